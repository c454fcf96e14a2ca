package com.apex.decision.config;

import com.apex.decision.model.InstrumentConfig;
import com.apex.decision.service.decision.DecisionEngine;
import com.apex.decision.service.execution.ExecutionPort;
import com.apex.decision.service.execution.RiskAuthority;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationFailedEvent;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Attaches the execution and risk collaborators and registers the configured instruments
 * once the application is ready; detaches them on shutdown.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EngineBootstrap {

    private final DecisionEngine engine;
    private final DecisionEngineProperties properties;
    private final ObjectProvider<ExecutionPort> executionPort;
    private final ObjectProvider<RiskAuthority> riskAuthority;

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        engine.initialize(executionPort.getIfAvailable(), riskAuthority.getIfAvailable());
        int registered = 0;
        for (DecisionEngineProperties.Instrument instrument : properties.getInstruments()) {
            InstrumentConfig config = instrument.toConfig(properties.getDefaults());
            if (engine.addSymbol(config)) {
                registered++;
            }
        }
        log.info("Decision engine ready with {}/{} configured instruments", registered, properties.getInstruments().size());
    }

    @EventListener(ContextClosedEvent.class)
    public void stop() {
        engine.deinitialize();
    }

    @Component
    @Slf4j
    public static class StartupFailureListener implements ApplicationListener<ApplicationFailedEvent> {

        @Override
        public void onApplicationEvent(ApplicationFailedEvent event) {
            Throwable exception = event.getException();
            Throwable root = exception;
            while (root.getCause() != null) {
                root = root.getCause();
            }
            log.error("FATAL Startup failure. Root cause: {}", root.getMessage(), exception);
        }
    }
}
