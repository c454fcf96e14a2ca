package com.apex.decision.scheduler;

import com.apex.decision.service.decision.DecisionEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "decision.timer.enabled", havingValue = "true", matchIfMissing = true)
public class EngineTimerScheduler {

    private final DecisionEngine engine;

    @Scheduled(fixedDelayString = "${decision.timer.interval-ms:1000}")
    public void onTimer() {
        try {
            engine.onTimer();
        } catch (RuntimeException e) {
            log.error("Timer event failed: {}", e.getMessage(), e);
        }
    }
}
