package com.apex.decision.service.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes each flushed context as one JSON object to the {@code decision.audit} logger.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "decision.audit.enabled", havingValue = "true", matchIfMissing = true)
public class JsonLogAuditSink implements AuditSink {

    private static final Logger AUDIT = LoggerFactory.getLogger("decision.audit");

    private final ObjectMapper objectMapper;
    private final Map<String, Object> context = new LinkedHashMap<>();

    public JsonLogAuditSink(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized void start(String name) {
        if (!context.isEmpty()) {
            log.debug("Audit context {} discarded unflushed", context.get("context"));
        }
        context.clear();
        context.put("context", name);
    }

    @Override
    public synchronized void append(String key, Object value) {
        context.put(key, value);
    }

    @Override
    public synchronized void flush() {
        if (context.isEmpty()) {
            return;
        }
        write(context);
        context.clear();
    }

    @Override
    public void note(String module, String message) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("context", "note");
        entry.put("module", module);
        entry.put("message", message);
        write(entry);
    }

    private void write(Map<String, Object> entry) {
        try {
            AUDIT.info(objectMapper.writeValueAsString(entry));
        } catch (JsonProcessingException e) {
            log.warn("Audit entry could not be serialized: {}", e.getOriginalMessage());
        }
    }
}
