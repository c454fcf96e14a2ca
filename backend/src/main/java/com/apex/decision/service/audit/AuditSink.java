package com.apex.decision.service.audit;

/**
 * Structured audit trail: key/value contexts with an explicit start, append, flush
 * lifecycle, plus free-text notes.
 */
public interface AuditSink {

    void start(String context);

    void append(String key, Object value);

    void flush();

    void note(String module, String message);

    static AuditSink noop() {
        return NoopAuditSink.INSTANCE;
    }

    final class NoopAuditSink implements AuditSink {

        private static final NoopAuditSink INSTANCE = new NoopAuditSink();

        private NoopAuditSink() {
        }

        @Override
        public void start(String context) {
        }

        @Override
        public void append(String key, Object value) {
        }

        @Override
        public void flush() {
        }

        @Override
        public void note(String module, String message) {
        }
    }
}
