package com.eainde.literature.model;

/**
 * Persisted status of one stage for one document.
 *
 * <p>Storage encoding: {@link Unset} is SQL NULL, {@link Completed} is the literal
 * {@code completed}, {@link DesyncDetected} is text prefixed with
 * {@value #DESYNC_PREFIX}, and any other text is a {@link Failed} message.</p>
 */
public sealed interface StageStatus
        permits StageStatus.Unset, StageStatus.Completed, StageStatus.Failed, StageStatus.DesyncDetected {

    String COMPLETED = "completed";
    String DESYNC_PREFIX = "Desync detected: ";

    /** Value written to the status column, null for {@link Unset}. */
    String toColumnValue();

    default boolean isCompleted() {
        return this instanceof Completed;
    }

    static StageStatus unset() {
        return Unset.INSTANCE;
    }

    static StageStatus completed() {
        return Completed.INSTANCE;
    }

    static StageStatus failed(String message) {
        return new Failed(message);
    }

    static StageStatus desync(String message) {
        return new DesyncDetected(message);
    }

    static StageStatus fromColumnValue(String value) {
        if (value == null) return Unset.INSTANCE;
        if (COMPLETED.equals(value)) return Completed.INSTANCE;
        if (value.startsWith(DESYNC_PREFIX)) return new DesyncDetected(value.substring(DESYNC_PREFIX.length()));
        return new Failed(value);
    }

    final class Unset implements StageStatus {
        static final Unset INSTANCE = new Unset();

        private Unset() {
        }

        @Override
        public String toColumnValue() {
            return null;
        }

        @Override
        public String toString() {
            return "Unset";
        }
    }

    final class Completed implements StageStatus {
        static final Completed INSTANCE = new Completed();

        private Completed() {
        }

        @Override
        public String toColumnValue() {
            return COMPLETED;
        }

        @Override
        public String toString() {
            return "Completed";
        }
    }

    record Failed(String message) implements StageStatus {
        public Failed {
            if (message == null || message.isBlank()) {
                message = "unknown error";
            }
        }

        @Override
        public String toColumnValue() {
            return message;
        }
    }

    record DesyncDetected(String message) implements StageStatus {
        @Override
        public String toColumnValue() {
            return DESYNC_PREFIX + message;
        }
    }
}
