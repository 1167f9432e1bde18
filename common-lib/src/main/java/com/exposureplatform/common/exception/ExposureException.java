package com.exposureplatform.common.exception;

/**
 * Raised when exposure state cannot be read, written or scheduled.
 *
 * <p>The {@link Store} tells the REST layer which part of the state is affected. A failure
 * in {@link Store#STATUS} means the exposure status shown to the user may be stale; a
 * failure in {@link Store#SUMMARIES} only affects history and uploads.
 */
public class ExposureException extends RuntimeException {

    public enum Store {
        /** The single exposure status row. */
        STATUS("status-store"),
        /** Check-cycle summaries, countries of interest and bookkeeping values. */
        SUMMARIES("summary-store"),
        /** The serialized queue that orders status changes. */
        TASK_QUEUE("task-queue");

        private final String label;

        Store(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final Store store;

    public ExposureException(Store store, String message) {
        super("[" + store.label() + "] " + message);
        this.store = store;
    }

    public ExposureException(Store store, String message, Throwable cause) {
        super("[" + store.label() + "] " + message, cause);
        this.store = store;
    }

    public Store getStore() {
        return store;
    }

    /** True if the user-visible exposure status may not reflect the last change. */
    public boolean affectsStatus() {
        return store == Store.STATUS;
    }
}
