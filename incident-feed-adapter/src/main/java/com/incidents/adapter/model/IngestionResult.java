package com.incidents.adapter.model;

/**
 * Result object for ingestion batches.
 * Rejected observations (no usable id) are counted, not fatal.
 */
public class IngestionResult {

    private final boolean success;
    private final String source;
    private final int accepted;
    private final int rejected;
    private final int closedInBatch;
    private final String message;
    private final String errorType;

    private IngestionResult(boolean success, String source, int accepted, int rejected, int closedInBatch,
                            String message, String errorType) {
        this.success = success;
        this.source = source;
        this.accepted = accepted;
        this.rejected = rejected;
        this.closedInBatch = closedInBatch;
        this.message = message;
        this.errorType = errorType;
    }

    public static IngestionResult success(String source, int accepted, int rejected, int closedInBatch) {
        String message = "Ingested " + accepted + " observations";
        if (rejected > 0) {
            return new IngestionResult(true, source, accepted, rejected, closedInBatch,
                    message + ", rejected " + rejected, "PARTIAL_SUCCESS");
        }
        return new IngestionResult(true, source, accepted, 0, closedInBatch, message, null);
    }

    public static IngestionResult empty(String source) {
        return new IngestionResult(false, source, 0, 0, 0, "No observations in request", "EMPTY_BATCH");
    }

    public boolean isSuccess() {
        return success;
    }

    public String getSource() {
        return source;
    }

    public int getAccepted() {
        return accepted;
    }

    public int getRejected() {
        return rejected;
    }

    public int getClosedInBatch() {
        return closedInBatch;
    }

    public String getMessage() {
        return message;
    }

    public String getErrorType() {
        return errorType;
    }
}
