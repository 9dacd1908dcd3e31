package com.seshlog.ingest.exception;

/**
 * Base class of every failure surfaced by the ingestion service. Callers decide
 * on retries and on what to show the user.
 */
public abstract class SessionIngestException extends RuntimeException {

    private final IngestionError error;

    protected SessionIngestException(IngestionError error, String message) {
        super(message);
        this.error = error;
    }

    protected SessionIngestException(IngestionError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public IngestionError getError() {
        return error;
    }
}
