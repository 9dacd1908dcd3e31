package com.seshlog.ingest.exception;

/**
 * Persistence failed (connection loss, constraint violation, timeout). The unit
 * of work has been rolled back when this is thrown.
 */
public class StorageException extends SessionIngestException {

    public StorageException(String message, Throwable cause) {
        super(IngestionError.STORAGE_ERROR, message, cause);
    }
}
