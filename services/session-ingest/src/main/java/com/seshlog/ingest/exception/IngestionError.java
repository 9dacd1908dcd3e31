package com.seshlog.ingest.exception;

/**
 * Failure codes reported by session ingestion. All of them end the current call.
 */
public enum IngestionError {
    VALIDATION_ERROR,
    UNKNOWN_LOCATION,
    UNKNOWN_USER,
    STORAGE_ERROR
}
