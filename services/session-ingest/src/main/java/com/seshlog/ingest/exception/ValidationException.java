package com.seshlog.ingest.exception;

import java.util.List;

/**
 * The observation is missing a required field or carries a malformed value.
 */
public class ValidationException extends SessionIngestException {

    private final List<String> violations;

    public ValidationException(List<String> violations) {
        super(IngestionError.VALIDATION_ERROR, String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
