package com.seshlog.ingest.exception;

public class UnknownUserException extends SessionIngestException {

    private final String username;

    public UnknownUserException(String username) {
        super(IngestionError.UNKNOWN_USER, "Unknown user: " + username);
        this.username = username;
    }

    public String getUsername() {
        return username;
    }
}
