package com.seshlog.ingest.exception;

public class UnknownLocationException extends SessionIngestException {

    private final String spotName;

    public UnknownLocationException(String spotName) {
        super(IngestionError.UNKNOWN_LOCATION, "Unknown location: " + spotName);
        this.spotName = spotName;
    }

    public String getSpotName() {
        return spotName;
    }
}
