package com.seshlog.ingest.repository;

import lombok.Value;

/**
 * Ids of a session row and the four reading rows it owns.
 */
@Value
public class SessionReadingIds {
    Long sessionId;
    Long tempId;
    Long swellId;
    Long tideId;
    Long windId;
}
