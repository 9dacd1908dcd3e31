package com.seshlog.ingest.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.stereotype.Repository;

import com.seshlog.ingest.model.Location;

import jakarta.persistence.LockModeType;

@Repository
public interface LocationRepository extends JpaRepository<Location, Long> {

    Optional<Location> findBySpotName(String spotName);

    /**
     * Shared row lock held by a session ingest until it commits, so the location
     * cannot be deleted underneath it.
     */
    @Lock(LockModeType.PESSIMISTIC_READ)
    Optional<Location> findSharedBySpotName(String spotName);

    /**
     * Exclusive row lock taken before deleting the location. Waits for in-flight
     * ingests that hold the shared lock.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<Location> findForUpdateBySpotName(String spotName);
}
