package com.seshlog.ingest.repository;

import java.util.Collection;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.seshlog.ingest.model.Location;
import com.seshlog.ingest.model.LogUser;
import com.seshlog.ingest.model.SessionInfo;

@Repository
public interface SessionInfoRepository extends JpaRepository<SessionInfo, Long> {

    @Query("""
            SELECT new com.seshlog.ingest.repository.SessionReadingIds(
                s.sessionId, s.temperature.tempId, s.swell.swellId, s.tide.tideId, s.wind.windId)
            FROM SessionInfo s WHERE s.location = :location
            """)
    List<SessionReadingIds> findReadingIdsByLocation(@Param("location") Location location);

    @Query("""
            SELECT new com.seshlog.ingest.repository.SessionReadingIds(
                s.sessionId, s.temperature.tempId, s.swell.swellId, s.tide.tideId, s.wind.windId)
            FROM SessionInfo s WHERE s.user = :user
            """)
    List<SessionReadingIds> findReadingIdsByUser(@Param("user") LogUser user);

    @Modifying
    @Query("DELETE FROM SessionInfo s WHERE s.sessionId IN :ids")
    int deleteByIds(@Param("ids") Collection<Long> ids);

    /**
     * Sessions whose reading rows are not all present. Always zero while the
     * foreign keys hold.
     */
    @Query("""
            SELECT COUNT(s) FROM SessionInfo s
            WHERE NOT EXISTS (SELECT t FROM Temperature t WHERE t.tempId = s.temperature.tempId)
               OR NOT EXISTS (SELECT w FROM Swell w WHERE w.swellId = s.swell.swellId)
               OR NOT EXISTS (SELECT d FROM Tide d WHERE d.tideId = s.tide.tideId)
               OR NOT EXISTS (SELECT n FROM Wind n WHERE n.windId = s.wind.windId)
            """)
    long countWithMissingReadings();
}
