package com.seshlog.ingest.service;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.seshlog.ingest.exception.UnknownLocationException;
import com.seshlog.ingest.exception.UnknownUserException;
import com.seshlog.ingest.model.Location;
import com.seshlog.ingest.model.LogUser;
import com.seshlog.ingest.repository.LocationRepository;
import com.seshlog.ingest.repository.LogUserRepository;
import com.seshlog.ingest.repository.SessionInfoRepository;
import com.seshlog.ingest.repository.SessionReadingIds;
import com.seshlog.ingest.repository.SwellRepository;
import com.seshlog.ingest.repository.TemperatureRepository;
import com.seshlog.ingest.repository.TideRepository;
import com.seshlog.ingest.repository.WindRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Removal of locations and users. Deleting either one deletes every session that
 * references it, together with the temperature, swell, tide and wind rows those
 * sessions own.
 *
 * <p>The parent row is locked for update before its sessions are listed. Ingests
 * hold a shared lock on the same row until they commit, so the listing sees every
 * session that will ever reference the parent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReferenceDataService {

    private final LocationRepository locationRepository;
    private final LogUserRepository userRepository;
    private final SessionInfoRepository sessionRepository;
    private final TemperatureRepository temperatureRepository;
    private final SwellRepository swellRepository;
    private final TideRepository tideRepository;
    private final WindRepository windRepository;

    /**
     * @return the number of sessions removed along with the location
     */
    @Transactional
    public int deleteLocation(String spotName) {
        Location location = locationRepository.findForUpdateBySpotName(spotName)
                .orElseThrow(() -> new UnknownLocationException(spotName));

        log.info("Deleting location {} and all associated sessions", spotName);

        int removed = deleteSessions(sessionRepository.findReadingIdsByLocation(location));
        locationRepository.delete(location);

        log.info("Deleted location {}: {} sessions removed", spotName, removed);
        return removed;
    }

    /**
     * @return the number of sessions removed along with the user
     */
    @Transactional
    public int deleteUser(String username) {
        LogUser user = userRepository.findForUpdateByUsername(username)
                .orElseThrow(() -> new UnknownUserException(username));

        log.info("Deleting user {} and all associated sessions", username);

        int removed = deleteSessions(sessionRepository.findReadingIdsByUser(user));
        userRepository.delete(user);

        log.info("Deleted user {}: {} sessions removed", username, removed);
        return removed;
    }

    private int deleteSessions(List<SessionReadingIds> sessions) {
        if (sessions.isEmpty()) {
            return 0;
        }

        // Sessions first: they hold the foreign keys to the reading rows
        int removed = sessionRepository.deleteByIds(ids(sessions, SessionReadingIds::getSessionId));
        temperatureRepository.deleteByIds(ids(sessions, SessionReadingIds::getTempId));
        swellRepository.deleteByIds(ids(sessions, SessionReadingIds::getSwellId));
        tideRepository.deleteByIds(ids(sessions, SessionReadingIds::getTideId));
        windRepository.deleteByIds(ids(sessions, SessionReadingIds::getWindId));

        log.debug("Removed {} sessions and their reading rows", removed);
        return removed;
    }

    private static List<Long> ids(List<SessionReadingIds> sessions,
            Function<SessionReadingIds, Long> id) {
        return sessions.stream().map(id).collect(Collectors.toList());
    }
}
