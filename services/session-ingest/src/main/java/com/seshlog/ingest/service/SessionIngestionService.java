package com.seshlog.ingest.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import com.seshlog.common.model.SessionObservationDTO;
import com.seshlog.ingest.exception.IngestionError;
import com.seshlog.ingest.exception.SessionIngestException;
import com.seshlog.ingest.exception.StorageException;
import com.seshlog.ingest.exception.UnknownLocationException;
import com.seshlog.ingest.exception.UnknownUserException;
import com.seshlog.ingest.exception.ValidationException;
import com.seshlog.ingest.model.Location;
import com.seshlog.ingest.model.LogUser;
import com.seshlog.ingest.model.SessionInfo;
import com.seshlog.ingest.model.Swell;
import com.seshlog.ingest.model.Temperature;
import com.seshlog.ingest.model.Tide;
import com.seshlog.ingest.model.Wind;
import com.seshlog.ingest.repository.LocationRepository;
import com.seshlog.ingest.repository.LogUserRepository;
import com.seshlog.ingest.repository.SessionInfoRepository;
import com.seshlog.ingest.repository.SwellRepository;
import com.seshlog.ingest.repository.TemperatureRepository;
import com.seshlog.ingest.repository.TideRepository;
import com.seshlog.ingest.repository.WindRepository;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Service for session ingestion.
 * Resolves the spot and the user, then writes the temperature, swell, tide and
 * wind rows and the session row linking them in a single transaction. Either all
 * five rows are committed or none is.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionIngestionService {

    private final LocationRepository locationRepository;
    private final LogUserRepository userRepository;
    private final TemperatureRepository temperatureRepository;
    private final SwellRepository swellRepository;
    private final TideRepository tideRepository;
    private final WindRepository windRepository;
    private final SessionInfoRepository sessionRepository;
    private final TransactionTemplate ingestTransactionTemplate;
    private final Validator validator;
    private final MeterRegistry meterRegistry;

    /**
     * Persists one observation.
     *
     * @return the generated session id
     * @throws ValidationException       if a required field is missing or malformed
     * @throws UnknownLocationException  if no location has the observation's spot name
     * @throws UnknownUserException      if no user has the observation's username
     * @throws StorageException          if persistence failed; nothing was written
     */
    public Long ingest(SessionObservationDTO observation) {
        try {
            validateObservation(observation);

            Long sessionId = ingestTransactionTemplate.execute(status -> persist(observation));

            log.info("Saved session: sessionId={}, spot={}, user={}, date={}",
                    sessionId, observation.getSpotName(), observation.getUsername(), observation.getDate());

            Counter.builder("seshlog.ingest.sessions.received")
                    .tag("spot", observation.getSpotName())
                    .register(meterRegistry)
                    .increment();

            return sessionId;

        } catch (SessionIngestException e) {
            log.warn("Rejected session observation: {} ({})", e.getMessage(), e.getError());
            countFailure(e.getError());
            throw e;
        } catch (DataAccessException | TransactionException e) {
            log.error("Storage failure while ingesting session for spot {}", spotOf(observation), e);
            countFailure(IngestionError.STORAGE_ERROR);
            throw new StorageException("Failed to persist session: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    private Long persist(SessionObservationDTO observation) {
        // Shared locks keep both rows from being deleted until this unit commits.
        // A miss throws and rolls back before any insert.
        Location location = locationRepository.findSharedBySpotName(observation.getSpotName())
                .orElseThrow(() -> new UnknownLocationException(observation.getSpotName()));
        LogUser user = userRepository.findSharedByUsername(observation.getUsername())
                .orElseThrow(() -> new UnknownUserException(observation.getUsername()));

        // Readings are per-session rows, always inserted fresh
        Temperature temperature = temperatureRepository.save(Temperature.builder()
                .airTemp(observation.getAirTemp())
                .waterTemp(observation.getWaterTemp())
                .build());
        log.debug("Saved temperature: tempId={}", temperature.getTempId());

        Swell swell = swellRepository.save(Swell.builder()
                .meanWaveDir(observation.getMeanWaveDir())
                .meanWaveDirCardinal(observation.getMeanWaveDirCardinal())
                .meanWaveHeight(observation.getMeanWaveHeight())
                .domPeriod(observation.getDomPeriod())
                .build());
        log.debug("Saved swell: swellId={}", swell.getSwellId());

        Tide tide = tideRepository.save(Tide.builder()
                .incoming(observation.getTideIncoming())
                .maximumHeight(observation.getTideMaxHeight())
                .minimumHeight(observation.getTideMinHeight())
                .medianHeight(observation.getTideMedianHeight())
                .build());
        log.debug("Saved tide: tideId={}", tide.getTideId());

        Wind wind = windRepository.save(Wind.builder()
                .meanWindDir(observation.getMeanWindDir())
                .meanWindDirCardinal(observation.getMeanWindDirCardinal())
                .meanWindSpeed(observation.getMeanWindSpeed())
                .gustSpeed(observation.getGustSpeed())
                .build());
        log.debug("Saved wind: windId={}", wind.getWindId());

        SessionInfo session = sessionRepository.save(SessionInfo.builder()
                .location(location)
                .temperature(temperature)
                .swell(swell)
                .tide(tide)
                .wind(wind)
                .user(user)
                .sessionDate(observation.getDate())
                .sessionTimeIn(observation.getTimeIn())
                .sessionTimeOut(observation.getTimeOut())
                .sessionNotes(observation.getNotes())
                .rating(observation.getRating())
                .build());

        return session.getSessionId();
    }

    private void validateObservation(SessionObservationDTO observation) {
        if (observation == null) {
            throw new ValidationException(List.of("Observation is required"));
        }

        List<String> errors = new ArrayList<>();

        validator.validate(observation).stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .map(this::describe)
                .forEach(errors::add);

        // Averaged buoy readings come back as NaN when the station reported nothing
        checkFinite("airTemp", observation.getAirTemp(), errors);
        checkFinite("waterTemp", observation.getWaterTemp(), errors);
        checkFinite("meanWaveHeight", observation.getMeanWaveHeight(), errors);
        checkFinite("domPeriod", observation.getDomPeriod(), errors);
        checkFinite("meanWindSpeed", observation.getMeanWindSpeed(), errors);
        checkFinite("gustSpeed", observation.getGustSpeed(), errors);
        checkFinite("tideMaxHeight", observation.getTideMaxHeight(), errors);
        checkFinite("tideMinHeight", observation.getTideMinHeight(), errors);
        checkFinite("tideMedianHeight", observation.getTideMedianHeight(), errors);

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    private void checkFinite(String field, Double value, List<String> errors) {
        if (value != null && !Double.isFinite(value)) {
            errors.add(field + ": must be a finite number");
        }
    }

    private String describe(ConstraintViolation<SessionObservationDTO> violation) {
        return violation.getPropertyPath() + ": " + violation.getMessage();
    }

    private void countFailure(IngestionError error) {
        Counter.builder("seshlog.ingest.sessions.failed")
                .tag("error", error.name())
                .register(meterRegistry)
                .increment();
    }

    private static String spotOf(SessionObservationDTO observation) {
        return observation != null ? observation.getSpotName() : null;
    }
}
