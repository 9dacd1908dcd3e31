package com.seshlog.ingest.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.seshlog.common.model.CompassDirection;
import com.seshlog.common.model.SessionObservationDTO;
import com.seshlog.ingest.config.IngestProperties;
import com.seshlog.ingest.exception.IngestionError;
import com.seshlog.ingest.exception.SessionIngestException;
import com.seshlog.ingest.service.SessionIngestionService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for session form submission.
 * Owns the submission policies the ingestion service leaves to its callers:
 * the default username and cardinals derived from degree readings.
 */
@RestController
@RequestMapping("/api/v1/sessions")
@RequiredArgsConstructor
@Slf4j
public class SessionIngestController {

    private final SessionIngestionService sessionIngestionService;
    private final IngestProperties properties;

    @PostMapping
    public ResponseEntity<SessionResponse> submitSession(@RequestBody SessionObservationDTO submission) {
        log.info("Received session submission: spot={}, date={}, timeIn={}, timeOut={}",
                submission.getSpotName(), submission.getDate(), submission.getTimeIn(), submission.getTimeOut());

        SessionObservationDTO observation = applySubmissionDefaults(submission);
        Long sessionId = sessionIngestionService.ingest(observation);

        return ResponseEntity.status(HttpStatus.CREATED).body(SessionResponse.builder()
                .sessionId(sessionId)
                .message("Session logged successfully")
                .timestamp(System.currentTimeMillis())
                .build());
    }

    @ExceptionHandler(SessionIngestException.class)
    public ResponseEntity<SessionResponse> handleIngestFailure(SessionIngestException ex) {
        HttpStatus status = statusFor(ex.getError());
        if (status.is5xxServerError()) {
            log.error("Session submission failed: {}", ex.getMessage());
        } else {
            log.warn("Session submission rejected: {}", ex.getMessage());
        }

        return ResponseEntity.status(status).body(SessionResponse.builder()
                .error(ex.getError().name())
                .message(ex.getMessage())
                .timestamp(System.currentTimeMillis())
                .build());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<SessionResponse> handleUnreadableJson(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest().body(SessionResponse.builder()
                .error(IngestionError.VALIDATION_ERROR.name())
                .message("Malformed JSON")
                .timestamp(System.currentTimeMillis())
                .build());
    }

    private SessionObservationDTO applySubmissionDefaults(SessionObservationDTO submission) {
        SessionObservationDTO.SessionObservationDTOBuilder observation = submission.toBuilder();

        if (isBlank(submission.getUsername()) && properties.getDefaultUsername() != null) {
            log.debug("No username submitted, using default {}", properties.getDefaultUsername());
            observation.username(properties.getDefaultUsername());
        }
        if (isBlank(submission.getMeanWaveDirCardinal()) && submission.getMeanWaveDir() != null) {
            observation.meanWaveDirCardinal(CompassDirection.fromDegrees(submission.getMeanWaveDir()).name());
        }
        if (isBlank(submission.getMeanWindDirCardinal()) && submission.getMeanWindDir() != null) {
            observation.meanWindDirCardinal(CompassDirection.fromDegrees(submission.getMeanWindDir()).name());
        }

        return observation.build();
    }

    private static HttpStatus statusFor(IngestionError error) {
        switch (error) {
            case VALIDATION_ERROR:
                return HttpStatus.BAD_REQUEST;
            case UNKNOWN_LOCATION:
            case UNKNOWN_USER:
                return HttpStatus.NOT_FOUND;
            default:
                return HttpStatus.SERVICE_UNAVAILABLE;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @lombok.Data
    @lombok.Builder
    public static class SessionResponse {
        private Long sessionId;
        private String error;
        private String message;
        private Long timestamp;
    }
}
