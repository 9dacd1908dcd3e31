package com.seshlog.ingest.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.seshlog.common.model.SessionObservationDTO;
import com.seshlog.ingest.config.IngestProperties;
import com.seshlog.ingest.exception.StorageException;
import com.seshlog.ingest.exception.UnknownLocationException;
import com.seshlog.ingest.exception.UnknownUserException;
import com.seshlog.ingest.exception.ValidationException;
import com.seshlog.ingest.service.SessionIngestionService;

@WebMvcTest(SessionIngestController.class)
@EnableConfigurationProperties(IngestProperties.class)
class SessionIngestControllerTest {

    // Field names as the session form and the buoy averaging step produce them
    private static final String FORM_SUBMISSION = """
            {
              "spot": "Agate Beach",
              "date": "2024-01-01",
              "timeIn": "13:00",
              "timeOut": "13:45",
              "rating": 2,
              "ATMP": 12.5,
              "WTMP": 9.8,
              "MWD": 270,
              "MWD_CARD": "W",
              "WVHT": 1.2,
              "DPD": 9.5,
              "WDIR": 358,
              "WSPD": 22.8,
              "GST": 29.5,
              "incoming": null,
              "max_h": null,
              "min_h": null,
              "median_h": null
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private IngestProperties properties;

    @MockBean
    private SessionIngestionService ingestionService;

    @AfterEach
    void clearDefaultUsername() {
        properties.setDefaultUsername(null);
    }

    @Test
    void formSubmissionIsMappedAndAcknowledged() throws Exception {
        properties.setDefaultUsername("roshindelman");
        Mockito.when(ingestionService.ingest(Mockito.any())).thenReturn(17L);

        mockMvc.perform(post("/api/v1/sessions").contentType(MediaType.APPLICATION_JSON).content(FORM_SUBMISSION))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.sessionId").value(17))
                .andExpect(jsonPath("$.message").value("Session logged successfully"));

        SessionObservationDTO observation = capturedObservation();
        assertThat(observation.getSpotName()).isEqualTo("Agate Beach");
        assertThat(observation.getDate()).hasToString("2024-01-01");
        assertThat(observation.getTimeOut()).hasToString("13:45");
        assertThat(observation.getAirTemp()).isEqualTo(12.5);
        assertThat(observation.getMeanWaveDirCardinal()).isEqualTo("W");
        assertThat(observation.getGustSpeed()).isEqualTo(29.5);
        assertThat(observation.getTideIncoming()).isNull();
        assertThat(observation.getUsername()).isEqualTo("roshindelman");
    }

    @Test
    void missingWindCardinalIsDerivedFromDegrees() throws Exception {
        properties.setDefaultUsername("roshindelman");
        Mockito.when(ingestionService.ingest(Mockito.any())).thenReturn(1L);

        mockMvc.perform(post("/api/v1/sessions").contentType(MediaType.APPLICATION_JSON).content(FORM_SUBMISSION))
                .andExpect(status().isCreated());

        assertThat(capturedObservation().getMeanWindDirCardinal()).isEqualTo("NW");
    }

    @Test
    void submittedUsernameWinsOverDefault() throws Exception {
        properties.setDefaultUsername("guest");
        Mockito.when(ingestionService.ingest(Mockito.any())).thenReturn(1L);
        String body = FORM_SUBMISSION.replace("\"rating\": 2,", "\"rating\": 2, \"username\": \"jdoe\",");

        mockMvc.perform(post("/api/v1/sessions").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated());

        assertThat(capturedObservation().getUsername()).isEqualTo("jdoe");
    }

    @Test
    void withoutDefaultTheUsernameIsLeftForTheServiceToReject() throws Exception {
        Mockito.when(ingestionService.ingest(Mockito.any()))
                .thenThrow(new ValidationException(List.of("username: Username is required")));

        mockMvc.perform(post("/api/v1/sessions").contentType(MediaType.APPLICATION_JSON).content(FORM_SUBMISSION))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value("username: Username is required"));

        assertThat(capturedObservation().getUsername()).isNull();
    }

    @Test
    void unknownReferencesAreNotFound() throws Exception {
        properties.setDefaultUsername("roshindelman");
        Mockito.when(ingestionService.ingest(Mockito.any()))
                .thenThrow(new UnknownLocationException("Agate Beach"))
                .thenThrow(new UnknownUserException("roshindelman"));

        mockMvc.perform(post("/api/v1/sessions").contentType(MediaType.APPLICATION_JSON).content(FORM_SUBMISSION))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("UNKNOWN_LOCATION"));
        mockMvc.perform(post("/api/v1/sessions").contentType(MediaType.APPLICATION_JSON).content(FORM_SUBMISSION))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("UNKNOWN_USER"));
    }

    @Test
    void storageFailureIsServiceUnavailable() throws Exception {
        properties.setDefaultUsername("roshindelman");
        Mockito.when(ingestionService.ingest(Mockito.any()))
                .thenThrow(new StorageException("Failed to persist session: timeout", new RuntimeException("timeout")));

        mockMvc.perform(post("/api/v1/sessions").contentType(MediaType.APPLICATION_JSON).content(FORM_SUBMISSION))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("STORAGE_ERROR"));
    }

    @Test
    void malformedJsonIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/sessions").contentType(MediaType.APPLICATION_JSON).content("{\"spot\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed JSON"));

        Mockito.verifyNoInteractions(ingestionService);
    }

    private SessionObservationDTO capturedObservation() {
        ArgumentCaptor<SessionObservationDTO> captor = ArgumentCaptor.forClass(SessionObservationDTO.class);
        Mockito.verify(ingestionService).ingest(captor.capture());
        return captor.getValue();
    }
}
