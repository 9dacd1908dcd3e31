package com.seshlog.common.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;

class SessionObservationDTOTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    @Test
    void completeObservationHasNoViolations() {
        assertThat(validator.validate(observation().build())).isEmpty();
    }

    @Test
    void tideAndTemperatureReadingsAreOptional() {
        SessionObservationDTO dto = observation()
                .airTemp(null)
                .waterTemp(null)
                .tideIncoming(null)
                .tideMaxHeight(null)
                .tideMinHeight(null)
                .tideMedianHeight(null)
                .build();

        assertThat(validator.validate(dto)).isEmpty();
    }

    @Test
    void reportsEveryMissingRequiredField() {
        Set<String> fields = violatedFields(new SessionObservationDTO());

        assertThat(fields).contains("spotName", "date", "timeIn", "timeOut", "rating", "username",
                "meanWaveDir", "meanWaveDirCardinal", "meanWaveHeight", "domPeriod",
                "meanWindDir", "meanWindDirCardinal", "meanWindSpeed", "gustSpeed");
        assertThat(fields).doesNotContain("airTemp", "waterTemp", "tideIncoming", "tideMaxHeight");
    }

    @Test
    void cardinalLongerThanFiveCharactersIsRejected() {
        SessionObservationDTO dto = observation().meanWindDirCardinal("NNWNNW").build();

        assertThat(violatedFields(dto)).containsExactly("meanWindDirCardinal");
    }

    @Test
    void blankSpotNameIsRejected() {
        assertThat(violatedFields(observation().spotName("  ").build())).containsExactly("spotName");
    }

    private Set<String> violatedFields(SessionObservationDTO dto) {
        return validator.validate(dto).stream()
                .map(ConstraintViolation::getPropertyPath)
                .map(Object::toString)
                .collect(Collectors.toSet());
    }

    private static SessionObservationDTO.SessionObservationDTOBuilder observation() {
        return SessionObservationDTO.builder()
                .spotName("Agate Beach")
                .date(LocalDate.of(2024, 1, 1))
                .timeIn(LocalTime.of(13, 0))
                .timeOut(LocalTime.of(13, 45))
                .rating(2)
                .username("roshindelman")
                .airTemp(12.5)
                .waterTemp(9.8)
                .meanWaveDir(270)
                .meanWaveDirCardinal("W")
                .meanWaveHeight(1.2)
                .domPeriod(9.5)
                .meanWindDir(358)
                .meanWindDirCardinal("NW")
                .meanWindSpeed(22.8)
                .gustSpeed(29.5);
    }
}
