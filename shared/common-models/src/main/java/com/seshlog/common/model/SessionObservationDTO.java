package com.seshlog.common.model;

import java.time.LocalDate;
import java.time.LocalTime;

import com.fasterxml.jackson.annotation.JsonAlias;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One submitted surf session with the environmental readings captured for it.
 * Used by the REST API and as the input of the ingestion service.
 *
 * The JSON aliases accept the field names of the session form and of the NDBC
 * buoy columns (ATMP, WVHT, WDIR, ...).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SessionObservationDTO {

    public static final int MAX_CARDINAL_LENGTH = 5;
    public static final int MAX_NOTES_LENGTH = 500;

    @NotBlank(message = "Spot name is required")
    @JsonAlias("spot")
    private String spotName;

    @NotNull(message = "Session date is required")
    private LocalDate date;

    @NotNull(message = "Time in is required")
    private LocalTime timeIn;

    @NotNull(message = "Time out is required")
    private LocalTime timeOut;

    @NotNull(message = "Rating is required")
    private Integer rating;

    @NotBlank(message = "Username is required")
    @JsonAlias("user")
    private String username;

    @Size(max = MAX_NOTES_LENGTH, message = "Notes must be at most 500 characters")
    private String notes;

    // Temperature, degrees as reported by the station
    @JsonAlias("ATMP")
    private Double airTemp;

    @JsonAlias("WTMP")
    private Double waterTemp;

    // Swell
    @NotNull(message = "Mean wave direction is required")
    @JsonAlias("MWD")
    private Integer meanWaveDir;

    @NotBlank(message = "Mean wave direction cardinal is required")
    @Size(max = MAX_CARDINAL_LENGTH, message = "Mean wave direction cardinal must be at most 5 characters")
    @JsonAlias("MWD_CARD")
    private String meanWaveDirCardinal;

    @NotNull(message = "Mean wave height is required")
    @JsonAlias("WVHT")
    private Double meanWaveHeight;

    @NotNull(message = "Dominant period is required")
    @JsonAlias("DPD")
    private Double domPeriod;

    // Wind
    @NotNull(message = "Mean wind direction is required")
    @JsonAlias("WDIR")
    private Integer meanWindDir;

    @NotBlank(message = "Mean wind direction cardinal is required")
    @Size(max = MAX_CARDINAL_LENGTH, message = "Mean wind direction cardinal must be at most 5 characters")
    @JsonAlias("WDIR_CARD")
    private String meanWindDirCardinal;

    @NotNull(message = "Mean wind speed is required")
    @JsonAlias("WSPD")
    private Double meanWindSpeed;

    @NotNull(message = "Gust speed is required")
    @JsonAlias("GST")
    private Double gustSpeed;

    // Tide, every field may be null
    @JsonAlias("incoming")
    private Boolean tideIncoming;

    @JsonAlias("max_h")
    private Double tideMaxHeight;

    @JsonAlias("min_h")
    private Double tideMinHeight;

    @JsonAlias("median_h")
    private Double tideMedianHeight;
}
