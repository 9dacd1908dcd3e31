package com.seshlog.ingest.model;

import java.time.LocalDate;
import java.time.LocalTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * JPA Entity for the session_info table.
 * Intersection row linking a location and a user with the four reading rows
 * created for this session. The reading rows belong to the session and are
 * deleted with it by {@code ReferenceDataService}.
 */
@Entity
@Table(name = "session_info")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(onlyExplicitlyIncluded = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class SessionInfo {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "session_id")
    @ToString.Include
    @EqualsAndHashCode.Include
    private Long sessionId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "loc_id", nullable = false)
    private Location location;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "temp_id", nullable = false, unique = true)
    private Temperature temperature;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "swell_id", nullable = false, unique = true)
    private Swell swell;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "tide_id", nullable = false, unique = true)
    private Tide tide;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "wind_id", nullable = false, unique = true)
    private Wind wind;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private LogUser user;

    @ToString.Include
    @Column(name = "session_date", nullable = false)
    private LocalDate sessionDate;

    @ToString.Include
    @Column(name = "session_time_in", nullable = false)
    private LocalTime sessionTimeIn;

    @ToString.Include
    @Column(name = "session_time_out", nullable = false)
    private LocalTime sessionTimeOut;

    @Column(name = "session_notes", length = 500)
    private String sessionNotes;

    @ToString.Include
    @Column(name = "rating", nullable = false)
    private Integer rating;
}
