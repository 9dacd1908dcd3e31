package com.seshlog.ingest.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JPA Entity for the tide table. Tide readings are optional, so a session may
 * own a row where every reading is null.
 */
@Entity
@Table(name = "tide")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Tide {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "tide_id")
    private Long tideId;

    // true = incoming, false = outgoing
    @Column(name = "incoming")
    private Boolean incoming;

    @Column(name = "maximum_height")
    private Double maximumHeight;

    @Column(name = "minimum_height")
    private Double minimumHeight;

    @Column(name = "median_height")
    private Double medianHeight;
}
