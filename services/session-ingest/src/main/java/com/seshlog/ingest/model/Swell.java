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

@Entity
@Table(name = "swell")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Swell {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "swell_id")
    private Long swellId;

    @Column(name = "mean_wave_dir", nullable = false)
    private Integer meanWaveDir;

    @Column(name = "mean_wave_dir_cardinal", length = 5, nullable = false)
    private String meanWaveDirCardinal;

    @Column(name = "dom_period", nullable = false)
    private Double domPeriod;

    @Column(name = "mean_wave_height", nullable = false)
    private Double meanWaveHeight;
}
