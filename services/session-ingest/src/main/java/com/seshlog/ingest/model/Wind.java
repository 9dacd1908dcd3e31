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
@Table(name = "wind")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Wind {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "wind_id")
    private Long windId;

    @Column(name = "mean_wind_dir", nullable = false)
    private Integer meanWindDir;

    @Column(name = "mean_wind_dir_cardinal", length = 5, nullable = false)
    private String meanWindDirCardinal;

    @Column(name = "mean_wind_speed", nullable = false)
    private Double meanWindSpeed;

    @Column(name = "gust_speed", nullable = false)
    private Double gustSpeed;
}
