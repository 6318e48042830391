package com.example.bilitracker.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateStats {

    /** Mean gap between consecutive publishes in days, 2 decimals; null with fewer than 2 records. */
    private Double averageIntervalDays;

    /** Predicted next publish (epoch seconds); null with fewer than 2 records. */
    private Long nextUpdatePrediction;

    private int totalVideos;

    private Long lastUpdateTime;

    private int intervalsCount;
}
