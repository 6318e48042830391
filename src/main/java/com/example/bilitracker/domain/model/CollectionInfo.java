package com.example.bilitracker.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Collection metadata normalized from either remote payload shape.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CollectionInfo {

    private String name;

    private String description;

    private int total;

    private String cover;

    /** Epoch seconds, 0 when unknown. */
    private long lastUpdate;
}
