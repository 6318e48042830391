package com.example.bilitracker.domain.model;

import com.example.bilitracker.domain.MonitorType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What a collection URL points at.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CollectionReference {

    private String ownerId;

    private String remoteId;

    private MonitorType type;
}
