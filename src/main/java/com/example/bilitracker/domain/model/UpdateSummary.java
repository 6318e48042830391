package com.example.bilitracker.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One collection's section of a notification mail.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateSummary {

    private String name;

    private int delta;

    private int remoteTotal;

    /** Epoch seconds. */
    private long updateTime;

    private String videosHtml;

    private String ownerId;

    private String remoteId;

    private String type;
}
