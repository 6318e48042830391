package com.example.bilitracker.infrastructure.persistence.entity;

import lombok.Data;

@Data
public class VideoUpdateEntity {

    private Long id;

    private Long monitorId;

    private String videoId;

    private String videoTitle;

    /** Epoch seconds. */
    private Long publishTime;

    private String cover;
}
