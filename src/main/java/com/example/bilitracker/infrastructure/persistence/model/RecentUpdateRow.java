package com.example.bilitracker.infrastructure.persistence.model;

import lombok.Data;

@Data
public class RecentUpdateRow {

    private Long id;
    private Long monitorId;
    private String monitorName;
    private String videoId;
    private String videoTitle;
    private Long publishTime;
    private String cover;
}
