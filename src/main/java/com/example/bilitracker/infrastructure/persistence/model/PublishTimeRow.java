package com.example.bilitracker.infrastructure.persistence.model;

import lombok.Data;

@Data
public class PublishTimeRow {

    private Long monitorId;
    private Long publishTime;
}
