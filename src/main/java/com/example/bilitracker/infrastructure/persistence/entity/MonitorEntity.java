package com.example.bilitracker.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class MonitorEntity {

    private Long id;

    /** Remote owner id, also used for the Referer header. */
    private String mid;

    private String remoteId;

    /** {@code series} or {@code season}. */
    private String type;

    private String name;

    private String cover;

    private String description;

    private Integer totalCount;

    /** Epoch seconds of the last successful check. */
    private Long lastCheckTs;

    private Integer isActive;

    private Integer archived;

    private LocalDateTime createdAt;
}
