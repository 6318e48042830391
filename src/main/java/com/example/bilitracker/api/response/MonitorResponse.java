package com.example.bilitracker.api.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MonitorResponse {

    private Long id;
    private String mid;
    private String remoteId;
    private String type;
    private String name;
    private String cover;
    private String description;
    private Integer totalCount;
    private Long lastCheckTs;
    private boolean active;
    private boolean archived;
    private LocalDateTime createdAt;
}
