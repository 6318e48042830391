package com.example.bilitracker.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecentUpdateResponse {

    private Long id;
    private Long monitorId;
    private String monitorName;
    private String videoId;
    private String title;
    private Long publishTime;
    private String cover;
}
