package com.example.bilitracker.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerStatusResponse {

    /** STOPPED, ARMED or RUNNING. */
    private String state;
    private boolean monitorActive;
    private String nextCheckTime;
    private int monitorCount;
    private int activeMonitorCount;
}
