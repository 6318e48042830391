package com.example.bilitracker.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.tracker")
public class AppTrackerProperties {

    /**
     * Cron of the daily log maintenance job (rotation and retention).
     */
    private String maintenanceCron = "0 0 0 * * ?";

    private int schedulerPoolSize = 4;

    /**
     * Worker count for on-demand single collection checks.
     */
    private int checkThreadCount = 2;

    private int checkQueueSize = 20;

    /**
     * Directory holding the active log file and its rotated backups.
     */
    private String logDir = "log";

    /**
     * Active log file name inside {@link #logDir}. Backups use the same base name with a timestamp suffix.
     */
    private String logFileName = "bili-tracker.log";

    /**
     * Cover image cache shared with the image proxy. Evicted covers are removed from here.
     */
    private String imageCacheDir = "cache/images";

    private String displayTimePattern = "yyyy-MM-dd HH:mm:ss";
}
