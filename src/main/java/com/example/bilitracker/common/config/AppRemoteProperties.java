package com.example.bilitracker.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.remote")
public class AppRemoteProperties {

    private String apiBaseUrl = "https://api.bilibili.com";

    /**
     * Owner page base. Also used as Origin and, suffixed with the owner id, as Referer.
     */
    private String spaceBaseUrl = "https://space.bilibili.com";

    private String videoBaseUrl = "https://www.bilibili.com/video";

    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private int maxAttempts = 3;

    /**
     * Backoff before retry n (0-based) is {@code backoffBaseSeconds * 2^n}.
     */
    private int backoffBaseSeconds = 1;

    private int infoTimeoutMs = 10000;

    private int bulkTimeoutMs = 15000;
}
