package com.example.bilitracker.infrastructure.cache;

import com.example.bilitracker.common.config.AppTrackerProperties;
import com.example.bilitracker.common.util.CacheKeyUtil;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Removes cached cover images of purged update records. Missing files are not an error.
 */
@Component
public class CoverCacheEvictor {

    private static final Logger log = LoggerFactory.getLogger(CoverCacheEvictor.class);

    private final AppTrackerProperties appTrackerProperties;

    public CoverCacheEvictor(AppTrackerProperties appTrackerProperties) {
        this.appTrackerProperties = appTrackerProperties;
    }

    /**
     * @return number of files actually deleted
     */
    public int evict(Collection<String> coverUrls) {
        if (coverUrls == null || coverUrls.isEmpty()) {
            return 0;
        }
        Path cacheDir = Paths.get(appTrackerProperties.getImageCacheDir());
        int deleted = 0;
        for (String coverUrl : coverUrls) {
            if (!StringUtils.hasText(coverUrl)) {
                continue;
            }
            Path file = cacheDir.resolve(CacheKeyUtil.coverFileName(coverUrl));
            try {
                if (Files.deleteIfExists(file)) {
                    deleted++;
                    log.debug("COVER_CACHE_EVICTED file={}", file);
                }
            } catch (IOException e) {
                log.warn("COVER_CACHE_EVICT_FAILED file={} reason={}", file, e.getMessage());
            }
        }
        return deleted;
    }
}
