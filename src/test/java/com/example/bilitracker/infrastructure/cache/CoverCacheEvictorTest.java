package com.example.bilitracker.infrastructure.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.bilitracker.common.config.AppTrackerProperties;
import com.example.bilitracker.common.util.CacheKeyUtil;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CoverCacheEvictorTest {

    @TempDir
    Path cacheDir;

    @Test
    void evictShouldDeleteCachedCoversAndIgnoreMissingOnes() throws Exception {
        AppTrackerProperties properties = new AppTrackerProperties();
        properties.setImageCacheDir(cacheDir.toString());
        CoverCacheEvictor evictor = new CoverCacheEvictor(properties);

        String cached = "https://i0.hdslb.com/bfs/archive/a.png";
        String kept = "https://i0.hdslb.com/bfs/archive/b.jpg";
        Path cachedFile = Files.createFile(cacheDir.resolve(CacheKeyUtil.coverFileName(cached)));
        Path keptFile = Files.createFile(cacheDir.resolve(CacheKeyUtil.coverFileName(kept)));

        int deleted = evictor.evict(Arrays.asList(cached, "https://i0.hdslb.com/missing.jpg", "", null));

        assertEquals(1, deleted);
        assertFalse(Files.exists(cachedFile));
        assertTrue(Files.exists(keptFile));
        assertEquals(0, evictor.evict(Collections.emptyList()));
    }
}
