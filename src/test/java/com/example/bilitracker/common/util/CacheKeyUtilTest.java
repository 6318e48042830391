package com.example.bilitracker.common.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class CacheKeyUtilTest {

    @Test
    void coverFileNameShouldKeepPathExtension() {
        String url = "https://i0.hdslb.com/bfs/archive/cover.png";

        assertEquals(CacheKeyUtil.md5Hex(url) + ".png", CacheKeyUtil.coverFileName(url));
    }

    @Test
    void extensionShouldFallBackToJpg() {
        assertEquals("jpg", CacheKeyUtil.extensionOf("https://i0.hdslb.com/bfs/archive/cover"));
        assertEquals("jpg", CacheKeyUtil.extensionOf("https://i0.hdslb.com/bfs/archive/cover."));
        assertEquals("jpg", CacheKeyUtil.extensionOf("https://i0.hdslb.com/a.averyveryverylongext"));
        assertEquals("jpg", CacheKeyUtil.extensionOf("not a uri with spaces"));
        assertEquals("webp", CacheKeyUtil.extensionOf("https://i0.hdslb.com/a.webp?x=1"));
    }

    @Test
    void md5HexShouldMatchKnownDigest() {
        assertEquals("5d41402abc4b2a76b9719d911017c592", CacheKeyUtil.md5Hex("hello"));
    }
}
