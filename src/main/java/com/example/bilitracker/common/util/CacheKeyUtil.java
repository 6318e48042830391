package com.example.bilitracker.common.util;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class CacheKeyUtil {

    private static final String DEFAULT_EXTENSION = "jpg";

    private CacheKeyUtil() {
    }

    public static String md5Hex(String text) {
        try {
            MessageDigest messageDigest = MessageDigest.getInstance("MD5");
            byte[] bytes = messageDigest.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte b : bytes) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 algorithm not found", e);
        }
    }

    /**
     * File name the image proxy stores a cover under: md5 of the URL plus the path extension
     * ({@code jpg} when absent or implausibly long).
     */
    public static String coverFileName(String coverUrl) {
        return md5Hex(coverUrl) + "." + extensionOf(coverUrl);
    }

    static String extensionOf(String coverUrl) {
        String path;
        try {
            path = URI.create(coverUrl.trim()).getPath();
        } catch (IllegalArgumentException e) {
            return DEFAULT_EXTENSION;
        }
        if (path == null) {
            return DEFAULT_EXTENSION;
        }
        int dot = path.lastIndexOf('.');
        if (dot < 0 || dot == path.length() - 1) {
            return DEFAULT_EXTENSION;
        }
        String ext = path.substring(dot + 1);
        return ext.length() > 10 ? DEFAULT_EXTENSION : ext;
    }
}
