package com.example.bilitracker.domain;

import java.util.Locale;

/**
 * The two remote collection taxonomies. The code is what the provider and the database use.
 */
public enum MonitorType {

    /** A user-curated series ("系列"). */
    SERIES("series"),

    /** A season ("合集"). */
    SEASON("season");

    private final String code;

    MonitorType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * @return the matching type, or null for null/unknown codes
     */
    public static MonitorType fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (MonitorType type : values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
