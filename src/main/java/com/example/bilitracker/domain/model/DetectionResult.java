package com.example.bilitracker.domain.model;

import java.util.Collections;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of comparing one collection against the provider.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DetectionResult {

    public enum Outcome {
        /** Provider returned no usable info; nothing was written. */
        SKIPPED,
        /** Remote total did not grow; only the check timestamp was refreshed. */
        UNCHANGED,
        /** Remote total grew; records appended and the total rewritten. */
        UPDATED
    }

    private Outcome outcome;

    private Long monitorId;

    private String name;

    private String ownerId;

    private String remoteId;

    private String type;

    private int previousTotal;

    private int remoteTotal;

    /** Videos returned for the delta, newest first. Empty unless UPDATED. */
    private List<RemoteVideo> videos = Collections.emptyList();

    /** Records actually persisted; less than the delta when duplicates were rejected. */
    private int persistedCount;

    /** Publish time of the newest returned video, or the check time when none came back. */
    private long updateTime;

    public boolean hasUpdate() {
        return outcome == Outcome.UPDATED;
    }

    public int getDelta() {
        return Math.max(0, remoteTotal - previousTotal);
    }
}
