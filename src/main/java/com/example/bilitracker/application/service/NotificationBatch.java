package com.example.bilitracker.application.service;

import com.example.bilitracker.domain.model.DetectionResult;
import com.example.bilitracker.domain.model.MonitorSettings;
import com.example.bilitracker.domain.model.UpdateSummary;
import java.util.ArrayList;
import java.util.List;

/**
 * Notification scope of one pass. In immediate mode every update is mailed on {@link #add};
 * in batch mode updates are collected and mailed together on {@link #flush}.
 * Not thread-safe, one instance per pass.
 */
public class NotificationBatch {

    private final UpdateNotificationService notificationService;
    private final MonitorSettings settings;
    private final List<UpdateSummary> summaries = new ArrayList<>();

    NotificationBatch(UpdateNotificationService notificationService, MonitorSettings settings) {
        this.notificationService = notificationService;
        this.settings = settings;
    }

    public void add(DetectionResult result) {
        if (result == null || !result.hasUpdate()) {
            return;
        }
        if (settings.isBatchSend()) {
            summaries.add(notificationService.summarize(result));
        } else {
            notificationService.notifyImmediately(settings, result);
        }
    }

    /**
     * Sends the aggregate mail when at least one update was collected.
     *
     * @return whether a mail went out
     */
    public boolean flush() {
        if (summaries.isEmpty()) {
            return false;
        }
        List<UpdateSummary> pending = new ArrayList<>(summaries);
        summaries.clear();
        return notificationService.sendBatch(settings, pending);
    }
}
