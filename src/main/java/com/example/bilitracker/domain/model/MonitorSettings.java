package com.example.bilitracker.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * Typed view over the raw key-value settings. Built from a fresh read each time a decision is made,
 * never kept across passes.
 */
@Getter
public final class MonitorSettings {

    public static final String MONITOR_ACTIVE = "monitor_active";
    public static final String GLOBAL_COOLDOWN = "global_cooldown";
    public static final String ITEM_COOLDOWN = "item_cooldown";
    public static final String SMTP_ENABLE = "smtp_enable";
    public static final String SMTP_SERVER = "smtp_server";
    public static final String SMTP_PORT = "smtp_port";
    public static final String EMAIL_ACCOUNT = "email_account";
    public static final String EMAIL_AUTH_CODE = "email_auth_code";
    public static final String SENDER_NAME = "sender_name";
    public static final String RECEIVER_EMAILS = "receiver_emails";
    public static final String USE_TLS = "use_tls";
    public static final String SMTP_BATCH_SEND = "smtp_batch_send";
    public static final String NEXT_CHECK_TIME = "next_check_time";
    public static final String RECENT_UPDATES_LIMIT = "recent_updates_limit";
    public static final String RECENT_UPDATES_SAVE_LIMIT = "recent_updates_save_limit";
    public static final String LOG_AUTO_CLEAN = "log_auto_clean";
    public static final String LOG_RETENTION_DAYS = "log_retention_days";
    public static final String DEBUG_MODE = "debug_mode";

    public static final Map<String, String> DEFAULTS;

    static {
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put(SMTP_ENABLE, "0");
        defaults.put(SMTP_SERVER, "smtp.163.com");
        defaults.put(SMTP_PORT, "465");
        defaults.put(EMAIL_ACCOUNT, "");
        defaults.put(EMAIL_AUTH_CODE, "");
        defaults.put(SENDER_NAME, "B站合集监控");
        defaults.put(RECEIVER_EMAILS, "");
        defaults.put(USE_TLS, "1");
        defaults.put(SMTP_BATCH_SEND, "0");
        defaults.put(MONITOR_ACTIVE, "0");
        defaults.put(GLOBAL_COOLDOWN, "600");
        defaults.put(ITEM_COOLDOWN, "30");
        defaults.put(NEXT_CHECK_TIME, "未调度");
        defaults.put(RECENT_UPDATES_LIMIT, "10");
        defaults.put(RECENT_UPDATES_SAVE_LIMIT, "30");
        defaults.put(LOG_AUTO_CLEAN, "1");
        defaults.put(LOG_RETENTION_DAYS, "7");
        defaults.put(DEBUG_MODE, "0");
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private final boolean monitorActive;
    private final int globalCooldownSeconds;
    private final int itemCooldownSeconds;
    private final boolean batchSend;
    private final int recentUpdatesLimit;
    private final int recentUpdatesSaveLimit;
    private final boolean logAutoClean;
    private final int logRetentionDays;
    private final boolean debugMode;
    private final String nextCheckTime;
    private final MailSettings mail;

    private MonitorSettings(Map<String, String> raw) {
        this.monitorActive = flag(raw, MONITOR_ACTIVE);
        this.globalCooldownSeconds = positiveInt(raw, GLOBAL_COOLDOWN);
        this.itemCooldownSeconds = nonNegativeInt(raw, ITEM_COOLDOWN);
        this.batchSend = flag(raw, SMTP_BATCH_SEND);
        this.recentUpdatesLimit = positiveInt(raw, RECENT_UPDATES_LIMIT);
        this.recentUpdatesSaveLimit = positiveInt(raw, RECENT_UPDATES_SAVE_LIMIT);
        this.logAutoClean = flag(raw, LOG_AUTO_CLEAN);
        this.logRetentionDays = nonNegativeInt(raw, LOG_RETENTION_DAYS);
        this.debugMode = flag(raw, DEBUG_MODE);
        this.nextCheckTime = text(raw, NEXT_CHECK_TIME);
        this.mail = MailSettings.builder()
                .enabled(flag(raw, SMTP_ENABLE))
                .host(text(raw, SMTP_SERVER))
                .port(positiveInt(raw, SMTP_PORT))
                .account(text(raw, EMAIL_ACCOUNT))
                .authCode(text(raw, EMAIL_AUTH_CODE))
                .senderName(text(raw, SENDER_NAME))
                .receivers(splitReceivers(text(raw, RECEIVER_EMAILS)))
                .useTls(flag(raw, USE_TLS))
                .build();
    }

    public static MonitorSettings from(Map<String, String> raw) {
        return new MonitorSettings(raw == null ? Collections.emptyMap() : raw);
    }

    private static String text(Map<String, String> raw, String key) {
        String value = raw.get(key);
        return value == null ? DEFAULTS.get(key) : value.trim();
    }

    private static boolean flag(Map<String, String> raw, String key) {
        return "1".equals(text(raw, key));
    }

    private static int positiveInt(Map<String, String> raw, String key) {
        int value = parseInt(raw, key);
        return value > 0 ? value : Integer.parseInt(DEFAULTS.get(key));
    }

    private static int nonNegativeInt(Map<String, String> raw, String key) {
        int value = parseInt(raw, key);
        return value >= 0 ? value : Integer.parseInt(DEFAULTS.get(key));
    }

    private static int parseInt(Map<String, String> raw, String key) {
        try {
            return Integer.parseInt(text(raw, key));
        } catch (NumberFormatException e) {
            return Integer.parseInt(DEFAULTS.get(key));
        }
    }

    private static List<String> splitReceivers(String value) {
        List<String> receivers = new ArrayList<>();
        if (value == null) {
            return receivers;
        }
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                receivers.add(trimmed);
            }
        }
        return receivers;
    }
}
