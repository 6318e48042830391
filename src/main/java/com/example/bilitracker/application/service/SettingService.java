package com.example.bilitracker.application.service;

import com.example.bilitracker.domain.model.MonitorSettings;
import com.example.bilitracker.infrastructure.persistence.entity.SettingEntity;
import com.example.bilitracker.infrastructure.persistence.mapper.SettingMapper;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Key-value runtime settings. Nothing is cached: every call reads the table.
 */
@Service
public class SettingService {

    private static final Logger log = LoggerFactory.getLogger(SettingService.class);

    public static final String MASKED_SECRET = "******";

    private final SettingMapper settingMapper;

    public SettingService(SettingMapper settingMapper) {
        this.settingMapper = settingMapper;
    }

    /**
     * Inserts a default for every known key that has no row yet. Existing values are left alone.
     */
    public int ensureDefaults() {
        Map<String, String> stored = getRawSettings();
        int inserted = 0;
        for (Map.Entry<String, String> entry : MonitorSettings.DEFAULTS.entrySet()) {
            if (!stored.containsKey(entry.getKey())) {
                settingMapper.insert(entry.getKey(), entry.getValue());
                inserted++;
            }
        }
        if (inserted > 0) {
            log.info("SETTINGS_DEFAULTS_INSERTED count={}", inserted);
        }
        return inserted;
    }

    public Map<String, String> getRawSettings() {
        Map<String, String> settings = new LinkedHashMap<>();
        for (SettingEntity entity : settingMapper.selectAll()) {
            settings.put(entity.getSettingKey(), entity.getSettingValue());
        }
        return settings;
    }

    public MonitorSettings getSettings() {
        return MonitorSettings.from(getRawSettings());
    }

    public void updateSetting(String key, String value) {
        settingMapper.upsert(key, value == null ? "" : value);
    }

    /**
     * Every known key with defaults filled in and the SMTP auth code masked.
     */
    public Map<String, String> getDisplaySettings() {
        Map<String, String> merged = new LinkedHashMap<>(MonitorSettings.DEFAULTS);
        Map<String, String> stored = getRawSettings();
        for (String key : MonitorSettings.DEFAULTS.keySet()) {
            if (stored.containsKey(key)) {
                merged.put(key, stored.get(key));
            }
        }
        String authCode = merged.get(MonitorSettings.EMAIL_AUTH_CODE);
        if (authCode != null && !authCode.isEmpty()) {
            merged.put(MonitorSettings.EMAIL_AUTH_CODE, MASKED_SECRET);
        }
        return merged;
    }

    /**
     * Stores the known, user-editable keys of {@code values}. Unknown keys and {@code next_check_time}
     * are ignored, a masked auth code keeps the stored one.
     *
     * @return keys whose stored value actually changed
     */
    public Set<String> saveSettings(Map<String, String> values) {
        if (values == null || values.isEmpty()) {
            return Collections.emptySet();
        }
        Map<String, String> stored = getRawSettings();
        Set<String> changed = new LinkedHashSet<>();
        for (Map.Entry<String, String> entry : values.entrySet()) {
            String key = entry.getKey();
            if (!isEditable(key) || isMaskedSecret(key, entry.getValue())) {
                continue;
            }
            String value = entry.getValue() == null ? "" : entry.getValue().trim();
            if (!Objects.equals(stored.get(key), value)) {
                settingMapper.upsert(key, value);
                changed.add(key);
            }
        }
        log.info("SETTINGS_SAVED changedKeys={}", changed);
        return changed;
    }

    /**
     * Stored settings overlaid with {@code overrides}, for trying a mail configuration before saving it.
     */
    public MonitorSettings previewSettings(Map<String, String> overrides) {
        Map<String, String> merged = getRawSettings();
        if (overrides != null) {
            for (Map.Entry<String, String> entry : overrides.entrySet()) {
                if (isEditable(entry.getKey()) && !isMaskedSecret(entry.getKey(), entry.getValue())
                        && entry.getValue() != null) {
                    merged.put(entry.getKey(), entry.getValue());
                }
            }
        }
        return MonitorSettings.from(merged);
    }

    private static boolean isEditable(String key) {
        return MonitorSettings.DEFAULTS.containsKey(key) && !MonitorSettings.NEXT_CHECK_TIME.equals(key);
    }

    private static boolean isMaskedSecret(String key, String value) {
        return MonitorSettings.EMAIL_AUTH_CODE.equals(key) && MASKED_SECRET.equals(value);
    }
}
