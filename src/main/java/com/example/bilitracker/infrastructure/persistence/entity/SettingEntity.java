package com.example.bilitracker.infrastructure.persistence.entity;

import lombok.Data;

@Data
public class SettingEntity {

    private String settingKey;

    private String settingValue;
}
