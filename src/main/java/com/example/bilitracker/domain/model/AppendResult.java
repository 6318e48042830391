package com.example.bilitracker.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AppendResult {

    private boolean success;

    private String message;

    public static AppendResult success(String message) {
        return new AppendResult(true, message);
    }

    public static AppendResult failure(String message) {
        return new AppendResult(false, message);
    }
}
