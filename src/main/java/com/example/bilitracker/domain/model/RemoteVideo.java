package com.example.bilitracker.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RemoteVideo {

    private String videoId;

    private String title;

    /** Epoch seconds. */
    private long publishTime;

    private String cover;
}
