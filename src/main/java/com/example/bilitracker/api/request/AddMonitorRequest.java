package com.example.bilitracker.api.request;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Size;
import lombok.Data;

@Data
public class AddMonitorRequest {

    /** e.g. https://space.bilibili.com/{mid}/lists/{id}?type=season */
    @NotBlank
    @Size(max = 512)
    private String url;
}
