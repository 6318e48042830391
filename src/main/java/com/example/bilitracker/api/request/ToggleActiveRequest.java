package com.example.bilitracker.api.request;

import javax.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ToggleActiveRequest {

    @NotNull
    private Boolean active;
}
