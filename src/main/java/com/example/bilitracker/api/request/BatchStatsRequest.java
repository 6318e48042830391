package com.example.bilitracker.api.request;

import java.util.List;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.Size;
import lombok.Data;

@Data
public class BatchStatsRequest {

    @NotEmpty
    @Size(max = 500)
    private List<Long> monitorIds;
}
