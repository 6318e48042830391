package com.example.bilitracker.api.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Data;

/**
 * Export of the earlier single-file tracker: {@code {"data": {"seasons": [...]}}}.
 */
@Data
public class LegacyImportRequest {

    private LegacyData data;

    @Data
    public static class LegacyData {

        private List<LegacyItem> seasons;
    }

    @Data
    public static class LegacyItem {

        private String mid;

        @JsonProperty("series_id")
        private String seriesId;

        @JsonProperty("season_id")
        private String seasonId;

        private String type;

        private String name;

        private String cover;

        private Integer total;

        @JsonProperty("last_episode_count")
        private Integer lastEpisodeCount;
    }
}
