package com.example.bilitracker.application.service;

import com.example.bilitracker.domain.model.UpdateStats;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Publish cadence of a collection, derived from its update records. Stateless.
 */
@Component
public class UpdateIntervalEstimator {

    private static final double SECONDS_PER_DAY = 86400D;

    /**
     * @param timestampsDescending publish times in epoch seconds, newest first
     */
    public UpdateStats estimate(List<Long> timestampsDescending) {
        List<Long> timestamps = timestampsDescending == null ? Collections.emptyList() : timestampsDescending;
        int n = timestamps.size();
        UpdateStats stats = new UpdateStats();
        stats.setTotalVideos(n);
        stats.setLastUpdateTime(n == 0 ? null : timestamps.get(0));
        if (n < 2) {
            stats.setIntervalsCount(0);
            return stats;
        }

        long gapSum = 0L;
        for (int i = 0; i < n - 1; i++) {
            gapSum += timestamps.get(i) - timestamps.get(i + 1);
        }
        double meanGapSeconds = (double) gapSum / (n - 1);

        // exact binary value, half-even: ties like 1.125 round to 1.12
        stats.setAverageIntervalDays(new BigDecimal(meanGapSeconds / SECONDS_PER_DAY)
                .setScale(2, RoundingMode.HALF_EVEN)
                .doubleValue());
        stats.setNextUpdatePrediction((long) (timestamps.get(0) + meanGapSeconds));
        stats.setIntervalsCount(n - 1);
        return stats;
    }

    /**
     * One entry per requested id, in request order; ids without records get the empty-list estimate.
     */
    public Map<Long, UpdateStats> estimateBatch(Collection<Long> monitorIds, Map<Long, List<Long>> timestampsById) {
        Map<Long, UpdateStats> result = new LinkedHashMap<>();
        if (monitorIds == null) {
            return result;
        }
        for (Long monitorId : monitorIds) {
            List<Long> timestamps = timestampsById == null ? null : timestampsById.get(monitorId);
            result.put(monitorId, estimate(timestamps));
        }
        return result;
    }
}
