package com.example.bilitracker.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.example.bilitracker.domain.model.UpdateStats;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class UpdateIntervalEstimatorTest {

    private final UpdateIntervalEstimator estimator = new UpdateIntervalEstimator();

    @Test
    void estimateShouldAverageGapsAndPredictNext() {
        UpdateStats stats = estimator.estimate(Arrays.asList(300000L, 200000L, 100000L));

        assertEquals(1.16, stats.getAverageIntervalDays());
        assertEquals(Long.valueOf(400000L), stats.getNextUpdatePrediction());
        assertEquals(3, stats.getTotalVideos());
        assertEquals(Long.valueOf(300000L), stats.getLastUpdateTime());
        assertEquals(2, stats.getIntervalsCount());
    }

    @Test
    void exactTiesShouldRoundToEvenDigit() {
        // 97200 s = 1.125 days, 10800 s = 0.125 days
        assertEquals(1.12, estimator.estimate(Arrays.asList(97200L, 0L)).getAverageIntervalDays());
        assertEquals(0.12, estimator.estimate(Arrays.asList(10800L, 0L)).getAverageIntervalDays());
        // 0.375 days
        assertEquals(0.38, estimator.estimate(Arrays.asList(32400L, 0L)).getAverageIntervalDays());
    }

    @Test
    void estimateShouldTruncateFractionalPrediction() {
        // gaps 100 and 101 seconds, mean 100.5
        UpdateStats stats = estimator.estimate(Arrays.asList(1201L, 1100L, 1000L));

        assertEquals(Long.valueOf(1301L), stats.getNextUpdatePrediction());
        assertEquals(0.0, stats.getAverageIntervalDays());
    }

    @Test
    void estimateShouldLeaveAverageEmptyBelowTwoRecords() {
        UpdateStats single = estimator.estimate(Collections.singletonList(500L));
        assertNull(single.getAverageIntervalDays());
        assertNull(single.getNextUpdatePrediction());
        assertEquals(1, single.getTotalVideos());
        assertEquals(Long.valueOf(500L), single.getLastUpdateTime());
        assertEquals(0, single.getIntervalsCount());

        UpdateStats empty = estimator.estimate(Collections.emptyList());
        assertNull(empty.getAverageIntervalDays());
        assertNull(empty.getNextUpdatePrediction());
        assertNull(empty.getLastUpdateTime());
        assertEquals(0, empty.getTotalVideos());

        assertEquals(0, estimator.estimate(null).getTotalVideos());
    }

    @Test
    void estimateBatchShouldMatchSingleEstimatesInRequestOrder() {
        Map<Long, List<Long>> timestamps = new HashMap<>();
        timestamps.put(1L, Arrays.asList(900000L, 450000L, 100000L, 50000L));
        timestamps.put(2L, Collections.singletonList(42L));

        Map<Long, UpdateStats> batch = estimator.estimateBatch(Arrays.asList(2L, 3L, 1L), timestamps);

        assertEquals(Arrays.asList(2L, 3L, 1L), Arrays.asList(batch.keySet().toArray(new Long[0])));
        assertEquals(estimator.estimate(timestamps.get(1L)), batch.get(1L));
        assertEquals(estimator.estimate(timestamps.get(2L)), batch.get(2L));
        assertEquals(estimator.estimate(Collections.emptyList()), batch.get(3L));
    }
}
