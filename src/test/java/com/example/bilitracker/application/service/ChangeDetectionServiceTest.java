package com.example.bilitracker.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.bilitracker.common.exception.RemoteApiException;
import com.example.bilitracker.domain.model.AppendResult;
import com.example.bilitracker.domain.model.CollectionInfo;
import com.example.bilitracker.domain.model.DetectionResult;
import com.example.bilitracker.domain.model.RemoteVideo;
import com.example.bilitracker.infrastructure.persistence.entity.MonitorEntity;
import com.example.bilitracker.infrastructure.remote.BiliApiClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChangeDetectionServiceTest {

    private static final long NOW = 1767225600L;

    private BiliApiClient biliApiClient;
    private MonitorService monitorService;
    private VideoUpdateService videoUpdateService;
    private SimpleMeterRegistry meterRegistry;
    private ChangeDetectionService service;

    @BeforeEach
    void setUp() {
        biliApiClient = mock(BiliApiClient.class);
        monitorService = mock(MonitorService.class);
        videoUpdateService = mock(VideoUpdateService.class);
        meterRegistry = new SimpleMeterRegistry();
        service = new ChangeDetectionService(biliApiClient, monitorService, videoUpdateService, meterRegistry,
                Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC));
    }

    @Test
    void detectShouldOnlyRefreshCheckTimeWhenTotalUnchanged() {
        when(biliApiClient.fetchInfo("season", "77", "123")).thenReturn(info(10));

        DetectionResult result = service.detect(monitor(10));

        assertEquals(DetectionResult.Outcome.UNCHANGED, result.getOutcome());
        assertFalse(result.hasUpdate());
        verify(monitorService).touchLastCheck(1L, NOW);
        verify(monitorService, never()).updateStatus(eq(1L), anyInt(), anyLong());
        verify(biliApiClient, never()).fetchLatestVideos(anyString(), anyString(), anyString(), anyInt());
        verifyNoInteractions(videoUpdateService);
    }

    @Test
    void detectShouldTreatShrinkingTotalAsUnchanged() {
        when(biliApiClient.fetchInfo("season", "77", "123")).thenReturn(info(0));

        DetectionResult result = service.detect(monitor(10));

        assertEquals(DetectionResult.Outcome.UNCHANGED, result.getOutcome());
        assertEquals(10, result.getRemoteTotal());
        verify(monitorService).touchLastCheck(1L, NOW);
        verify(monitorService, never()).updateStatus(eq(1L), anyInt(), anyLong());
    }

    @Test
    void detectShouldRequestExactlyTheDeltaAndStoreRemoteTotal() {
        when(biliApiClient.fetchInfo("season", "77", "123")).thenReturn(info(13));
        when(biliApiClient.fetchLatestVideos("season", "77", "123", 3)).thenReturn(Arrays.asList(
                new RemoteVideo("103", "第13集", 1767200000L, "c3"),
                new RemoteVideo("102", "第12集", 1767100000L, "c2"),
                new RemoteVideo("101", "第11集", 1767000000L, "c1")));
        when(videoUpdateService.appendUpdate(1L, "103", "第13集", 1767200000L, "c3"))
                .thenReturn(AppendResult.success("ok"));
        when(videoUpdateService.appendUpdate(1L, "102", "第12集", 1767100000L, "c2"))
                .thenReturn(AppendResult.failure("该视频已存在记录"));
        when(videoUpdateService.appendUpdate(1L, "101", "第11集", 1767000000L, "c1"))
                .thenReturn(AppendResult.success("ok"));

        DetectionResult result = service.detect(monitor(10));

        assertTrue(result.hasUpdate());
        assertEquals(3, result.getDelta());
        assertEquals(13, result.getRemoteTotal());
        assertEquals(2, result.getPersistedCount());
        assertEquals(1767200000L, result.getUpdateTime());
        verify(biliApiClient).fetchLatestVideos("season", "77", "123", 3);
        verify(monitorService).updateStatus(1L, 13, NOW);
        verify(monitorService, never()).touchLastCheck(anyLong(), anyLong());
        assertEquals(3.0, meterRegistry.counter("tracker.updates.detected").count());
    }

    @Test
    void detectShouldStoreRemoteTotalEvenWhenNoVideoCameBack() {
        when(biliApiClient.fetchInfo("season", "77", "123")).thenReturn(info(12));
        when(biliApiClient.fetchLatestVideos("season", "77", "123", 2)).thenReturn(Collections.emptyList());

        DetectionResult result = service.detect(monitor(10));

        assertTrue(result.hasUpdate());
        assertEquals(0, result.getPersistedCount());
        assertEquals(NOW, result.getUpdateTime());
        verify(monitorService).updateStatus(1L, 12, NOW);
    }

    @Test
    void detectShouldSkipWhenInfoUnavailable() {
        when(biliApiClient.fetchInfo("season", "77", "123")).thenReturn(null);

        DetectionResult result = service.detect(monitor(10));

        assertEquals(DetectionResult.Outcome.SKIPPED, result.getOutcome());
        verifyNoInteractions(monitorService, videoUpdateService);
    }

    @Test
    void detectShouldSkipWhenRemoteFails() {
        when(biliApiClient.fetchInfo("season", "77", "123"))
                .thenThrow(new RemoteApiException("failed", "https://api.bilibili.com/x", 500, null));

        DetectionResult result = service.detect(monitor(10));

        assertEquals(DetectionResult.Outcome.SKIPPED, result.getOutcome());
        verifyNoInteractions(monitorService, videoUpdateService);
    }

    private static CollectionInfo info(int total) {
        return new CollectionInfo("周更", "", total, "", 0L);
    }

    private static MonitorEntity monitor(int total) {
        MonitorEntity entity = new MonitorEntity();
        entity.setId(1L);
        entity.setMid("123");
        entity.setRemoteId("77");
        entity.setType("season");
        entity.setName("周更");
        entity.setTotalCount(total);
        entity.setIsActive(1);
        entity.setArchived(0);
        return entity;
    }
}
