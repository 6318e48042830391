package com.example.bilitracker.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.bilitracker.api.request.LegacyImportRequest;
import com.example.bilitracker.common.exception.BusinessException;
import com.example.bilitracker.common.exception.RemoteApiException;
import com.example.bilitracker.common.exception.ValidationException;
import com.example.bilitracker.domain.MonitorType;
import com.example.bilitracker.domain.model.CollectionInfo;
import com.example.bilitracker.domain.model.CollectionReference;
import com.example.bilitracker.infrastructure.persistence.entity.MonitorEntity;
import com.example.bilitracker.infrastructure.persistence.mapper.MonitorMapper;
import com.example.bilitracker.infrastructure.remote.BiliApiClient;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class MonitorServiceTest {

    private static final String URL = "https://space.bilibili.com/123/lists/77?type=season";

    private MonitorMapper monitorMapper;
    private BiliApiClient biliApiClient;
    private MonitorService service;

    @BeforeEach
    void setUp() {
        monitorMapper = mock(MonitorMapper.class);
        biliApiClient = mock(BiliApiClient.class);
        service = new MonitorService(monitorMapper, biliApiClient,
                Clock.fixed(Instant.ofEpochSecond(1767225600L), ZoneOffset.UTC));
        when(biliApiClient.parseReference(URL)).thenReturn(new CollectionReference("123", "77", MonitorType.SEASON));
    }

    @Test
    void addMonitorShouldStartFromCurrentRemoteTotal() {
        when(biliApiClient.fetchInfo("season", "77", "123"))
                .thenReturn(new CollectionInfo("周更日常", "desc", 42, "cover", 0L));

        service.addMonitor(URL);

        ArgumentCaptor<MonitorEntity> captor = ArgumentCaptor.forClass(MonitorEntity.class);
        verify(monitorMapper).insert(captor.capture());
        MonitorEntity saved = captor.getValue();
        assertEquals("123", saved.getMid());
        assertEquals("77", saved.getRemoteId());
        assertEquals("season", saved.getType());
        assertEquals(Integer.valueOf(42), saved.getTotalCount());
        assertEquals(Long.valueOf(1767225600L), saved.getLastCheckTs());
        assertEquals(Integer.valueOf(1), saved.getIsActive());
        assertEquals(Integer.valueOf(0), saved.getArchived());
    }

    @Test
    void addMonitorShouldRejectDuplicateBeforeCallingRemote() {
        when(monitorMapper.countByRemoteIdAndType("77", "season")).thenReturn(1);

        BusinessException error = assertThrows(BusinessException.class, () -> service.addMonitor(URL));

        assertEquals("409", error.getCode());
        verify(biliApiClient, never()).fetchInfo(anyString(), anyString(), anyString());
    }

    @Test
    void addMonitorShouldReportMissingCollection() {
        when(biliApiClient.fetchInfo("season", "77", "123")).thenReturn(null);

        BusinessException error = assertThrows(BusinessException.class, () -> service.addMonitor(URL));

        assertEquals("404", error.getCode());
        verify(monitorMapper, never()).insert(any(MonitorEntity.class));
    }

    @Test
    void addMonitorShouldMapRemoteFailure() {
        when(biliApiClient.fetchInfo("season", "77", "123"))
                .thenThrow(new RemoteApiException("failed", "https://api.bilibili.com/x", null, null));

        BusinessException error = assertThrows(BusinessException.class, () -> service.addMonitor(URL));

        assertEquals("REMOTE_UNAVAILABLE", error.getCode());
    }

    @Test
    void addMonitorShouldPropagateInvalidUrl() {
        when(biliApiClient.parseReference("bad")).thenThrow(new ValidationException("无法从URL中提取有效信息: bad"));

        ValidationException error = assertThrows(ValidationException.class, () -> service.addMonitor("bad"));

        assertEquals("400", error.getCode());
    }

    @Test
    void archiveShouldUseArchiveStatement() {
        when(monitorMapper.selectById(5L)).thenReturn(new MonitorEntity());

        service.setArchived(5L, true);
        service.setArchived(5L, false);

        verify(monitorMapper).archive(5L);
        verify(monitorMapper).unarchive(5L);
    }

    @Test
    void deleteShouldRequireExistingMonitor() {
        BusinessException error = assertThrows(BusinessException.class, () -> service.deleteMonitor(9L));

        assertEquals("404", error.getCode());
        verify(monitorMapper, never()).deleteById(9L);
    }

    @Test
    void legacyImportShouldMapOldFieldsAndSkipInvalidOrTrackedItems() {
        LegacyImportRequest.LegacyItem series = legacyItem("123", "501", null, null, 8);
        series.setName("旧系列");
        LegacyImportRequest.LegacyItem season = legacyItem("123", null, "77", "season", null);
        season.setLastEpisodeCount(15);
        LegacyImportRequest.LegacyItem noOwner = legacyItem("", "502", null, "series", 1);
        LegacyImportRequest.LegacyItem unknownType = legacyItem("123", "503", null, "playlist", 1);
        LegacyImportRequest.LegacyItem tracked = legacyItem("123", "504", null, "series", 1);
        when(monitorMapper.countByRemoteIdAndType("504", "series")).thenReturn(1);

        int imported = service.importLegacy(request(Arrays.asList(series, season, noOwner, unknownType, tracked)));

        assertEquals(2, imported);
        ArgumentCaptor<MonitorEntity> captor = ArgumentCaptor.forClass(MonitorEntity.class);
        verify(monitorMapper, times(2)).insert(captor.capture());
        List<MonitorEntity> saved = captor.getAllValues();
        assertEquals("501", saved.get(0).getRemoteId());
        assertEquals("series", saved.get(0).getType());
        assertEquals("旧系列", saved.get(0).getName());
        assertEquals(Integer.valueOf(8), saved.get(0).getTotalCount());
        assertEquals(Long.valueOf(1767225600L), saved.get(0).getLastCheckTs());
        assertEquals("77", saved.get(1).getRemoteId());
        assertEquals("season", saved.get(1).getType());
        assertEquals(Integer.valueOf(15), saved.get(1).getTotalCount());
        assertEquals(Integer.valueOf(1), saved.get(1).getIsActive());
        verify(biliApiClient, never()).fetchInfo(anyString(), anyString(), anyString());
    }

    @Test
    void legacyImportShouldRejectMissingSeasons() {
        BusinessException error = assertThrows(BusinessException.class,
                () -> service.importLegacy(request(Collections.emptyList())));

        assertEquals("400", error.getCode());
        assertThrows(BusinessException.class, () -> service.importLegacy(new LegacyImportRequest()));
    }

    private static LegacyImportRequest.LegacyItem legacyItem(String mid, String seriesId, String seasonId,
                                                             String type, Integer total) {
        LegacyImportRequest.LegacyItem item = new LegacyImportRequest.LegacyItem();
        item.setMid(mid);
        item.setSeriesId(seriesId);
        item.setSeasonId(seasonId);
        item.setType(type);
        item.setTotal(total);
        return item;
    }

    private static LegacyImportRequest request(List<LegacyImportRequest.LegacyItem> items) {
        LegacyImportRequest.LegacyData data = new LegacyImportRequest.LegacyData();
        data.setSeasons(items);
        LegacyImportRequest request = new LegacyImportRequest();
        request.setData(data);
        return request;
    }
}
