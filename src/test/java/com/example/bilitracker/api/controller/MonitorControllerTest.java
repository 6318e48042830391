package com.example.bilitracker.api.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.bilitracker.api.request.AddMonitorRequest;
import com.example.bilitracker.api.response.ApiResponse;
import com.example.bilitracker.api.response.MonitorResponse;
import com.example.bilitracker.application.job.MonitorScheduler;
import com.example.bilitracker.application.service.MonitorService;
import com.example.bilitracker.application.service.VideoUpdateService;
import com.example.bilitracker.common.exception.BusinessException;
import com.example.bilitracker.infrastructure.persistence.entity.MonitorEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MonitorControllerTest {

    private static final String URL = "https://space.bilibili.com/123/lists/77?type=season";

    private MonitorService monitorService;
    private MonitorScheduler monitorScheduler;
    private MonitorController controller;

    @BeforeEach
    void setUp() {
        monitorService = mock(MonitorService.class);
        monitorScheduler = mock(MonitorScheduler.class);
        controller = new MonitorController(monitorService, mock(VideoUpdateService.class), monitorScheduler);
    }

    @Test
    void addShouldQueueFirstCheckOfNewCollection() {
        MonitorEntity added = new MonitorEntity();
        added.setId(12L);
        added.setIsActive(1);
        added.setArchived(0);
        when(monitorService.addMonitor(URL)).thenReturn(added);

        ApiResponse<MonitorResponse> response = controller.addMonitor(request());

        assertEquals(ApiResponse.SUCCESS_CODE, response.getCode());
        verify(monitorScheduler).checkAfterAdd(12L);
    }

    @Test
    void failedAddShouldNotQueueCheck() {
        when(monitorService.addMonitor(URL)).thenThrow(new BusinessException("409", "该合集已在监控列表中"));

        assertThrows(BusinessException.class, () -> controller.addMonitor(request()));

        verify(monitorScheduler, never()).checkAfterAdd(any());
    }

    private static AddMonitorRequest request() {
        AddMonitorRequest request = new AddMonitorRequest();
        request.setUrl(URL);
        return request;
    }
}
