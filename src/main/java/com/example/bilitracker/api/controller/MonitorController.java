package com.example.bilitracker.api.controller;

import com.example.bilitracker.api.request.AddMonitorRequest;
import com.example.bilitracker.api.request.ArchiveRequest;
import com.example.bilitracker.api.request.BatchStatsRequest;
import com.example.bilitracker.api.request.LegacyImportRequest;
import com.example.bilitracker.api.request.ToggleActiveRequest;
import com.example.bilitracker.api.response.ApiResponse;
import com.example.bilitracker.api.response.MonitorResponse;
import com.example.bilitracker.api.response.RecentUpdateResponse;
import com.example.bilitracker.application.job.MonitorScheduler;
import com.example.bilitracker.application.service.MonitorService;
import com.example.bilitracker.application.service.VideoUpdateService;
import com.example.bilitracker.domain.model.UpdateStats;
import com.example.bilitracker.infrastructure.persistence.entity.MonitorEntity;
import com.example.bilitracker.infrastructure.persistence.model.RecentUpdateRow;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
public class MonitorController {

    private final MonitorService monitorService;
    private final VideoUpdateService videoUpdateService;
    private final MonitorScheduler monitorScheduler;

    public MonitorController(MonitorService monitorService,
                             VideoUpdateService videoUpdateService,
                             MonitorScheduler monitorScheduler) {
        this.monitorService = monitorService;
        this.videoUpdateService = videoUpdateService;
        this.monitorScheduler = monitorScheduler;
    }

    @GetMapping("/monitors")
    public ApiResponse<List<MonitorResponse>> listMonitors() {
        return ApiResponse.success(toResponses(monitorService.listAll()));
    }

    @GetMapping("/monitors/archived")
    public ApiResponse<List<MonitorResponse>> listArchived() {
        return ApiResponse.success(toResponses(monitorService.listArchived()));
    }

    @PostMapping("/monitors")
    public ApiResponse<MonitorResponse> addMonitor(@Valid @RequestBody AddMonitorRequest request) {
        MonitorEntity added = monitorService.addMonitor(request.getUrl());
        monitorScheduler.checkAfterAdd(added.getId());
        return ApiResponse.success("添加成功", toResponse(added));
    }

    @PostMapping("/monitors/import")
    public ApiResponse<Integer> importLegacy(@RequestBody LegacyImportRequest request) {
        return ApiResponse.success("导入完成", monitorService.importLegacy(request));
    }

    @DeleteMapping("/monitors/{id}")
    public ApiResponse<String> deleteMonitor(@PathVariable("id") Long id) {
        monitorService.deleteMonitor(id);
        return ApiResponse.success("DELETED");
    }

    @PutMapping("/monitors/{id}/active")
    public ApiResponse<MonitorResponse> toggleActive(@PathVariable("id") Long id,
                                                     @Valid @RequestBody ToggleActiveRequest request) {
        return ApiResponse.success(toResponse(monitorService.setActive(id, request.getActive())));
    }

    @PutMapping("/monitors/{id}/archived")
    public ApiResponse<MonitorResponse> setArchived(@PathVariable("id") Long id,
                                                    @Valid @RequestBody ArchiveRequest request) {
        return ApiResponse.success(toResponse(monitorService.setArchived(id, request.getArchived())));
    }

    @PostMapping("/monitors/{id}/check")
    public ApiResponse<String> checkMonitor(@PathVariable("id") Long id) {
        monitorService.requireMonitor(id);
        monitorScheduler.checkSingle(id);
        return ApiResponse.success("检查任务已提交", "QUEUED");
    }

    @GetMapping("/monitors/{id}/stats")
    public ApiResponse<UpdateStats> getStats(@PathVariable("id") Long id) {
        monitorService.requireMonitor(id);
        return ApiResponse.success(videoUpdateService.getStats(id));
    }

    @PostMapping("/monitors/stats")
    public ApiResponse<Map<Long, UpdateStats>> getStatsBatch(@Valid @RequestBody BatchStatsRequest request) {
        return ApiResponse.success(videoUpdateService.getStatsBatch(request.getMonitorIds()));
    }

    @GetMapping("/updates/recent")
    public ApiResponse<List<RecentUpdateResponse>> listRecentUpdates(
            @RequestParam(value = "limit", required = false) Integer limit) {
        List<RecentUpdateResponse> responses = new ArrayList<>();
        for (RecentUpdateRow row : videoUpdateService.listRecent(limit)) {
            responses.add(new RecentUpdateResponse(row.getId(), row.getMonitorId(), row.getMonitorName(),
                    row.getVideoId(), row.getVideoTitle(), row.getPublishTime(), row.getCover()));
        }
        return ApiResponse.success(responses);
    }

    private List<MonitorResponse> toResponses(List<MonitorEntity> entities) {
        List<MonitorResponse> responses = new ArrayList<>(entities.size());
        for (MonitorEntity entity : entities) {
            responses.add(toResponse(entity));
        }
        return responses;
    }

    private MonitorResponse toResponse(MonitorEntity entity) {
        return new MonitorResponse(
                entity.getId(),
                entity.getMid(),
                entity.getRemoteId(),
                entity.getType(),
                entity.getName(),
                entity.getCover(),
                entity.getDescription(),
                entity.getTotalCount(),
                entity.getLastCheckTs(),
                Integer.valueOf(1).equals(entity.getIsActive()),
                Integer.valueOf(1).equals(entity.getArchived()),
                entity.getCreatedAt());
    }
}
