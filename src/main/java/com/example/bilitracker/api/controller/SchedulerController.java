package com.example.bilitracker.api.controller;

import com.example.bilitracker.api.response.ApiResponse;
import com.example.bilitracker.api.response.SchedulerStatusResponse;
import com.example.bilitracker.application.job.MonitorScheduler;
import com.example.bilitracker.application.service.MonitorService;
import com.example.bilitracker.application.service.SettingService;
import com.example.bilitracker.domain.model.MonitorSettings;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
public class SchedulerController {

    private final MonitorScheduler monitorScheduler;
    private final SettingService settingService;
    private final MonitorService monitorService;

    public SchedulerController(MonitorScheduler monitorScheduler,
                               SettingService settingService,
                               MonitorService monitorService) {
        this.monitorScheduler = monitorScheduler;
        this.settingService = settingService;
        this.monitorService = monitorService;
    }

    @GetMapping("/status")
    public ApiResponse<SchedulerStatusResponse> status() {
        MonitorSettings settings = settingService.getSettings();
        return ApiResponse.success(new SchedulerStatusResponse(
                monitorScheduler.getState().name(),
                settings.isMonitorActive(),
                settings.getNextCheckTime(),
                monitorService.countAll(),
                monitorService.countActive()));
    }

    @PostMapping("/scheduler/start")
    public ApiResponse<SchedulerStatusResponse> start() {
        monitorScheduler.startMonitor();
        return status();
    }

    @PostMapping("/scheduler/stop")
    public ApiResponse<SchedulerStatusResponse> stop() {
        monitorScheduler.stop();
        return status();
    }

    @PostMapping("/scheduler/run-once")
    public ApiResponse<String> runOnce() {
        monitorScheduler.runOnce();
        return ApiResponse.success("已触发立即检查", "QUEUED");
    }
}
