package com.example.bilitracker.api.controller;

import com.example.bilitracker.api.response.ApiResponse;
import com.example.bilitracker.application.job.MonitorScheduler;
import com.example.bilitracker.application.service.SettingService;
import com.example.bilitracker.application.service.UpdateNotificationService;
import com.example.bilitracker.common.exception.BusinessException;
import java.util.Map;
import java.util.Set;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/settings")
public class SettingController {

    private final SettingService settingService;
    private final MonitorScheduler monitorScheduler;
    private final UpdateNotificationService updateNotificationService;

    public SettingController(SettingService settingService,
                             MonitorScheduler monitorScheduler,
                             UpdateNotificationService updateNotificationService) {
        this.settingService = settingService;
        this.monitorScheduler = monitorScheduler;
        this.updateNotificationService = updateNotificationService;
    }

    @GetMapping
    public ApiResponse<Map<String, String>> getSettings() {
        return ApiResponse.success(settingService.getDisplaySettings());
    }

    @PutMapping
    public ApiResponse<Map<String, String>> saveSettings(@RequestBody Map<String, String> request) {
        Set<String> changed = settingService.saveSettings(request);
        monitorScheduler.applySettingChanges(changed);
        return ApiResponse.success("保存成功", settingService.getDisplaySettings());
    }

    /**
     * Sends a test mail with the stored settings overlaid by the (unsaved) values in the body.
     */
    @PostMapping("/mail-test")
    public ApiResponse<String> sendTestMail(@RequestBody(required = false) Map<String, String> request) {
        if (!updateNotificationService.sendTestMail(settingService.previewSettings(request))) {
            throw new BusinessException("MAIL_TEST_FAILED", "测试邮件发送失败", "请检查SMTP配置或查看日志");
        }
        return ApiResponse.success("发送成功，请查收", "SENT");
    }
}
