package com.example.bilitracker.application.job;

import com.example.bilitracker.application.service.LogMaintenanceService;
import com.example.bilitracker.application.service.SettingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Seeds missing settings, restores the log level and arms the scheduler once the context is ready.
 */
@Component
public class MonitorSchedulerBootstrap {

    private static final Logger log = LoggerFactory.getLogger(MonitorSchedulerBootstrap.class);

    private final SettingService settingService;
    private final LogMaintenanceService logMaintenanceService;
    private final MonitorScheduler monitorScheduler;

    public MonitorSchedulerBootstrap(SettingService settingService,
                                     LogMaintenanceService logMaintenanceService,
                                     MonitorScheduler monitorScheduler) {
        this.settingService = settingService;
        this.logMaintenanceService = logMaintenanceService;
        this.monitorScheduler = monitorScheduler;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        settingService.ensureDefaults();
        logMaintenanceService.applyDebugMode(settingService.getSettings().isDebugMode());
        monitorScheduler.start();
        log.info("SCHEDULER_BOOTSTRAPPED state={}", monitorScheduler.getState());
    }
}
