package com.example.bilitracker.application.job;

import com.example.bilitracker.application.service.ChangeDetectionService;
import com.example.bilitracker.application.service.LogMaintenanceService;
import com.example.bilitracker.application.service.MonitorService;
import com.example.bilitracker.application.service.NotificationBatch;
import com.example.bilitracker.application.service.SettingService;
import com.example.bilitracker.application.service.UpdateNotificationService;
import com.example.bilitracker.common.config.AppTrackerProperties;
import com.example.bilitracker.common.exception.BusinessException;
import com.example.bilitracker.common.util.Sleeper;
import com.example.bilitracker.domain.SchedulerState;
import com.example.bilitracker.domain.model.DetectionResult;
import com.example.bilitracker.domain.model.MonitorSettings;
import com.example.bilitracker.infrastructure.persistence.entity.MonitorEntity;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

/**
 * Owns every timed activity: the periodic pass over active collections, one-shot passes,
 * single collection checks and the daily log maintenance.
 *
 * <p>{@link #start()} is the only place jobs get registered. It always drops what was registered
 * before and re-reads the settings, so switching monitoring on or off and changing the interval
 * both go through it.
 */
@Service
public class MonitorScheduler {

    private static final Logger log = LoggerFactory.getLogger(MonitorScheduler.class);

    static final String MONITOR_JOB = "monitor_job";
    static final String MAINTENANCE_JOB = "daily_log_maintenance_job";

    static final String DISPLAY_RUNNING = "正在运行...";
    static final String DISPLAY_STOPPED = "监控已停止";

    private final TaskScheduler monitorTaskScheduler;
    private final ExecutorService monitorCheckExecutor;
    private final SettingService settingService;
    private final MonitorService monitorService;
    private final ChangeDetectionService changeDetectionService;
    private final UpdateNotificationService updateNotificationService;
    private final LogMaintenanceService logMaintenanceService;
    private final AppTrackerProperties appTrackerProperties;
    private final MeterRegistry meterRegistry;
    private final Sleeper sleeper;
    private final Clock clock;
    private final DateTimeFormatter displayFormatter;

    private final Map<String, ScheduledFuture<?>> jobs = new ConcurrentHashMap<>();
    private final AtomicInteger runningPasses = new AtomicInteger();
    private final Object lifecycleLock = new Object();
    private volatile boolean armed;

    @Autowired
    public MonitorScheduler(TaskScheduler monitorTaskScheduler,
                            ExecutorService monitorCheckExecutor,
                            SettingService settingService,
                            MonitorService monitorService,
                            ChangeDetectionService changeDetectionService,
                            UpdateNotificationService updateNotificationService,
                            LogMaintenanceService logMaintenanceService,
                            AppTrackerProperties appTrackerProperties,
                            ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this(monitorTaskScheduler, monitorCheckExecutor, settingService, monitorService, changeDetectionService,
                updateNotificationService, logMaintenanceService, appTrackerProperties,
                meterRegistryProvider.getIfAvailable(), Sleeper.threadSleeper(), Clock.systemDefaultZone());
    }

    MonitorScheduler(TaskScheduler monitorTaskScheduler,
                     ExecutorService monitorCheckExecutor,
                     SettingService settingService,
                     MonitorService monitorService,
                     ChangeDetectionService changeDetectionService,
                     UpdateNotificationService updateNotificationService,
                     LogMaintenanceService logMaintenanceService,
                     AppTrackerProperties appTrackerProperties,
                     MeterRegistry meterRegistry,
                     Sleeper sleeper,
                     Clock clock) {
        this.monitorTaskScheduler = monitorTaskScheduler;
        this.monitorCheckExecutor = monitorCheckExecutor;
        this.settingService = settingService;
        this.monitorService = monitorService;
        this.changeDetectionService = changeDetectionService;
        this.updateNotificationService = updateNotificationService;
        this.logMaintenanceService = logMaintenanceService;
        this.appTrackerProperties = appTrackerProperties;
        this.meterRegistry = meterRegistry;
        this.sleeper = sleeper;
        this.clock = clock;
        this.displayFormatter = DateTimeFormatter.ofPattern(appTrackerProperties.getDisplayTimePattern());
    }

    /**
     * Re-arms from the current settings: maintenance always, the periodic pass only while
     * {@code monitor_active} is on. The first pass runs one interval from now, and each later
     * pass one interval after the previous one ends.
     */
    public void start() {
        synchronized (lifecycleLock) {
            cancelAll();
            MonitorSettings settings = settingService.getSettings();

            jobs.put(MAINTENANCE_JOB, monitorTaskScheduler.schedule(this::runMaintenance,
                    new CronTrigger(appTrackerProperties.getMaintenanceCron())));

            if (settings.isMonitorActive()) {
                Duration interval = Duration.ofSeconds(settings.getGlobalCooldownSeconds());
                Instant firstRun = clock.instant().plus(interval);
                jobs.put(MONITOR_JOB, monitorTaskScheduler.scheduleWithFixedDelay(
                        () -> runPass("periodic"), firstRun, interval));
                settingService.updateSetting(MonitorSettings.NEXT_CHECK_TIME, formatDisplay(firstRun));
                log.info("SCHEDULER_ARMED monitoring=on intervalSeconds={} firstRun={}",
                        interval.getSeconds(), formatDisplay(firstRun));
            } else {
                settingService.updateSetting(MonitorSettings.NEXT_CHECK_TIME, DISPLAY_STOPPED);
                log.info("SCHEDULER_ARMED monitoring=off");
            }
            armed = true;
        }
    }

    public void startMonitor() {
        settingService.updateSetting(MonitorSettings.MONITOR_ACTIVE, "1");
        start();
    }

    /**
     * Turns monitoring off. A pass already running finishes; no further ticks happen.
     */
    public void stop() {
        settingService.updateSetting(MonitorSettings.MONITOR_ACTIVE, "0");
        start();
    }

    /**
     * Queues one immediate pass. Periodic registration is left as it is.
     */
    public void runOnce() {
        monitorTaskScheduler.schedule(() -> runPass("manual"), clock.instant());
        log.info("MONITOR_PASS_QUEUED trigger=manual");
    }

    /**
     * Checks one collection in the background, whatever its active or archived flags.
     *
     * @throws BusinessException when the check queue is full
     */
    public void checkSingle(Long monitorId) {
        try {
            monitorCheckExecutor.execute(() -> runSingleCheck(monitorId));
        } catch (RejectedExecutionException e) {
            log.warn("SINGLE_CHECK_REJECTED monitorId={}", monitorId);
            throw new BusinessException("429", "检查任务过多", "请稍后重试", e);
        }
        log.info("SINGLE_CHECK_QUEUED monitorId={}", monitorId);
    }

    /**
     * Queues the first check of a newly added collection. A full queue only skips it; the next
     * periodic pass covers the collection anyway.
     *
     * @return whether the check was queued
     */
    public boolean checkAfterAdd(Long monitorId) {
        try {
            checkSingle(monitorId);
            return true;
        } catch (BusinessException e) {
            log.warn("INITIAL_CHECK_SKIPPED monitorId={} reason={}", monitorId, e.getMessage());
            return false;
        }
    }

    /**
     * Applies saved setting changes that affect running components.
     */
    public void applySettingChanges(Collection<String> changedKeys) {
        if (changedKeys == null || changedKeys.isEmpty()) {
            return;
        }
        if (changedKeys.contains(MonitorSettings.DEBUG_MODE)) {
            logMaintenanceService.applyDebugMode(settingService.getSettings().isDebugMode());
        }
        if (changedKeys.contains(MonitorSettings.MONITOR_ACTIVE)
                || changedKeys.contains(MonitorSettings.GLOBAL_COOLDOWN)) {
            start();
        }
    }

    public SchedulerState getState() {
        if (!armed) {
            return SchedulerState.STOPPED;
        }
        return runningPasses.get() > 0 ? SchedulerState.RUNNING : SchedulerState.ARMED;
    }

    public boolean isJobRegistered(String jobId) {
        return jobs.containsKey(jobId);
    }

    @PreDestroy
    public void shutdown() {
        synchronized (lifecycleLock) {
            cancelAll();
            armed = false;
        }
        log.info("SCHEDULER_STOPPED");
    }

    void runPass(String trigger) {
        runningPasses.incrementAndGet();
        long startedAt = System.currentTimeMillis();
        try {
            settingService.updateSetting(MonitorSettings.NEXT_CHECK_TIME, DISPLAY_RUNNING);
            MonitorSettings settings = settingService.getSettings();
            List<MonitorEntity> monitors = monitorService.listActive();
            log.info("MONITOR_PASS_START trigger={} monitorCount={} batchSend={}",
                    trigger, monitors.size(), settings.isBatchSend());

            NotificationBatch batch = updateNotificationService.openBatch(settings);
            Duration cooldown = Duration.ofSeconds(settings.getItemCooldownSeconds());
            int updated = 0;
            int skipped = 0;
            int failed = 0;
            for (int i = 0; i < monitors.size(); i++) {
                if (i > 0 && !pause(cooldown)) {
                    log.warn("MONITOR_PASS_INTERRUPTED trigger={} checked={}", trigger, i);
                    break;
                }
                MonitorEntity monitor = monitors.get(i);
                try {
                    DetectionResult result = changeDetectionService.detect(monitor);
                    if (result.hasUpdate()) {
                        updated++;
                    } else if (result.getOutcome() == DetectionResult.Outcome.SKIPPED) {
                        skipped++;
                    }
                    batch.add(result);
                } catch (Exception e) {
                    failed++;
                    log.error("MONITOR_CHECK_FAILED monitorId={} name={}", monitor.getId(), monitor.getName(), e);
                }
            }

            try {
                batch.flush();
            } catch (Exception e) {
                log.error("MONITOR_NOTIFY_FLUSH_FAILED trigger={}", trigger, e);
            }
            recordPass(trigger);
            log.info("MONITOR_PASS_DONE trigger={} checked={} updated={} skipped={} failed={} costMs={}",
                    trigger, monitors.size(), updated, skipped, failed, System.currentTimeMillis() - startedAt);
        } finally {
            writeNextDisplay();
            runningPasses.decrementAndGet();
        }
    }

    void runSingleCheck(Long monitorId) {
        MonitorEntity monitor = monitorService.findById(monitorId);
        if (monitor == null) {
            log.warn("SINGLE_CHECK_SKIPPED monitorId={} reason=not_found", monitorId);
            return;
        }
        try {
            MonitorSettings settings = settingService.getSettings();
            DetectionResult result = changeDetectionService.detect(monitor);
            log.info("SINGLE_CHECK_DONE monitorId={} outcome={} delta={}",
                    monitorId, result.getOutcome(), result.getDelta());
            if (result.hasUpdate()) {
                updateNotificationService.notifyImmediately(settings, result);
            }
        } catch (Exception e) {
            log.error("SINGLE_CHECK_FAILED monitorId={}", monitorId, e);
        }
    }

    void runMaintenance() {
        try {
            logMaintenanceService.runDailyMaintenance(settingService.getSettings());
        } catch (Exception e) {
            log.error("LOG_MAINTENANCE_FAILED", e);
        }
    }

    /**
     * Next-run display after a pass: one interval from now while the periodic job is registered.
     */
    private void writeNextDisplay() {
        if (jobs.containsKey(MONITOR_JOB)) {
            int intervalSeconds = settingService.getSettings().getGlobalCooldownSeconds();
            Instant next = clock.instant().plusSeconds(intervalSeconds);
            settingService.updateSetting(MonitorSettings.NEXT_CHECK_TIME, formatDisplay(next));
        } else {
            settingService.updateSetting(MonitorSettings.NEXT_CHECK_TIME, DISPLAY_STOPPED);
        }
    }

    private boolean pause(Duration cooldown) {
        try {
            sleeper.sleep(cooldown);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void cancelAll() {
        for (Map.Entry<String, ScheduledFuture<?>> entry : jobs.entrySet()) {
            if (entry.getValue() != null) {
                entry.getValue().cancel(false);
            }
            log.debug("SCHEDULER_JOB_CANCELLED jobId={}", entry.getKey());
        }
        jobs.clear();
    }

    private String formatDisplay(Instant instant) {
        return displayFormatter.format(instant.atZone(clock.getZone()));
    }

    private void recordPass(String trigger) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter("tracker.pass.count", "trigger", trigger).increment();
        } catch (Exception ex) {
            log.debug("Pass counter failed", ex);
        }
    }
}
