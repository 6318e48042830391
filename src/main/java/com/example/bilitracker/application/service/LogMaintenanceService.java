package com.example.bilitracker.application.service;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.FileAppender;
import com.example.bilitracker.common.config.AppTrackerProperties;
import com.example.bilitracker.domain.model.MonitorSettings;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Service;

/**
 * Daily rotation and retention of the application log file, plus the runtime debug switch.
 */
@Service
public class LogMaintenanceService {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(LogMaintenanceService.class);

    static final String APP_LOGGER = "com.example.bilitracker";

    private static final DateTimeFormatter BACKUP_SUFFIX = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final AppTrackerProperties appTrackerProperties;
    private final LoggingSystem loggingSystem;
    private final Clock clock;

    @Autowired
    public LogMaintenanceService(AppTrackerProperties appTrackerProperties, LoggingSystem loggingSystem) {
        this(appTrackerProperties, loggingSystem, Clock.systemDefaultZone());
    }

    LogMaintenanceService(AppTrackerProperties appTrackerProperties, LoggingSystem loggingSystem, Clock clock) {
        this.appTrackerProperties = appTrackerProperties;
        this.loggingSystem = loggingSystem;
        this.clock = clock;
    }

    /**
     * Rotates then cleans, when {@code log_auto_clean} is on.
     */
    public void runDailyMaintenance(MonitorSettings settings) {
        if (!settings.isLogAutoClean()) {
            log.info("LOG_MAINTENANCE_SKIPPED reason=auto_clean_disabled");
            return;
        }
        log.info("LOG_MAINTENANCE_START retentionDays={}", settings.getLogRetentionDays());
        rotateCurrentLog();
        int removed = cleanExpiredLogs(settings.getLogRetentionDays());
        log.info("LOG_MAINTENANCE_DONE removedBackups={}", removed);
    }

    /**
     * Renames the active log file to {@code <base>_yyyyMMdd_HHmmss.log} (its last-modified time) and lets
     * the file appender start a fresh one.
     *
     * @return the backup file, or null when there was nothing to rotate or the rename failed
     */
    public Path rotateCurrentLog() {
        Path current = currentLogFile();
        if (!Files.exists(current)) {
            log.info("LOG_ROTATE_SKIPPED reason=no_current_file file={}", current);
            return null;
        }

        List<FileAppender<ILoggingEvent>> appenders = findFileAppenders(current);
        Path backup;
        try {
            Instant modified = Files.getLastModifiedTime(current).toInstant();
            backup = current.resolveSibling(baseName() + "_"
                    + BACKUP_SUFFIX.format(modified.atZone(clock.getZone())) + ".log");
            for (FileAppender<ILoggingEvent> appender : appenders) {
                appender.stop();
            }
            Files.move(current, backup);
        } catch (IOException e) {
            restart(appenders);
            log.error("LOG_ROTATE_FAILED file={} reason={}", current, e.getMessage(), e);
            return null;
        }
        restart(appenders);
        log.info("LOG_ROTATED backup={}", backup);
        return backup;
    }

    /**
     * Deletes {@code *.log} files in the log directory, except the active one, last modified more than
     * {@code retentionDays} days ago.
     *
     * @return number of deleted files
     */
    public int cleanExpiredLogs(int retentionDays) {
        Path dir = logDir();
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        Instant expireBefore = clock.instant().minus(Duration.ofDays(Math.max(0, retentionDays)));
        String currentName = appTrackerProperties.getLogFileName();
        int deleted = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.log")) {
            for (Path file : stream) {
                if (file.getFileName().toString().equals(currentName)) {
                    continue;
                }
                Instant modified = Files.getLastModifiedTime(file).toInstant();
                if (modified.isBefore(expireBefore)) {
                    Files.deleteIfExists(file);
                    deleted++;
                    log.info("LOG_BACKUP_DELETED file={}", file.getFileName());
                }
            }
        } catch (IOException e) {
            log.error("LOG_CLEAN_FAILED dir={} reason={}", dir, e.getMessage(), e);
        }
        return deleted;
    }

    public void applyDebugMode(boolean debug) {
        loggingSystem.setLogLevel(APP_LOGGER, debug ? LogLevel.DEBUG : LogLevel.INFO);
        log.info("LOG_LEVEL_CHANGED logger={} debug={}", APP_LOGGER, debug);
    }

    Path currentLogFile() {
        return logDir().resolve(appTrackerProperties.getLogFileName());
    }

    private Path logDir() {
        return Paths.get(appTrackerProperties.getLogDir());
    }

    private String baseName() {
        String name = appTrackerProperties.getLogFileName();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static void restart(List<FileAppender<ILoggingEvent>> appenders) {
        for (FileAppender<ILoggingEvent> appender : appenders) {
            if (!appender.isStarted()) {
                appender.start();
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static List<FileAppender<ILoggingEvent>> findFileAppenders(Path file) {
        List<FileAppender<ILoggingEvent>> result = new ArrayList<>();
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext)) {
            return result;
        }
        Path target = file.toAbsolutePath().normalize();
        for (Logger logger : ((LoggerContext) factory).getLoggerList()) {
            Iterator<Appender<ILoggingEvent>> it = logger.iteratorForAppenders();
            while (it.hasNext()) {
                Appender<ILoggingEvent> appender = it.next();
                if (appender instanceof FileAppender && !result.contains(appender)) {
                    FileAppender<ILoggingEvent> fileAppender = (FileAppender<ILoggingEvent>) appender;
                    if (fileAppender.getFile() != null
                            && Paths.get(fileAppender.getFile()).toAbsolutePath().normalize().equals(target)) {
                        result.add(fileAppender);
                    }
                }
            }
        }
        return result;
    }
}
