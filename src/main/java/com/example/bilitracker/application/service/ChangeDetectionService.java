package com.example.bilitracker.application.service;

import com.example.bilitracker.common.exception.RemoteApiException;
import com.example.bilitracker.domain.model.AppendResult;
import com.example.bilitracker.domain.model.CollectionInfo;
import com.example.bilitracker.domain.model.DetectionResult;
import com.example.bilitracker.domain.model.RemoteVideo;
import com.example.bilitracker.infrastructure.persistence.entity.MonitorEntity;
import com.example.bilitracker.infrastructure.remote.BiliApiClient;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Compares one collection's stored total with the remote one and records the difference.
 */
@Service
public class ChangeDetectionService {

    private static final Logger log = LoggerFactory.getLogger(ChangeDetectionService.class);

    private final BiliApiClient biliApiClient;
    private final MonitorService monitorService;
    private final VideoUpdateService videoUpdateService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Autowired
    public ChangeDetectionService(BiliApiClient biliApiClient,
                                  MonitorService monitorService,
                                  VideoUpdateService videoUpdateService,
                                  ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this(biliApiClient, monitorService, videoUpdateService, meterRegistryProvider.getIfAvailable(),
                Clock.systemUTC());
    }

    ChangeDetectionService(BiliApiClient biliApiClient,
                           MonitorService monitorService,
                           VideoUpdateService videoUpdateService,
                           MeterRegistry meterRegistry,
                           Clock clock) {
        this.biliApiClient = biliApiClient;
        this.monitorService = monitorService;
        this.videoUpdateService = videoUpdateService;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Stored total T, remote total R:
     * info unavailable leaves the row untouched; R &lt;= T only refreshes the check time;
     * R &gt; T fetches exactly R - T newest videos, appends them and stores R whatever the append outcome.
     */
    public DetectionResult detect(MonitorEntity monitor) {
        DetectionResult result = new DetectionResult();
        result.setMonitorId(monitor.getId());
        result.setName(monitor.getName());
        result.setOwnerId(monitor.getMid());
        result.setRemoteId(monitor.getRemoteId());
        result.setType(monitor.getType());
        int storedTotal = monitor.getTotalCount() == null ? 0 : monitor.getTotalCount();
        result.setPreviousTotal(storedTotal);

        CollectionInfo info;
        try {
            info = biliApiClient.fetchInfo(monitor.getType(), monitor.getRemoteId(), monitor.getMid());
        } catch (RemoteApiException e) {
            log.warn("DETECT_SKIPPED monitorId={} name={} reason=remote_failure url={} status={}",
                    monitor.getId(), monitor.getName(), e.getUrl(), e.getStatusCode());
            result.setOutcome(DetectionResult.Outcome.SKIPPED);
            return result;
        }
        if (info == null) {
            log.warn("DETECT_SKIPPED monitorId={} name={} reason=no_info", monitor.getId(), monitor.getName());
            result.setOutcome(DetectionResult.Outcome.SKIPPED);
            return result;
        }

        long now = clock.instant().getEpochSecond();
        int remoteTotal = info.getTotal();
        if (remoteTotal <= storedTotal) {
            monitorService.touchLastCheck(monitor.getId(), now);
            result.setOutcome(DetectionResult.Outcome.UNCHANGED);
            result.setRemoteTotal(storedTotal);
            result.setUpdateTime(now);
            log.debug("DETECT_UNCHANGED monitorId={} stored={} remote={}", monitor.getId(), storedTotal, remoteTotal);
            return result;
        }

        int delta = remoteTotal - storedTotal;
        log.info("DETECT_UPDATED monitorId={} name={} stored={} remote={} delta={}",
                monitor.getId(), monitor.getName(), storedTotal, remoteTotal, delta);
        List<RemoteVideo> videos = biliApiClient.fetchLatestVideos(
                monitor.getType(), monitor.getRemoteId(), monitor.getMid(), delta);

        int persisted = 0;
        for (RemoteVideo video : videos) {
            AppendResult appendResult = videoUpdateService.appendUpdate(monitor.getId(), video.getVideoId(),
                    video.getTitle(), video.getPublishTime(), video.getCover());
            if (appendResult.isSuccess()) {
                persisted++;
            } else {
                log.info("DETECT_APPEND_REJECTED monitorId={} videoId={} reason={}",
                        monitor.getId(), video.getVideoId(), appendResult.getMessage());
            }
        }
        monitorService.updateStatus(monitor.getId(), remoteTotal, now);
        recordUpdates(delta);

        result.setOutcome(DetectionResult.Outcome.UPDATED);
        result.setRemoteTotal(remoteTotal);
        result.setVideos(videos);
        result.setPersistedCount(persisted);
        result.setUpdateTime(videos.isEmpty() ? now : videos.get(0).getPublishTime());
        return result;
    }

    private void recordUpdates(int delta) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter("tracker.updates.detected").increment(delta);
        } catch (Exception ex) {
            log.debug("Update counter failed", ex);
        }
    }
}
