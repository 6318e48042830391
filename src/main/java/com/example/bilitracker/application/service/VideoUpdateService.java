package com.example.bilitracker.application.service;

import com.example.bilitracker.domain.model.AppendResult;
import com.example.bilitracker.domain.model.UpdateStats;
import com.example.bilitracker.infrastructure.cache.CoverCacheEvictor;
import com.example.bilitracker.infrastructure.persistence.entity.VideoUpdateEntity;
import com.example.bilitracker.infrastructure.persistence.mapper.VideoUpdateMapper;
import com.example.bilitracker.infrastructure.persistence.model.PublishTimeRow;
import com.example.bilitracker.infrastructure.persistence.model.RecentUpdateRow;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class VideoUpdateService {

    private static final Logger log = LoggerFactory.getLogger(VideoUpdateService.class);

    static final String DUPLICATE_MESSAGE = "该视频已存在记录";

    private final VideoUpdateMapper videoUpdateMapper;
    private final SettingService settingService;
    private final CoverCacheEvictor coverCacheEvictor;
    private final UpdateIntervalEstimator updateIntervalEstimator;

    public VideoUpdateService(VideoUpdateMapper videoUpdateMapper,
                              SettingService settingService,
                              CoverCacheEvictor coverCacheEvictor,
                              UpdateIntervalEstimator updateIntervalEstimator) {
        this.videoUpdateMapper = videoUpdateMapper;
        this.settingService = settingService;
        this.coverCacheEvictor = coverCacheEvictor;
        this.updateIntervalEstimator = updateIntervalEstimator;
    }

    /**
     * Appends one update record, then trims the table to the configured retention limit.
     * A video id that is already recorded is reported as a failed append, never thrown.
     */
    public AppendResult appendUpdate(Long monitorId, String videoId, String title, long publishTime, String cover) {
        if (!StringUtils.hasText(videoId)) {
            return AppendResult.failure("视频ID为空");
        }
        if (videoUpdateMapper.countByVideoId(videoId) > 0) {
            log.debug("VIDEO_UPDATE_DUPLICATE monitorId={} videoId={}", monitorId, videoId);
            return AppendResult.failure(DUPLICATE_MESSAGE);
        }

        VideoUpdateEntity entity = new VideoUpdateEntity();
        entity.setMonitorId(monitorId);
        entity.setVideoId(videoId);
        entity.setVideoTitle(title);
        entity.setPublishTime(publishTime);
        entity.setCover(cover);
        try {
            videoUpdateMapper.insert(entity);
        } catch (DuplicateKeyException e) {
            // lost a race with a concurrent check of the same collection
            log.debug("VIDEO_UPDATE_DUPLICATE monitorId={} videoId={} race=true", monitorId, videoId);
            return AppendResult.failure(DUPLICATE_MESSAGE);
        }
        log.info("VIDEO_UPDATE_RECORDED monitorId={} videoId={} publishTime={}", monitorId, videoId, publishTime);

        purgeBeyondLimit(settingService.getSettings().getRecentUpdatesSaveLimit());
        return AppendResult.success("记录成功");
    }

    /**
     * Deletes every record past the newest {@code keep} (by publish time) and their cached covers.
     *
     * @return number of records deleted
     */
    public int purgeBeyondLimit(int keep) {
        List<VideoUpdateEntity> expired = videoUpdateMapper.selectBeyondNewest(Math.max(0, keep));
        if (expired.isEmpty()) {
            return 0;
        }
        List<Long> ids = new ArrayList<>(expired.size());
        List<String> covers = new ArrayList<>(expired.size());
        for (VideoUpdateEntity entity : expired) {
            ids.add(entity.getId());
            if (StringUtils.hasText(entity.getCover())) {
                covers.add(entity.getCover());
            }
        }
        int deleted = videoUpdateMapper.deleteByIds(ids);
        int evicted = coverCacheEvictor.evict(covers);
        log.info("VIDEO_UPDATE_PURGED keep={} deleted={} coversEvicted={}", keep, deleted, evicted);
        return deleted;
    }

    /**
     * @param limit list size; the {@code recent_updates_limit} setting when null or not positive
     */
    public List<RecentUpdateRow> listRecent(Integer limit) {
        int effective = limit == null || limit <= 0
                ? settingService.getSettings().getRecentUpdatesLimit()
                : limit;
        return videoUpdateMapper.selectRecent(effective);
    }

    public List<Long> getTimestamps(Long monitorId) {
        return videoUpdateMapper.selectPublishTimes(monitorId);
    }

    /**
     * Publish times per monitor, newest first. Every requested id is present, possibly with an empty list.
     */
    public Map<Long, List<Long>> getTimestampsBatch(Collection<Long> monitorIds) {
        Map<Long, List<Long>> result = new LinkedHashMap<>();
        if (monitorIds == null || monitorIds.isEmpty()) {
            return result;
        }
        for (Long monitorId : monitorIds) {
            result.put(monitorId, new ArrayList<>());
        }
        for (PublishTimeRow row : videoUpdateMapper.selectPublishTimesByMonitorIds(result.keySet())) {
            List<Long> timestamps = result.get(row.getMonitorId());
            if (timestamps != null) {
                timestamps.add(row.getPublishTime() == null ? 0L : row.getPublishTime());
            }
        }
        return result;
    }

    public UpdateStats getStats(Long monitorId) {
        return updateIntervalEstimator.estimate(getTimestamps(monitorId));
    }

    public Map<Long, UpdateStats> getStatsBatch(Collection<Long> monitorIds) {
        if (monitorIds == null || monitorIds.isEmpty()) {
            return Collections.emptyMap();
        }
        return updateIntervalEstimator.estimateBatch(monitorIds, getTimestampsBatch(monitorIds));
    }
}
