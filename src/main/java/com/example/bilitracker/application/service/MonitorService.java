package com.example.bilitracker.application.service;

import com.example.bilitracker.api.request.LegacyImportRequest;
import com.example.bilitracker.common.exception.BusinessException;
import com.example.bilitracker.common.exception.RemoteApiException;
import com.example.bilitracker.domain.MonitorType;
import com.example.bilitracker.domain.model.CollectionInfo;
import com.example.bilitracker.domain.model.CollectionReference;
import com.example.bilitracker.infrastructure.persistence.entity.MonitorEntity;
import com.example.bilitracker.infrastructure.persistence.mapper.MonitorMapper;
import com.example.bilitracker.infrastructure.remote.BiliApiClient;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class MonitorService {

    private static final Logger log = LoggerFactory.getLogger(MonitorService.class);

    private final MonitorMapper monitorMapper;
    private final BiliApiClient biliApiClient;
    private final Clock clock;

    @Autowired
    public MonitorService(MonitorMapper monitorMapper, BiliApiClient biliApiClient) {
        this(monitorMapper, biliApiClient, Clock.systemUTC());
    }

    MonitorService(MonitorMapper monitorMapper, BiliApiClient biliApiClient, Clock clock) {
        this.monitorMapper = monitorMapper;
        this.biliApiClient = biliApiClient;
        this.clock = clock;
    }

    /**
     * Registers the collection a URL points at. The stored total starts at the current remote total,
     * so videos published before this call are never reported as updates.
     */
    public MonitorEntity addMonitor(String url) {
        CollectionReference reference = biliApiClient.parseReference(url);
        String type = reference.getType().getCode();
        if (monitorMapper.countByRemoteIdAndType(reference.getRemoteId(), type) > 0) {
            throw new BusinessException("409", "该合集已在监控列表中", "无需重复添加");
        }

        CollectionInfo info;
        try {
            info = biliApiClient.fetchInfo(type, reference.getRemoteId(), reference.getOwnerId());
        } catch (RemoteApiException e) {
            log.warn("MONITOR_ADD_REMOTE_FAILED url={} status={}", e.getUrl(), e.getStatusCode());
            throw new BusinessException("REMOTE_UNAVAILABLE", "B站接口暂时不可用", "请稍后重试", e);
        }
        if (info == null) {
            throw new BusinessException("404", "未获取到合集信息", "请确认合集链接是否正确");
        }

        MonitorEntity entity = new MonitorEntity();
        entity.setMid(reference.getOwnerId());
        entity.setRemoteId(reference.getRemoteId());
        entity.setType(type);
        entity.setName(info.getName());
        entity.setCover(info.getCover());
        entity.setDescription(info.getDescription());
        entity.setTotalCount(info.getTotal());
        entity.setLastCheckTs(clock.instant().getEpochSecond());
        entity.setIsActive(1);
        entity.setArchived(0);
        monitorMapper.insert(entity);
        log.info("MONITOR_ADDED id={} type={} remoteId={} mid={} total={}",
                entity.getId(), type, entity.getRemoteId(), entity.getMid(), entity.getTotalCount());
        return entity;
    }

    /**
     * Imports collections from the earlier tracker's export without calling the provider. Items
     * missing an owner or collection id, with an unknown type, or already tracked are skipped.
     *
     * @return number of collections imported
     */
    public int importLegacy(LegacyImportRequest request) {
        if (request == null || request.getData() == null
                || request.getData().getSeasons() == null || request.getData().getSeasons().isEmpty()) {
            throw new BusinessException("400", "无效的数据格式", "请检查导入的数据");
        }
        long now = clock.instant().getEpochSecond();
        int imported = 0;
        for (LegacyImportRequest.LegacyItem item : request.getData().getSeasons()) {
            if (item == null) {
                continue;
            }
            String remoteId = StringUtils.hasText(item.getSeriesId()) ? item.getSeriesId() : item.getSeasonId();
            MonitorType type = MonitorType.fromCode(StringUtils.hasText(item.getType()) ? item.getType() : "series");
            if (!StringUtils.hasText(item.getMid()) || !StringUtils.hasText(remoteId) || type == null) {
                log.debug("LEGACY_IMPORT_SKIPPED mid={} remoteId={} type={}", item.getMid(), remoteId, item.getType());
                continue;
            }
            if (monitorMapper.countByRemoteIdAndType(remoteId.trim(), type.getCode()) > 0) {
                continue;
            }

            MonitorEntity entity = new MonitorEntity();
            entity.setMid(item.getMid().trim());
            entity.setRemoteId(remoteId.trim());
            entity.setType(type.getCode());
            entity.setName(item.getName() == null ? "" : item.getName());
            entity.setCover(item.getCover() == null ? "" : item.getCover());
            entity.setDescription("");
            Integer total = item.getTotal() != null ? item.getTotal() : item.getLastEpisodeCount();
            entity.setTotalCount(total == null ? 0 : total);
            entity.setLastCheckTs(now);
            entity.setIsActive(1);
            entity.setArchived(0);
            try {
                monitorMapper.insert(entity);
                imported++;
            } catch (DuplicateKeyException e) {
                log.debug("LEGACY_IMPORT_DUPLICATE remoteId={} type={}", entity.getRemoteId(), entity.getType());
            }
        }
        log.info("LEGACY_IMPORT_DONE received={} imported={}", request.getData().getSeasons().size(), imported);
        return imported;
    }

    public MonitorEntity findById(Long id) {
        return id == null ? null : monitorMapper.selectById(id);
    }

    public MonitorEntity requireMonitor(Long id) {
        MonitorEntity entity = findById(id);
        if (entity == null) {
            throw new BusinessException("404", "监控项不存在", "请刷新后重试");
        }
        return entity;
    }

    public List<MonitorEntity> listAll() {
        return monitorMapper.selectAll();
    }

    /**
     * Active, non-archived collections, newest registration first. This is the pass order.
     */
    public List<MonitorEntity> listActive() {
        return monitorMapper.selectActive();
    }

    public List<MonitorEntity> listArchived() {
        return monitorMapper.selectArchived();
    }

    public int countAll() {
        return monitorMapper.countAll();
    }

    public int countActive() {
        return monitorMapper.countActive();
    }

    public void deleteMonitor(Long id) {
        MonitorEntity entity = requireMonitor(id);
        monitorMapper.deleteById(id);
        log.info("MONITOR_DELETED id={} name={}", id, entity.getName());
    }

    public MonitorEntity setActive(Long id, boolean active) {
        requireMonitor(id);
        monitorMapper.updateActive(id, active ? 1 : 0);
        log.info("MONITOR_ACTIVE_CHANGED id={} active={}", id, active);
        return monitorMapper.selectById(id);
    }

    /**
     * Archiving also pauses the collection; un-archiving leaves it paused.
     */
    public MonitorEntity setArchived(Long id, boolean archived) {
        requireMonitor(id);
        if (archived) {
            monitorMapper.archive(id);
        } else {
            monitorMapper.unarchive(id);
        }
        log.info("MONITOR_ARCHIVE_CHANGED id={} archived={}", id, archived);
        return monitorMapper.selectById(id);
    }

    public void updateStatus(Long id, int totalCount, long lastCheckTs) {
        monitorMapper.updateStatus(id, totalCount, lastCheckTs);
    }

    public void touchLastCheck(Long id, long lastCheckTs) {
        monitorMapper.touchLastCheck(id, lastCheckTs);
    }
}
