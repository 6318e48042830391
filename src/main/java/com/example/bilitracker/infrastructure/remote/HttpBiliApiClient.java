package com.example.bilitracker.infrastructure.remote;

import com.example.bilitracker.common.config.AppRemoteProperties;
import com.example.bilitracker.common.exception.RemoteApiException;
import com.example.bilitracker.common.exception.ValidationException;
import com.example.bilitracker.common.util.Sleeper;
import com.example.bilitracker.domain.MonitorType;
import com.example.bilitracker.domain.model.CollectionInfo;
import com.example.bilitracker.domain.model.CollectionReference;
import com.example.bilitracker.domain.model.RemoteVideo;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.PreDestroy;
import org.apache.http.HttpEntity;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

@Component
public class HttpBiliApiClient implements BiliApiClient {

    private static final Logger log = LoggerFactory.getLogger(HttpBiliApiClient.class);

    private static final Pattern SPACE_OWNER_PATTERN = Pattern.compile("space\\.bilibili\\.com/(\\d+)");
    private static final String UNTITLED_VIDEO = "未命名视频";

    private final AppRemoteProperties appRemoteProperties;
    private final ObjectMapper objectMapper;
    private final CloseableHttpClient httpClient;
    private final Sleeper sleeper;
    private final MeterRegistry meterRegistry;

    @Autowired
    public HttpBiliApiClient(AppRemoteProperties appRemoteProperties,
                             ObjectMapper objectMapper,
                             ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this(appRemoteProperties, objectMapper, buildHttpClient(), Sleeper.threadSleeper(),
                meterRegistryProvider.getIfAvailable());
    }

    HttpBiliApiClient(AppRemoteProperties appRemoteProperties,
                      ObjectMapper objectMapper,
                      CloseableHttpClient httpClient,
                      Sleeper sleeper,
                      MeterRegistry meterRegistry) {
        this.appRemoteProperties = appRemoteProperties;
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
        this.sleeper = sleeper;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public CollectionInfo fetchInfo(String type, String remoteId, String ownerId) {
        MonitorType monitorType = requireType(type);
        if (monitorType == MonitorType.SERIES) {
            return fetchSeriesInfo(remoteId, ownerId);
        }
        return fetchSeasonInfo(remoteId, ownerId);
    }

    @Override
    public List<RemoteVideo> fetchLatestVideos(String type, String remoteId, String ownerId, int count) {
        MonitorType monitorType = requireType(type);
        if (count <= 0) {
            return Collections.emptyList();
        }
        String url;
        if (monitorType == MonitorType.SEASON) {
            url = appRemoteProperties.getApiBaseUrl()
                    + "/x/polymer/web-space/seasons_archives_list?mid=" + ownerId
                    + "&season_id=" + remoteId
                    + "&sort_reverse=true&page_size=" + count + "&page_num=1";
        } else {
            url = appRemoteProperties.getApiBaseUrl()
                    + "/x/polymer/web-space/home/seasons_series?mid=" + ownerId
                    + "&series_id=" + remoteId
                    + "&sort_reverse=true&page_size=" + count + "&page_num=1";
        }

        JsonNode root;
        try {
            root = getJson(url, ownerId, appRemoteProperties.getBulkTimeoutMs());
        } catch (RemoteApiException e) {
            log.warn("BILI_LATEST_VIDEOS_FAILED type={} remoteId={} url={} status={}",
                    type, remoteId, e.getUrl(), e.getStatusCode());
            return Collections.emptyList();
        }
        if (!isOk(root)) {
            log.debug("BILI_LATEST_VIDEOS_EMPTY type={} remoteId={} code={}", type, remoteId, root.path("code"));
            return Collections.emptyList();
        }
        JsonNode archives = root.path("data").path("archives");
        if (!archives.isArray()) {
            return Collections.emptyList();
        }

        List<RemoteVideo> videos = new ArrayList<>();
        for (JsonNode archive : archives) {
            RemoteVideo video = toRemoteVideo(archive);
            if (video != null) {
                videos.add(video);
            }
        }
        log.debug("BILI_LATEST_VIDEOS type={} remoteId={} requested={} returned={}",
                type, remoteId, count, videos.size());
        return videos;
    }

    @Override
    public CollectionReference parseReference(String url) {
        if (!StringUtils.hasText(url)) {
            throw new ValidationException("URL不能为空");
        }
        String trimmed = url.trim();
        UriComponents components;
        try {
            components = UriComponentsBuilder.fromUriString(trimmed).build();
        } catch (IllegalArgumentException e) {
            throw new ValidationException("URL解析失败: " + e.getMessage(), e);
        }

        // /{mid}/lists/{id}
        List<String> segments = components.getPathSegments();
        String ownerId = null;
        String remoteId = null;
        if (segments.size() >= 3 && "lists".equals(segments.get(1))) {
            ownerId = segments.get(0);
            remoteId = segments.get(2);
        } else if (trimmed.contains("space.bilibili.com")) {
            Matcher matcher = SPACE_OWNER_PATTERN.matcher(trimmed);
            if (matcher.find()) {
                ownerId = matcher.group(1);
            }
        }
        MonitorType type = MonitorType.fromCode(components.getQueryParams().getFirst("type"));

        if (!StringUtils.hasText(ownerId) || !StringUtils.hasText(remoteId) || type == null) {
            log.debug("BILI_URL_REJECTED url={} ownerId={} remoteId={} type={}", trimmed, ownerId, remoteId, type);
            throw new ValidationException("无法从URL中提取有效信息: " + trimmed);
        }
        return new CollectionReference(ownerId, remoteId, type);
    }

    @PreDestroy
    public void close() {
        try {
            httpClient.close();
        } catch (IOException e) {
            log.warn("Close bili http client failed", e);
        }
    }

    private CollectionInfo fetchSeriesInfo(String seriesId, String ownerId) {
        String url = appRemoteProperties.getApiBaseUrl() + "/x/series/series?series_id=" + seriesId;
        JsonNode root = getJson(url, ownerId, appRemoteProperties.getInfoTimeoutMs());
        JsonNode meta = root.path("data").path("meta");
        if (!isOk(root) || !meta.isObject()) {
            log.info("BILI_INFO_UNAVAILABLE type=series remoteId={} code={}", seriesId, root.path("code"));
            return null;
        }
        return new CollectionInfo(
                normalizeName(meta.path("name").asText("")),
                meta.path("description").asText(""),
                meta.path("total").asInt(0),
                meta.path("cover").asText(""),
                meta.path("last_update_ts").asLong(0L));
    }

    private CollectionInfo fetchSeasonInfo(String seasonId, String ownerId) {
        String url = appRemoteProperties.getApiBaseUrl()
                + "/x/polymer/web-space/seasons_archives_list?mid=" + ownerId
                + "&season_id=" + seasonId
                + "&sort_reverse=false&page_size=1&page_num=1";
        JsonNode root = getJson(url, ownerId, appRemoteProperties.getInfoTimeoutMs());
        JsonNode data = root.path("data");
        JsonNode meta = data.path("meta");
        if (!isOk(root) || !meta.isObject()) {
            log.info("BILI_INFO_UNAVAILABLE type=season remoteId={} code={}", seasonId, root.path("code"));
            return null;
        }
        long lastUpdate = 0L;
        for (JsonNode archive : data.path("archives")) {
            lastUpdate = Math.max(lastUpdate, archive.path("pubdate").asLong(0L));
        }
        return new CollectionInfo(
                normalizeName(meta.path("name").asText("")),
                meta.path("description").asText(""),
                meta.path("total").asInt(0),
                meta.path("cover").asText(""),
                lastUpdate);
    }

    /**
     * GET with bounded retries. Non-200 answers and I/O failures, unreadable JSON included, are retried
     * after {@code backoffBaseSeconds * 2^attempt}; there is no pause after the last attempt.
     */
    private JsonNode getJson(String url, String ownerId, int timeoutMs) {
        int maxAttempts = Math.max(1, appRemoteProperties.getMaxAttempts());
        Integer lastStatus = null;
        Exception lastError = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            HttpGet httpGet = new HttpGet(url);
            httpGet.setConfig(RequestConfig.custom()
                    .setConnectTimeout(timeoutMs)
                    .setConnectionRequestTimeout(timeoutMs)
                    .setSocketTimeout(timeoutMs)
                    .build());
            httpGet.setHeader("User-Agent", appRemoteProperties.getUserAgent());
            httpGet.setHeader("Origin", appRemoteProperties.getSpaceBaseUrl());
            httpGet.setHeader("Referer", appRemoteProperties.getSpaceBaseUrl() + "/" + ownerId);

            try (CloseableHttpResponse response = httpClient.execute(httpGet)) {
                int statusCode = response.getStatusLine().getStatusCode();
                lastStatus = statusCode;
                if (statusCode == 200) {
                    HttpEntity entity = response.getEntity();
                    String body = entity == null ? "" : EntityUtils.toString(entity, StandardCharsets.UTF_8);
                    JsonNode root = objectMapper.readTree(body);
                    if (root == null || root.isMissingNode()) {
                        throw new IOException("empty response body");
                    }
                    return root;
                }
                EntityUtils.consumeQuietly(response.getEntity());
                lastError = null;
                log.warn("BILI_API_STATUS_FAILED url={} status={} attempt={}/{}",
                        url, statusCode, attempt + 1, maxAttempts);
            } catch (IOException e) {
                lastError = e;
                log.warn("BILI_API_REQUEST_FAILED url={} attempt={}/{} reason={}",
                        url, attempt + 1, maxAttempts, e.getMessage());
            }

            if (attempt < maxAttempts - 1) {
                backoff(url, attempt);
            }
        }
        recordFailure();
        throw new RemoteApiException("B站接口请求失败: " + url, url, lastStatus, lastError);
    }

    private void backoff(String url, int attempt) {
        long seconds = (long) Math.max(0, appRemoteProperties.getBackoffBaseSeconds()) << attempt;
        log.debug("BILI_API_BACKOFF url={} seconds={}", url, seconds);
        try {
            sleeper.sleep(Duration.ofSeconds(seconds));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteApiException("B站接口重试被中断: " + url, url, null, e);
        }
    }

    private RemoteVideo toRemoteVideo(JsonNode archive) {
        if (archive == null || !archive.isObject()) {
            return null;
        }
        JsonNode aid = archive.get("aid");
        if (aid == null || aid.isNull() || !StringUtils.hasText(aid.asText()) || "0".equals(aid.asText())) {
            log.debug("BILI_ARCHIVE_SKIPPED reason=missing_aid");
            return null;
        }
        JsonNode title = archive.get("title");
        return new RemoteVideo(
                aid.asText(),
                title == null || title.isNull() ? UNTITLED_VIDEO : title.asText(),
                archive.path("pubdate").asLong(0L),
                archive.path("pic").asText(""));
    }

    private MonitorType requireType(String type) {
        MonitorType monitorType = MonitorType.fromCode(type);
        if (monitorType == null) {
            throw new ValidationException("无效的监控类型: " + type);
        }
        return monitorType;
    }

    private void recordFailure() {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter("tracker.remote.failures").increment();
        } catch (Exception ex) {
            log.debug("Remote failure counter failed", ex);
        }
    }

    static String normalizeName(String name) {
        return name.replace("合集· ", "").replace("合集·", "");
    }

    private static boolean isOk(JsonNode root) {
        return root.path("code").asInt(-1) == 0;
    }

    private static CloseableHttpClient buildHttpClient() {
        PoolingHttpClientConnectionManager cm = new PoolingHttpClientConnectionManager();
        cm.setMaxTotal(20);
        cm.setDefaultMaxPerRoute(10);
        return HttpClients.custom()
                .setConnectionManager(cm)
                .build();
    }
}
