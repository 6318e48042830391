package com.example.bilitracker.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.bilitracker.common.config.AppRemoteProperties;
import com.example.bilitracker.domain.model.DetectionResult;
import com.example.bilitracker.domain.model.MailSettings;
import com.example.bilitracker.domain.model.MonitorSettings;
import com.example.bilitracker.domain.model.RemoteVideo;
import com.example.bilitracker.infrastructure.mail.MailNotifier;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class UpdateNotificationServiceTest {

    private MailNotifier mailNotifier;
    private UpdateNotificationService service;

    @BeforeEach
    void setUp() {
        mailNotifier = mock(MailNotifier.class);
        when(mailNotifier.send(any(MailSettings.class), anyString(), anyString())).thenReturn(true);
        service = new UpdateNotificationService(mailNotifier, new AppRemoteProperties(),
                Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void batchedPassShouldSendOneAggregateMail() {
        NotificationBatch batch = service.openBatch(settings(true, true));

        batch.add(updated(1L, "周更日常", 10, 12));
        batch.add(unchanged(2L));
        batch.add(updated(3L, "番外", 4, 7));
        verify(mailNotifier, never()).send(any(MailSettings.class), anyString(), anyString());

        assertTrue(batch.flush());

        ArgumentCaptor<String> subject = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(mailNotifier, times(1)).send(any(MailSettings.class), subject.capture(), body.capture());
        assertEquals("[统一推送] 共检测到 2 个合集更新，新增 5 个视频", subject.getValue());
        assertTrue(body.getValue().contains("B站合集监控统一推送通知"));
        assertTrue(body.getValue().indexOf("周更日常") < body.getValue().indexOf("番外"));
        assertTrue(body.getValue().contains("https://space.bilibili.com/123/lists/3?type=season"));
    }

    @Test
    void flushWithoutUpdatesShouldSendNothing() {
        NotificationBatch batch = service.openBatch(settings(true, true));
        batch.add(unchanged(2L));

        assertFalse(batch.flush());
        verify(mailNotifier, never()).send(any(MailSettings.class), anyString(), anyString());
    }

    @Test
    void immediatePassShouldSendOneMailPerUpdatedCollection() {
        NotificationBatch batch = service.openBatch(settings(true, false));

        batch.add(updated(1L, "周更日常", 10, 12));
        batch.add(updated(3L, "番外", 4, 7));
        assertFalse(batch.flush());

        verify(mailNotifier).send(any(MailSettings.class), eq("【更新】周更日常 更新了 2 个视频"), anyString());
        verify(mailNotifier).send(any(MailSettings.class), eq("【更新】番外 更新了 3 个视频"), anyString());
        verify(mailNotifier, times(2)).send(any(MailSettings.class), anyString(), anyString());
    }

    @Test
    void nothingShouldBeSentWhileMailDisabled() {
        NotificationBatch batched = service.openBatch(settings(false, true));
        batched.add(updated(1L, "周更日常", 10, 12));
        assertFalse(batched.flush());

        NotificationBatch immediate = service.openBatch(settings(false, false));
        immediate.add(updated(1L, "周更日常", 10, 12));

        verify(mailNotifier, never()).send(any(MailSettings.class), anyString(), anyString());
    }

    @Test
    void bodyShouldEscapeTitlesAndLinkVideos() {
        DetectionResult result = updated(1L, "周更", 0, 2);
        result.setVideos(Arrays.asList(
                new RemoteVideo("1001", "<b>第一集</b>", 1767225600L, ""),
                new RemoteVideo("BV1xx411c7mD", "第二集", 1767225600L, "")));

        service.notifyImmediately(settings(true, false), result);

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(mailNotifier).send(any(MailSettings.class), anyString(), body.capture());
        assertTrue(body.getValue().contains("https://www.bilibili.com/video/av1001"));
        assertTrue(body.getValue().contains("https://www.bilibili.com/video/BV1xx411c7mD"));
        assertTrue(body.getValue().contains("&lt;b&gt;第一集&lt;/b&gt;"));
        assertTrue(body.getValue().contains("2026-01-01 00:00"));
    }

    private static MonitorSettings settings(boolean mailEnabled, boolean batch) {
        Map<String, String> raw = new HashMap<>();
        raw.put(MonitorSettings.SMTP_ENABLE, mailEnabled ? "1" : "0");
        raw.put(MonitorSettings.SMTP_BATCH_SEND, batch ? "1" : "0");
        raw.put(MonitorSettings.EMAIL_ACCOUNT, "bot@example.com");
        raw.put(MonitorSettings.EMAIL_AUTH_CODE, "secret");
        raw.put(MonitorSettings.RECEIVER_EMAILS, "me@example.com");
        return MonitorSettings.from(raw);
    }

    private static DetectionResult updated(Long id, String name, int previous, int remote) {
        DetectionResult result = new DetectionResult();
        result.setOutcome(DetectionResult.Outcome.UPDATED);
        result.setMonitorId(id);
        result.setName(name);
        result.setOwnerId("123");
        result.setRemoteId(String.valueOf(id));
        result.setType("season");
        result.setPreviousTotal(previous);
        result.setRemoteTotal(remote);
        List<RemoteVideo> videos = Collections.singletonList(
                new RemoteVideo(String.valueOf(id * 100), name + " 新视频", 1767225600L, ""));
        result.setVideos(videos);
        result.setUpdateTime(1767225600L);
        return result;
    }

    private static DetectionResult unchanged(Long id) {
        DetectionResult result = new DetectionResult();
        result.setOutcome(DetectionResult.Outcome.UNCHANGED);
        result.setMonitorId(id);
        result.setName("未变化");
        return result;
    }
}
