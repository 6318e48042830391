package com.example.bilitracker.application.service;

import com.example.bilitracker.common.config.AppRemoteProperties;
import com.example.bilitracker.domain.model.DetectionResult;
import com.example.bilitracker.domain.model.MonitorSettings;
import com.example.bilitracker.domain.model.RemoteVideo;
import com.example.bilitracker.domain.model.UpdateSummary;
import com.example.bilitracker.infrastructure.mail.MailNotifier;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

/**
 * Turns detected updates into notification mails, one per collection or one per pass.
 */
@Service
public class UpdateNotificationService {

    private static final Logger log = LoggerFactory.getLogger(UpdateNotificationService.class);

    private static final DateTimeFormatter MINUTE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final DateTimeFormatter SECOND_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    static final String TEST_SUBJECT = "B站视频追踪 - 测试邮件";

    private final MailNotifier mailNotifier;
    private final AppRemoteProperties appRemoteProperties;
    private final Clock clock;

    @Autowired
    public UpdateNotificationService(MailNotifier mailNotifier, AppRemoteProperties appRemoteProperties) {
        this(mailNotifier, appRemoteProperties, Clock.systemDefaultZone());
    }

    UpdateNotificationService(MailNotifier mailNotifier, AppRemoteProperties appRemoteProperties, Clock clock) {
        this.mailNotifier = mailNotifier;
        this.appRemoteProperties = appRemoteProperties;
        this.clock = clock;
    }

    public NotificationBatch openBatch(MonitorSettings settings) {
        return new NotificationBatch(this, settings);
    }

    public boolean notifyImmediately(MonitorSettings settings, DetectionResult result) {
        if (!settings.getMail().isEnabled()) {
            log.debug("NOTIFY_SKIPPED reason=mail_disabled monitorId={}", result.getMonitorId());
            return false;
        }
        UpdateSummary summary = summarize(result);
        String subject = "【更新】" + summary.getName() + " 更新了 " + summary.getDelta() + " 个视频";
        String body = "<h3>" + escape(summary.getName()) + "</h3>" + summarySection(summary);
        return dispatch(settings, subject, body);
    }

    boolean sendBatch(MonitorSettings settings, List<UpdateSummary> summaries) {
        if (!settings.getMail().isEnabled()) {
            log.debug("NOTIFY_SKIPPED reason=mail_disabled batchSize={}", summaries.size());
            return false;
        }
        int totalVideos = 0;
        for (UpdateSummary summary : summaries) {
            totalVideos += summary.getDelta();
        }
        String subject = "[统一推送] 共检测到 " + summaries.size() + " 个合集更新，新增 " + totalVideos + " 个视频";

        StringBuilder body = new StringBuilder();
        body.append("<h2>B站合集监控统一推送通知</h2>")
                .append("<p><b>总更新合集数:</b> ").append(summaries.size()).append("</p>")
                .append("<p><b>总更新视频数:</b> ").append(totalVideos).append("</p>")
                .append("<p><b>检查时间:</b> ").append(format(clock.instant(), SECOND_FORMATTER)).append("</p>")
                .append("<hr>");
        for (UpdateSummary summary : summaries) {
            body.append("<h3>").append(escape(summary.getName())).append("</h3>")
                    .append(summarySection(summary))
                    .append("<hr>");
        }
        return dispatch(settings, subject, body.toString());
    }

    public boolean sendTestMail(MonitorSettings settings) {
        String body = "<h1>配置成功</h1><p>如果您收到这封邮件，说明您的SMTP配置正确。</p>";
        return mailNotifier.send(settings.getMail(), TEST_SUBJECT, body);
    }

    UpdateSummary summarize(DetectionResult result) {
        StringBuilder videosHtml = new StringBuilder();
        for (RemoteVideo video : result.getVideos()) {
            videosHtml.append("<p>• <a href='").append(videoUrl(video.getVideoId())).append("'>")
                    .append(escape(video.getTitle()))
                    .append("</a> (")
                    .append(format(Instant.ofEpochSecond(video.getPublishTime()), MINUTE_FORMATTER))
                    .append(")</p>");
        }
        return new UpdateSummary(result.getName(), result.getDelta(), result.getRemoteTotal(),
                result.getUpdateTime(), videosHtml.toString(), result.getOwnerId(), result.getRemoteId(),
                result.getType());
    }

    /**
     * Numeric ids are legacy AV numbers and need the {@code av} prefix; BV ids are used as is.
     */
    String videoUrl(String videoId) {
        boolean numeric = videoId != null && !videoId.isEmpty() && videoId.chars().allMatch(Character::isDigit);
        return appRemoteProperties.getVideoBaseUrl() + "/" + (numeric ? "av" + videoId : videoId);
    }

    String collectionUrl(UpdateSummary summary) {
        return appRemoteProperties.getSpaceBaseUrl() + "/" + summary.getOwnerId() + "/lists/"
                + summary.getRemoteId() + "?type=" + summary.getType();
    }

    private String summarySection(UpdateSummary summary) {
        return "<p><b>更新数量:</b> " + summary.getDelta() + "</p>"
                + "<p><b>当前总数:</b> " + summary.getRemoteTotal() + "</p>"
                + "<p><b>更新时间:</b> "
                + format(Instant.ofEpochSecond(summary.getUpdateTime()), MINUTE_FORMATTER) + "</p>"
                + "<h4>最新视频：</h4>"
                + summary.getVideosHtml()
                + "<h4>合集链接：</h4>"
                + "<p><a href=\"" + collectionUrl(summary) + "\">点击查看合集/系列</a></p>";
    }

    private boolean dispatch(MonitorSettings settings, String subject, String body) {
        boolean sent = mailNotifier.send(settings.getMail(), subject, body);
        if (!sent) {
            log.warn("NOTIFY_FAILED subject={}", subject);
        }
        return sent;
    }

    private String format(Instant instant, DateTimeFormatter formatter) {
        ZoneId zone = clock.getZone();
        return formatter.format(instant.atZone(zone));
    }

    private static String escape(String text) {
        return text == null ? "" : HtmlUtils.htmlEscape(text);
    }
}
