package com.example.bilitracker.infrastructure.mail;

import com.example.bilitracker.domain.model.MailSettings;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import java.util.function.Function;
import javax.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Builds a fresh sender per mail, since host and credentials live in the settings table and may
 * change between sends.
 */
@Component
public class SmtpMailNotifier implements MailNotifier {

    private static final Logger log = LoggerFactory.getLogger(SmtpMailNotifier.class);

    private static final int TIMEOUT_MS = 15000;

    private final Function<MailSettings, JavaMailSender> senderFactory;

    @Autowired
    public SmtpMailNotifier() {
        this(SmtpMailNotifier::createSender);
    }

    SmtpMailNotifier(Function<MailSettings, JavaMailSender> senderFactory) {
        this.senderFactory = senderFactory;
    }

    @Override
    public boolean send(MailSettings settings, String subject, String htmlBody) {
        if (settings == null || !settings.isEnabled()) {
            log.info("MAIL_SKIPPED reason=disabled subject={}", subject);
            return false;
        }
        if (!StringUtils.hasText(settings.getHost())
                || !StringUtils.hasText(settings.getAccount())
                || !StringUtils.hasText(settings.getAuthCode())
                || settings.getReceivers() == null
                || settings.getReceivers().isEmpty()) {
            log.info("MAIL_SKIPPED reason=incomplete_config subject={}", subject);
            return false;
        }

        try {
            JavaMailSender sender = senderFactory.apply(settings);
            MimeMessage message = sender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, false, StandardCharsets.UTF_8.name());
            if (StringUtils.hasText(settings.getSenderName())) {
                helper.setFrom(settings.getAccount(), settings.getSenderName());
            } else {
                helper.setFrom(settings.getAccount());
            }
            helper.setTo(settings.getReceivers().toArray(new String[0]));
            helper.setSubject(subject);
            helper.setText(htmlBody, true);
            sender.send(message);
            log.info("MAIL_SENT subject={} receivers={} host={}:{}",
                    subject, settings.getReceivers().size(), settings.getHost(), settings.getPort());
            return true;
        } catch (Exception e) {
            log.error("MAIL_SEND_FAILED subject={} host={}:{} reason={}",
                    subject, settings.getHost(), settings.getPort(), e.getMessage(), e);
            return false;
        }
    }

    static JavaMailSender createSender(MailSettings settings) {
        JavaMailSenderImpl sender = new JavaMailSenderImpl();
        sender.setHost(settings.getHost());
        sender.setPort(settings.getPort());
        sender.setUsername(settings.getAccount());
        sender.setPassword(settings.getAuthCode());
        sender.setDefaultEncoding(StandardCharsets.UTF_8.name());
        sender.setProtocol(settings.isUseTls() ? "smtps" : "smtp");

        Properties props = new Properties();
        String prefix = "mail." + sender.getProtocol() + ".";
        props.put(prefix + "auth", "true");
        props.put(prefix + "connectiontimeout", String.valueOf(TIMEOUT_MS));
        props.put(prefix + "timeout", String.valueOf(TIMEOUT_MS));
        props.put(prefix + "writetimeout", String.valueOf(TIMEOUT_MS));
        if (settings.isUseTls()) {
            props.put(prefix + "ssl.enable", "true");
        }
        sender.setJavaMailProperties(props);
        return sender;
    }
}
