package com.example.bilitracker.infrastructure.mail;

import com.example.bilitracker.domain.model.MailSettings;

public interface MailNotifier {

    /**
     * Sends one HTML mail to every configured receiver.
     *
     * @return false when mail is disabled, incompletely configured or the transport failed; never throws
     */
    boolean send(MailSettings settings, String subject, String htmlBody);
}
