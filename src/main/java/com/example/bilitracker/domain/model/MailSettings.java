package com.example.bilitracker.domain.model;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MailSettings {

    private boolean enabled;

    private String host;

    private int port;

    private String account;

    private String authCode;

    private String senderName;

    private List<String> receivers;

    /** Implicit TLS (SMTPS) when true, plain SMTP otherwise. */
    private boolean useTls;
}
