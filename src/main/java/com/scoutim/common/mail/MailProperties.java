package com.scoutim.common.mail;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "im.mail")
public record MailProperties(
        String apiUrl,
        String apiKey,
        String fromEmail,
        String fromName,
        Integer maxAttempts,
        Long retryDelayMs,
        Long timeoutMs
) {

    public static final String DEFAULT_API_URL = "https://api.brevo.com/v3/smtp/email";

    public String apiUrlEffective() {
        return apiUrl == null || apiUrl.isBlank() ? DEFAULT_API_URL : apiUrl;
    }

    public String fromNameEffective() {
        return fromName == null || fromName.isBlank() ? "BB Scout" : fromName;
    }

    public int maxAttemptsEffective() {
        Integer v = maxAttempts;
        if (v == null || v <= 0) {
            return 3;
        }
        return v;
    }

    public long retryDelayMsEffective() {
        Long v = retryDelayMs;
        if (v == null || v < 0) {
            return 1000L;
        }
        return v;
    }

    public long timeoutMsEffective() {
        Long v = timeoutMs;
        if (v == null || v <= 0) {
            return 15_000L;
        }
        return v;
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank() && fromEmail != null && !fromEmail.isBlank();
    }
}
