package com.scoutim.common.mail;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Brevo 事务邮件 HTTP API。
 *
 * <pre>
 * curl --request POST https://api.brevo.com/v3/smtp/email
 *   --header 'api-key: ...'
 *   --header 'content-type: application/json'
 *   --data '{"sender":{"name":"..","email":".."},"to":[{"email":".."}],"subject":"..","textContent":"..","htmlContent":".."}'
 * </pre>
 */
@Slf4j
@Service
public class BrevoMailNotifier implements MailNotifier {

    private final MailProperties props;
    private final RestTemplate restTemplate;

    @Autowired
    public BrevoMailNotifier(MailProperties props, RestTemplateBuilder restTemplateBuilder) {
        this(props, restTemplateBuilder
                .setConnectTimeout(Duration.ofMillis(props.timeoutMsEffective()))
                .setReadTimeout(Duration.ofMillis(props.timeoutMsEffective()))
                .build());
    }

    BrevoMailNotifier(MailProperties props, RestTemplate restTemplate) {
        this.props = props;
        this.restTemplate = restTemplate;
        log.info("mail notifier: apiKeyConfigured={}, fromEmailConfigured={}",
                props.apiKey() != null && !props.apiKey().isBlank(),
                props.fromEmail() != null && !props.fromEmail().isBlank());
    }

    @Override
    public boolean isConfigured() {
        return props.configured();
    }

    @Override
    public void send(String toEmail, String subject, String textBody, String htmlBody) {
        if (!isConfigured()) {
            throw new MailSendException("mail_not_configured");
        }
        if (toEmail == null || toEmail.isBlank()) {
            throw new MailSendException("mail_recipient_missing");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("api-key", props.apiKey());
        HttpEntity<Map<String, Object>> entity = new HttpEntity<>(payload(toEmail, subject, textBody, htmlBody), headers);

        int maxAttempts = props.maxAttemptsEffective();
        String lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
                        props.apiUrlEffective(),
                        HttpMethod.POST,
                        entity,
                        new ParameterizedTypeReference<Map<String, Object>>() {}
                );
                if (response.getStatusCode().is2xxSuccessful()) {
                    Map<String, Object> body = response.getBody();
                    Object messageId = body == null ? null : body.get("messageId");
                    log.info("mail sent: to={}, messageId={}, attempt={}", toEmail, messageId, attempt);
                    return;
                }
                lastError = "HTTP " + response.getStatusCode().value();
            } catch (RestClientException e) {
                lastError = e.toString();
            }
            log.warn("mail send attempt {}/{} failed: to={}, err={}", attempt, maxAttempts, toEmail, lastError);

            if (attempt < maxAttempts) {
                sleepBeforeRetry();
            }
        }
        throw new MailSendException("mail send failed after " + maxAttempts + " attempts: " + lastError);
    }

    private Map<String, Object> payload(String toEmail, String subject, String textBody, String htmlBody) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sender", Map.of("name", props.fromNameEffective(), "email", props.fromEmail()));
        payload.put("to", List.of(Map.of("email", toEmail)));
        payload.put("subject", subject);
        payload.put("textContent", textBody);
        if (htmlBody != null && !htmlBody.isBlank()) {
            payload.put("htmlContent", htmlBody);
        }
        return payload;
    }

    private void sleepBeforeRetry() {
        long delay = props.retryDelayMsEffective();
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MailSendException("mail send interrupted", e);
        }
    }
}
