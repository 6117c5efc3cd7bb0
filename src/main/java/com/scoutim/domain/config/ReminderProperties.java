package com.scoutim.domain.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 未读消息邮件提醒。
 *
 * <p>enabled 只控制定时任务是否启动；手动调用 runOnce 不受影响。</p>
 * <p>sendTimeoutMs 应不小于邮件发送的全部重试耗时（im.mail 的 maxAttempts × timeoutMs 加重试间隔），
 * 超时的发送按已提醒计入冷却。</p>
 */
@ConfigurationProperties(prefix = "im.reminder")
public record ReminderProperties(
        Boolean enabled,
        Integer intervalMinutes,
        Integer initialDelaySeconds,
        Integer cooldownHours,
        Long sendTimeoutMs,
        String webAppUrl
) {

    public boolean enabledEffective() {
        return enabled == null || enabled;
    }

    public int intervalMinutesEffective() {
        Integer v = intervalMinutes;
        if (v == null || v <= 0) {
            return 15;
        }
        return v;
    }

    public int initialDelaySecondsEffective() {
        Integer v = initialDelaySeconds;
        if (v == null || v < 0) {
            return 60;
        }
        return v;
    }

    public int cooldownHoursEffective() {
        Integer v = cooldownHours;
        if (v == null || v < 0) {
            return 24;
        }
        return v;
    }

    public long sendTimeoutMsEffective() {
        Long v = sendTimeoutMs;
        if (v == null || v <= 0) {
            return 60_000L;
        }
        return v;
    }

    public String webAppUrlEffective() {
        String v = webAppUrl;
        if (v == null || v.isBlank()) {
            return "https://bbscout.me";
        }
        return v;
    }
}
