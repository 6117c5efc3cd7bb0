package com.scoutim.domain.dto;

/**
 * 一次提醒扫描的结果统计。
 */
public record ReminderRunStats(
        boolean notifierConfigured,
        int candidates,
        int sent,
        int skippedCooldown,
        int skippedNoUnread,
        int failed
) {

    public static ReminderRunStats notConfigured() {
        return new ReminderRunStats(false, 0, 0, 0, 0, 0);
    }
}
