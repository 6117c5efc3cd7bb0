package com.scoutim.domain.service;

import com.scoutim.domain.dto.ReminderRunStats;

/**
 * 未读消息邮件提醒。
 */
public interface UnreadReminderService {

    /**
     * 扫描一次开启提醒的用户，对超过各自延迟仍未读的用户各发一封邮件。
     *
     * <p>单个用户发送失败或超时只记日志，不影响其他用户。</p>
     */
    ReminderRunStats runOnce();
}
