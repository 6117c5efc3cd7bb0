package com.scoutim.domain.service;

import com.scoutim.domain.dto.ReminderSettingsDto;
import com.scoutim.domain.dto.UpdateReminderSettingsRequest;

import java.util.Set;

public interface ReminderSettingsService {

    Set<Integer> ALLOWED_DELAYS_MIN = Set.of(30, 60, 180);

    ReminderSettingsDto get(long userId);

    /**
     * 更新提醒设置。修改邮箱会清除已验证标记，需要重新验证后才会收到提醒。
     */
    ReminderSettingsDto update(long userId, UpdateReminderSettingsRequest req);
}
