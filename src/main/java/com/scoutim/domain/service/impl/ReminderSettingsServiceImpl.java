package com.scoutim.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.scoutim.common.api.BizException;
import com.scoutim.domain.dto.ReminderSettingsDto;
import com.scoutim.domain.dto.UpdateReminderSettingsRequest;
import com.scoutim.domain.entity.UserEntity;
import com.scoutim.domain.mapper.UserMapper;
import com.scoutim.domain.service.ReminderSettingsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReminderSettingsServiceImpl implements ReminderSettingsService {

    private final UserMapper userMapper;

    @Override
    public ReminderSettingsDto get(long userId) {
        return toDto(load(userId));
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public ReminderSettingsDto update(long userId, UpdateReminderSettingsRequest req) {
        UserEntity u = load(userId);
        if (req == null) {
            return toDto(u);
        }
        if (req.getDelayMin() != null && !ALLOWED_DELAYS_MIN.contains(req.getDelayMin())) {
            throw BizException.badRequest("reminder_delay_must_be_30_60_180");
        }

        LambdaUpdateWrapper<UserEntity> w = new LambdaUpdateWrapper<UserEntity>()
                .eq(UserEntity::getId, userId);
        boolean changed = false;
        if (req.getEnabled() != null) {
            w.set(UserEntity::getUnreadReminderEnabled, req.getEnabled());
            changed = true;
        }
        if (req.getDelayMin() != null) {
            w.set(UserEntity::getUnreadReminderDelayMin, req.getDelayMin());
            changed = true;
        }
        if (req.getEmail() != null) {
            String email = req.getEmail().trim().toLowerCase(Locale.ROOT);
            if (!email.equals(u.getEmail())) {
                w.set(UserEntity::getEmail, email.isEmpty() ? null : email);
                w.set(UserEntity::getEmailVerified, false);
                changed = true;
                log.info("reminder email changed, verification reset: userId={}", userId);
            }
        }
        if (changed) {
            userMapper.update(null, w);
        }
        return toDto(load(userId));
    }

    private UserEntity load(long userId) {
        UserEntity u = userMapper.selectById(userId);
        if (u == null) {
            throw BizException.notFound("user_not_found");
        }
        return u;
    }

    private static ReminderSettingsDto toDto(UserEntity u) {
        ReminderSettingsDto dto = new ReminderSettingsDto();
        dto.setEmail(u.getEmail());
        dto.setEmailVerified(Boolean.TRUE.equals(u.getEmailVerified()));
        dto.setEnabled(Boolean.TRUE.equals(u.getUnreadReminderEnabled()));
        dto.setDelayMin(u.reminderDelayMinEffective());
        dto.setLastSentAt(u.getLastUnreadReminderSentAt());
        return dto;
    }
}
