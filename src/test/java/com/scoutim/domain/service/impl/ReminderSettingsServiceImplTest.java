package com.scoutim.domain.service.impl;

import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import com.scoutim.common.api.BizException;
import com.scoutim.domain.dto.ReminderSettingsDto;
import com.scoutim.domain.dto.UpdateReminderSettingsRequest;
import com.scoutim.domain.entity.UserEntity;
import com.scoutim.domain.mapper.UserMapper;
import com.scoutim.domain.service.ReminderSettingsService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
class ReminderSettingsServiceImplTest {

    @Autowired
    private ReminderSettingsService settingsService;

    @Autowired
    private UserMapper userMapper;

    @Test
    void defaults_DisabledWithSixtyMinutes() {
        long id = newUser("dana@example.com", true);

        ReminderSettingsDto dto = settingsService.get(id);

        assertThat(dto.getEnabled()).isFalse();
        assertThat(dto.getDelayMin()).isEqualTo(60);
        assertThat(dto.getEmailVerified()).isTrue();
    }

    @Test
    void update_EnableWithAllowedDelay() {
        long id = newUser("dana@example.com", true);
        UpdateReminderSettingsRequest req = new UpdateReminderSettingsRequest();
        req.setEnabled(true);
        req.setDelayMin(180);

        ReminderSettingsDto dto = settingsService.update(id, req);

        assertThat(dto.getEnabled()).isTrue();
        assertThat(dto.getDelayMin()).isEqualTo(180);
        assertThat(userMapper.selectById(id).getUnreadReminderDelayMin()).isEqualTo(180);
    }

    @Test
    void update_DelayOutsideAllowedSet_IsRejected() {
        long id = newUser("dana@example.com", true);
        UpdateReminderSettingsRequest req = new UpdateReminderSettingsRequest();
        req.setDelayMin(45);

        BizException e = assertThrows(BizException.class, () -> settingsService.update(id, req));

        assertTrue(e.isBadRequest());
        assertThat(userMapper.selectById(id).getUnreadReminderDelayMin()).isEqualTo(60);
    }

    @Test
    void update_NewEmail_ResetsVerification_SameEmailKeepsIt() {
        long id = newUser("dana@example.com", true);

        UpdateReminderSettingsRequest same = new UpdateReminderSettingsRequest();
        same.setEmail("  DANA@example.com ");
        assertThat(settingsService.update(id, same).getEmailVerified()).isTrue();

        UpdateReminderSettingsRequest changed = new UpdateReminderSettingsRequest();
        changed.setEmail("dana.new@example.com");
        ReminderSettingsDto dto = settingsService.update(id, changed);

        assertThat(dto.getEmail()).isEqualTo("dana.new@example.com");
        assertThat(dto.getEmailVerified()).isFalse();
    }

    @Test
    void unknownUser_IsNotFound() {
        assertTrue(assertThrows(BizException.class, () -> settingsService.get(IdWorker.getId())).isNotFound());
    }

    private long newUser(String email, boolean verified) {
        long id = IdWorker.getId();
        userMapper.insert(UserEntity.builder()
                .id(id)
                .loginName("dana-" + id)
                .email(email)
                .emailVerified(verified)
                .createdAt(LocalDateTime.now())
                .build());
        return id;
    }
}
