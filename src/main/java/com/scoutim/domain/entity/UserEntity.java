package com.scoutim.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 用户表中本服务关心的列。账号注册、密码、邮箱验证由账号服务维护。
 */
@AllArgsConstructor
@NoArgsConstructor
@Builder
@Data
@TableName("t_user")
public class UserEntity {

    public static final int DEFAULT_REMINDER_DELAY_MIN = 60;

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private String loginName;

    /** 展示名，可为空。 */
    private String username;

    private String email;

    private Boolean emailVerified;

    private Boolean unreadReminderEnabled;

    /** 30 / 60 / 180 */
    private Integer unreadReminderDelayMin;

    /** 最近一次未读提醒发送时间，用于冷却。 */
    private LocalDateTime lastUnreadReminderSentAt;

    private LocalDateTime createdAt;

    public String displayName() {
        if (username != null && !username.isBlank()) {
            return username;
        }
        return loginName;
    }

    public int reminderDelayMinEffective() {
        Integer v = unreadReminderDelayMin;
        return v == null || v <= 0 ? DEFAULT_REMINDER_DELAY_MIN : v;
    }
}
