package com.scoutim.domain.dto;

import jakarta.validation.constraints.Email;
import lombok.Data;

/**
 * 字段为 null 表示不修改。
 */
@Data
public class UpdateReminderSettingsRequest {

    private Boolean enabled;

    /** 30 / 60 / 180 */
    private Integer delayMin;

    @Email
    private String email;
}
