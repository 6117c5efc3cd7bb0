package com.scoutim.domain.dto;

import lombok.Data;

import java.time.LocalDateTime;

@Data
public class ReminderSettingsDto {

    private String email;

    private Boolean emailVerified;

    private Boolean enabled;

    private Integer delayMin;

    private LocalDateTime lastSentAt;
}
