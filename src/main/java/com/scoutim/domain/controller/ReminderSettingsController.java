package com.scoutim.domain.controller;

import com.scoutim.auth.web.AuthContext;
import com.scoutim.common.api.ApiCodes;
import com.scoutim.common.api.Result;
import com.scoutim.domain.dto.ReminderSettingsDto;
import com.scoutim.domain.dto.UpdateReminderSettingsRequest;
import com.scoutim.domain.service.ReminderSettingsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RequiredArgsConstructor
@RestController
@RequestMapping("/me/reminder-settings")
public class ReminderSettingsController {

    private final ReminderSettingsService reminderSettingsService;

    @GetMapping
    public Result<ReminderSettingsDto> get() {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(reminderSettingsService.get(userId));
    }

    @PutMapping
    public Result<ReminderSettingsDto> update(@Valid @RequestBody UpdateReminderSettingsRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(reminderSettingsService.update(userId, req));
    }
}
