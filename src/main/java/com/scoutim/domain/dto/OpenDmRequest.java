package com.scoutim.domain.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class OpenDmRequest {
    @NotBlank
    private String recipientUsername;
}
