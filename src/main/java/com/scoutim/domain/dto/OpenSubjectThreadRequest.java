package com.scoutim.domain.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class OpenSubjectThreadRequest {
    /** 主题对象（球员）在对方名下时，owner 为对方 userId */
    @NotNull
    private Long ownerId;
}
