package com.scoutim.domain.dto;

import com.scoutim.domain.entity.MessageEntity;
import lombok.Data;

import java.time.LocalDateTime;

@Data
public class MessageDto {

    private Long id;

    private Long threadId;

    private Long senderId;

    private String body;

    private LocalDateTime createdAt;

    private LocalDateTime readAt;

    /** 是否为当前用户发送 */
    private Boolean mine;

    public static MessageDto from(MessageEntity m, long viewerId) {
        MessageDto dto = new MessageDto();
        dto.setId(m.getId());
        dto.setThreadId(m.getThreadId());
        dto.setSenderId(m.getSenderId());
        dto.setBody(m.getBody());
        dto.setCreatedAt(m.getCreatedAt());
        dto.setReadAt(m.getReadAt());
        dto.setMine(m.getSenderId() != null && m.getSenderId() == viewerId);
        return dto;
    }
}
