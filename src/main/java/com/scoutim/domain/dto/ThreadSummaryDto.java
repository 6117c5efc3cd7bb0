package com.scoutim.domain.dto;

import com.scoutim.domain.enums.ThreadKind;
import lombok.Data;

import java.time.LocalDateTime;

@Data
public class ThreadSummaryDto {

    private Long threadId;

    private ThreadKind kind;

    /** 私信为 0 */
    private Long subjectId;

    /** 主题会话的发起方（owner）；私信为 null */
    private Long ownerId;

    private Long counterpartId;

    private String counterpartName;

    private Boolean active;

    /** 会话最后活跃时间（列表排序依据） */
    private LocalDateTime lastActivityAt;

    private Long unreadCount;

    /** 最后一条消息（无消息时为 null） */
    private LastMessageDto lastMessage;

    @Data
    public static class LastMessageDto {
        private Long messageId;
        private Long senderId;
        private String body;
        private LocalDateTime createdAt;
    }
}
