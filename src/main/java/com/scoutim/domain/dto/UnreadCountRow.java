package com.scoutim.domain.dto;

import lombok.Data;

/**
 * 按会话分组的未读数查询结果行。
 */
@Data
public class UnreadCountRow {

    private Long threadId;

    private Long unreadCount;
}
