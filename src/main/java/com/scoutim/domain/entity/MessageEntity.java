package com.scoutim.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_message")
public class MessageEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long threadId;

    private Long senderId;

    private String body;

    /** 创建后不再修改；同一会话内严格递增，决定消息顺序。 */
    private LocalDateTime createdAt;

    /** null 表示未读；只会由非发送方设置一次。 */
    private LocalDateTime readAt;
}
