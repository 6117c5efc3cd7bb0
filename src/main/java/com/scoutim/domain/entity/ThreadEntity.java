package com.scoutim.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.scoutim.domain.enums.ThreadKind;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_thread")
public class ThreadEntity {

    /** 私信没有主题对象，subject_id 存 0。 */
    public static final long NO_SUBJECT = 0L;

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    /** 会话类型：见 {@link ThreadKind}（数据库仍存数字）。 */
    private ThreadKind kind;

    private Long subjectId;

    /** 私信：两人中 id 较小者；主题会话：owner。 */
    @TableField("user_a_id")
    private Long userAId;

    /** 私信：两人中 id 较大者；主题会话：对方。 */
    @TableField("user_b_id")
    private Long userBId;

    private LocalDateTime createdAt;

    /** 最后一条消息的创建时间；没有消息时等于 createdAt。 */
    private LocalDateTime lastActivityAt;

    private Boolean active;

    public boolean hasParticipant(long userId) {
        return (userAId != null && userAId == userId) || (userBId != null && userBId == userId);
    }

    /**
     * @return 对方 userId；userId 不是参与者时返回 null
     */
    public Long counterpartOf(long userId) {
        if (userAId != null && userAId == userId) {
            return userBId;
        }
        if (userBId != null && userBId == userId) {
            return userAId;
        }
        return null;
    }

    public boolean isActiveThread() {
        return !Boolean.FALSE.equals(active);
    }
}
