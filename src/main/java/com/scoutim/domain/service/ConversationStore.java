package com.scoutim.domain.service;

import com.scoutim.domain.dto.ThreadSummaryDto;
import com.scoutim.domain.entity.MessageEntity;
import com.scoutim.domain.entity.ThreadEntity;
import com.scoutim.domain.enums.ThreadKind;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 会话、消息与已读状态的持久化入口。
 *
 * <p>失败时抛 {@link com.scoutim.common.api.BizException}：
 * 参数不合法 = BAD_REQUEST，会话不存在 = NOT_FOUND，非参与者 = FORBIDDEN；
 * 存储不可用时 DataAccessException 原样向上抛。</p>
 */
public interface ConversationStore {

    /**
     * 获取两人之间的私信会话，不存在则创建。参数顺序无关，并发调用收敛到同一条记录。
     */
    ThreadEntity getOrCreateThread(long partyA, long partyB);

    /**
     * 获取 (subject, owner, counterpart) 对应的主题会话，不存在则创建。
     */
    ThreadEntity getOrCreateSubjectThread(long subjectId, long ownerId, long counterpartId);

    /**
     * 追加一条消息并把会话的 lastActivityAt 更新为消息创建时间，两者在同一事务内完成。
     */
    default MessageEntity appendMessage(long threadId, long senderId, String body) {
        return appendMessage(threadId, senderId, body, null);
    }

    /**
     * 同 {@link #appendMessage(long, long, String)}，会话类型与 requiredKind 不符时按会话不存在处理。
     *
     * @param requiredKind 为 null 时不限类型
     */
    MessageEntity appendMessage(long threadId, long senderId, String body, ThreadKind requiredKind);

    /**
     * 把会话中 reader 收到的未读消息全部标记为已读。
     *
     * @return 本次标记的条数；重复调用返回 0
     */
    int markRead(long threadId, long readerId);

    /**
     * 用户参与的会话，按 lastActivityAt、id 倒序。
     *
     * @param kind 为 null 时返回所有类型
     */
    List<ThreadSummaryDto> listThreadsFor(long userId, ThreadKind kind);

    default List<ThreadSummaryDto> listThreadsFor(long userId) {
        return listThreadsFor(userId, null);
    }

    /**
     * 会话消息，按创建时间升序。
     */
    List<MessageEntity> listMessages(long threadId, long viewerId);

    /**
     * 按 id 读取会话，不校验参与者；不存在返回 null。
     */
    ThreadEntity getById(long threadId);

    default ThreadEntity getThreadFor(long threadId, long userId) {
        return getThreadFor(threadId, userId, null);
    }

    /**
     * 读取会话并校验 userId 为参与者。
     *
     * @param requiredKind 为 null 时不限类型；类型不符时抛 NOT_FOUND
     */
    ThreadEntity getThreadFor(long threadId, long userId, ThreadKind requiredKind);

    long unreadCount(long threadId, long userId);

    /**
     * 用户在全部会话中收到的未读消息总数。
     */
    long totalUnread(long userId);

    /**
     * 停用会话：不再接受新消息，历史保留。
     *
     * @return 本次是否从启用变为停用
     */
    boolean deactivateThread(long threadId, long actorId);

    /**
     * 用户在所有未停用会话中、创建时间不晚于 cutoff 的未读消息数。
     */
    long countUnreadOlderThan(long userId, LocalDateTime cutoff);
}
