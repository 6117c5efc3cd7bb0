package com.scoutim.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import com.scoutim.common.api.BizException;
import com.scoutim.domain.config.ConversationProperties;
import com.scoutim.domain.dto.ThreadSummaryDto;
import com.scoutim.domain.dto.UnreadCountRow;
import com.scoutim.domain.entity.MessageEntity;
import com.scoutim.domain.entity.ThreadEntity;
import com.scoutim.domain.entity.UserEntity;
import com.scoutim.domain.enums.ThreadKind;
import com.scoutim.domain.mapper.MessageMapper;
import com.scoutim.domain.mapper.ThreadMapper;
import com.scoutim.domain.mapper.UserMapper;
import com.scoutim.domain.service.ConversationStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
public class ConversationStoreImpl implements ConversationStore {

    private final ThreadMapper threadMapper;
    private final MessageMapper messageMapper;
    private final UserMapper userMapper;
    private final ConversationProperties props;
    private final Clock clock;

    public ConversationStoreImpl(ThreadMapper threadMapper,
                                 MessageMapper messageMapper,
                                 UserMapper userMapper,
                                 ConversationProperties props,
                                 Clock clock) {
        this.threadMapper = threadMapper;
        this.messageMapper = messageMapper;
        this.userMapper = userMapper;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public ThreadEntity getOrCreateThread(long partyA, long partyB) {
        requireUserId(partyA);
        requireUserId(partyB);
        if (partyA == partyB) {
            throw BizException.badRequest("cannot_message_self");
        }
        long a = Math.min(partyA, partyB);
        long b = Math.max(partyA, partyB);
        return getOrCreate(ThreadKind.DIRECT, ThreadEntity.NO_SUBJECT, a, b);
    }

    @Override
    public ThreadEntity getOrCreateSubjectThread(long subjectId, long ownerId, long counterpartId) {
        if (subjectId <= 0) {
            throw BizException.badRequest("invalid_subject_id");
        }
        requireUserId(ownerId);
        requireUserId(counterpartId);
        if (ownerId == counterpartId) {
            throw BizException.badRequest("cannot_open_own_subject");
        }
        return getOrCreate(ThreadKind.SUBJECT, subjectId, ownerId, counterpartId);
    }

    private ThreadEntity getOrCreate(ThreadKind kind, long subjectId, long userA, long userB) {
        ThreadEntity exist = findThread(subjectId, userA, userB);
        if (exist != null) {
            return exist;
        }

        LocalDateTime now = now();
        ThreadEntity t = new ThreadEntity();
        t.setId(IdWorker.getId());
        t.setKind(kind);
        t.setSubjectId(subjectId);
        t.setUserAId(userA);
        t.setUserBId(userB);
        t.setCreatedAt(now);
        t.setLastActivityAt(now);
        t.setActive(true);
        try {
            threadMapper.insert(t);
            log.debug("thread created: id={}, kind={}, subjectId={}, a={}, b={}", t.getId(), kind, subjectId, userA, userB);
            return t;
        } catch (DuplicateKeyException e) {
            // 并发创建：唯一键冲突说明另一请求已插入，读回那一条
            ThreadEntity again = findThread(subjectId, userA, userB);
            if (again == null) {
                throw e;
            }
            return again;
        }
    }

    private ThreadEntity findThread(long subjectId, long userA, long userB) {
        return threadMapper.selectOne(new LambdaQueryWrapper<ThreadEntity>()
                .eq(ThreadEntity::getSubjectId, subjectId)
                .eq(ThreadEntity::getUserAId, userA)
                .eq(ThreadEntity::getUserBId, userB));
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public MessageEntity appendMessage(long threadId, long senderId, String body, ThreadKind requiredKind) {
        if (body == null || body.isBlank()) {
            throw BizException.badRequest("message_body_empty");
        }
        if (body.length() > props.maxBodyLengthEffective()) {
            throw BizException.badRequest("message_body_too_long");
        }

        // 行锁：同一会话的追加串行化，创建时间才能严格递增
        ThreadEntity t = threadMapper.selectOne(new LambdaQueryWrapper<ThreadEntity>()
                .eq(ThreadEntity::getId, threadId)
                .last("for update"));
        if (t == null || (requiredKind != null && t.getKind() != requiredKind)) {
            throw BizException.notFound("thread_not_found");
        }
        if (!t.hasParticipant(senderId)) {
            throw BizException.forbidden("not_thread_participant");
        }
        if (!t.isActiveThread()) {
            throw BizException.badRequest("thread_inactive");
        }

        LocalDateTime createdAt = now();
        LocalDateTime last = t.getLastActivityAt();
        if (last != null && !createdAt.isAfter(last)) {
            createdAt = last.plus(1, ChronoUnit.MILLIS);
        }

        MessageEntity m = new MessageEntity();
        m.setId(IdWorker.getId());
        m.setThreadId(threadId);
        m.setSenderId(senderId);
        m.setBody(body);
        m.setCreatedAt(createdAt);
        messageMapper.insert(m);

        ThreadEntity patch = new ThreadEntity();
        patch.setId(threadId);
        patch.setLastActivityAt(createdAt);
        threadMapper.updateById(patch);
        return m;
    }

    @Override
    public int markRead(long threadId, long readerId) {
        getThreadFor(threadId, readerId);
        int n = messageMapper.markRead(threadId, readerId, now());
        if (n > 0) {
            log.debug("messages marked read: threadId={}, readerId={}, count={}", threadId, readerId, n);
        }
        return n;
    }

    @Override
    public List<ThreadSummaryDto> listThreadsFor(long userId, ThreadKind kind) {
        List<ThreadEntity> threads = threadMapper.selectList(new LambdaQueryWrapper<ThreadEntity>()
                .and(w -> w.eq(ThreadEntity::getUserAId, userId).or().eq(ThreadEntity::getUserBId, userId))
                .eq(kind != null, ThreadEntity::getKind, kind)
                .orderByDesc(ThreadEntity::getLastActivityAt)
                .orderByDesc(ThreadEntity::getId));
        if (threads.isEmpty()) {
            return List.of();
        }

        List<Long> threadIds = new ArrayList<>(threads.size());
        Set<Long> counterpartIds = new HashSet<>();
        for (ThreadEntity t : threads) {
            threadIds.add(t.getId());
            Long other = t.counterpartOf(userId);
            if (other != null) {
                counterpartIds.add(other);
            }
        }

        Map<Long, MessageEntity> lastByThread = new HashMap<>();
        for (MessageEntity m : messageMapper.selectLastMessagesByThreadIds(threadIds)) {
            lastByThread.put(m.getThreadId(), m);
        }

        Map<Long, Long> unreadByThread = new HashMap<>();
        for (UnreadCountRow row : messageMapper.selectUnreadCountsByThreadIds(userId, threadIds)) {
            if (row.getThreadId() != null) {
                unreadByThread.put(row.getThreadId(), row.getUnreadCount() == null ? 0L : row.getUnreadCount());
            }
        }

        Map<Long, String> namesById = new HashMap<>();
        if (!counterpartIds.isEmpty()) {
            for (UserEntity u : userMapper.selectBatchIds(counterpartIds)) {
                namesById.put(u.getId(), u.displayName());
            }
        }

        List<ThreadSummaryDto> out = new ArrayList<>(threads.size());
        for (ThreadEntity t : threads) {
            Long other = t.counterpartOf(userId);
            ThreadSummaryDto dto = new ThreadSummaryDto();
            dto.setThreadId(t.getId());
            dto.setKind(t.getKind());
            dto.setSubjectId(t.getSubjectId());
            dto.setOwnerId(t.getKind() == ThreadKind.SUBJECT ? t.getUserAId() : null);
            dto.setCounterpartId(other);
            dto.setCounterpartName(other == null ? null : namesById.get(other));
            dto.setActive(t.isActiveThread());
            dto.setLastActivityAt(t.getLastActivityAt());
            dto.setUnreadCount(unreadByThread.getOrDefault(t.getId(), 0L));

            MessageEntity last = lastByThread.get(t.getId());
            if (last != null) {
                ThreadSummaryDto.LastMessageDto lm = new ThreadSummaryDto.LastMessageDto();
                lm.setMessageId(last.getId());
                lm.setSenderId(last.getSenderId());
                lm.setBody(last.getBody());
                lm.setCreatedAt(last.getCreatedAt());
                dto.setLastMessage(lm);
            }
            out.add(dto);
        }
        return out;
    }

    @Override
    public List<MessageEntity> listMessages(long threadId, long viewerId) {
        getThreadFor(threadId, viewerId);
        return messageMapper.selectList(new LambdaQueryWrapper<MessageEntity>()
                .eq(MessageEntity::getThreadId, threadId)
                .orderByAsc(MessageEntity::getCreatedAt)
                .orderByAsc(MessageEntity::getId));
    }

    @Override
    public ThreadEntity getById(long threadId) {
        return threadMapper.selectById(threadId);
    }

    @Override
    public ThreadEntity getThreadFor(long threadId, long userId, ThreadKind requiredKind) {
        ThreadEntity t = threadMapper.selectById(threadId);
        if (t == null || (requiredKind != null && t.getKind() != requiredKind)) {
            throw BizException.notFound("thread_not_found");
        }
        if (!t.hasParticipant(userId)) {
            throw BizException.forbidden("not_thread_participant");
        }
        return t;
    }

    @Override
    public long unreadCount(long threadId, long userId) {
        getThreadFor(threadId, userId);
        Long n = messageMapper.selectCount(new LambdaQueryWrapper<MessageEntity>()
                .eq(MessageEntity::getThreadId, threadId)
                .ne(MessageEntity::getSenderId, userId)
                .isNull(MessageEntity::getReadAt));
        return n == null ? 0L : n;
    }

    @Override
    public long totalUnread(long userId) {
        return messageMapper.countUnreadForUser(userId);
    }

    @Override
    public boolean deactivateThread(long threadId, long actorId) {
        ThreadEntity t = getThreadFor(threadId, actorId);
        if (!t.isActiveThread()) {
            return false;
        }
        ThreadEntity patch = new ThreadEntity();
        patch.setId(threadId);
        patch.setActive(false);
        boolean changed = threadMapper.updateById(patch) > 0;
        if (changed) {
            log.info("thread deactivated: id={}, actorId={}", threadId, actorId);
        }
        return changed;
    }

    @Override
    public long countUnreadOlderThan(long userId, LocalDateTime cutoff) {
        return messageMapper.countUnreadOlderThan(userId, cutoff);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }

    private static void requireUserId(long userId) {
        if (userId <= 0) {
            throw BizException.badRequest("invalid_user_id");
        }
    }
}
