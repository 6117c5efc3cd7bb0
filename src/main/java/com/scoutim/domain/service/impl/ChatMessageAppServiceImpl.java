package com.scoutim.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.scoutim.common.api.BizException;
import com.scoutim.domain.dto.MessageDto;
import com.scoutim.domain.dto.ThreadDetailDto;
import com.scoutim.domain.entity.MessageEntity;
import com.scoutim.domain.entity.ThreadEntity;
import com.scoutim.domain.entity.UserEntity;
import com.scoutim.domain.enums.ThreadKind;
import com.scoutim.domain.mapper.UserMapper;
import com.scoutim.domain.service.ChatMessageAppService;
import com.scoutim.domain.service.ConversationStore;
import com.scoutim.gateway.ws.WsEnvelope;
import com.scoutim.gateway.ws.cluster.FanoutBridge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
public class ChatMessageAppServiceImpl implements ChatMessageAppService {

    private final ConversationStore conversationStore;
    private final UserMapper userMapper;
    private final FanoutBridge fanoutBridge;

    public ChatMessageAppServiceImpl(ConversationStore conversationStore,
                                     UserMapper userMapper,
                                     FanoutBridge fanoutBridge) {
        this.conversationStore = conversationStore;
        this.userMapper = userMapper;
        this.fanoutBridge = fanoutBridge;
    }

    @Override
    public MessageDto send(long threadId, long senderId, String body, ThreadKind requiredKind) {
        MessageEntity m = conversationStore.appendMessage(threadId, senderId, body, requiredKind);
        try {
            notifyRecipient(m);
        } catch (Exception e) {
            log.warn("new message fanout failed: threadId={}, messageId={}, err={}", threadId, m.getId(), e.toString());
        }
        return MessageDto.from(m, senderId);
    }

    private void notifyRecipient(MessageEntity m) {
        ThreadEntity t = conversationStore.getById(m.getThreadId());
        if (t == null) {
            return;
        }
        Long recipientId = t.counterpartOf(m.getSenderId());
        if (recipientId == null) {
            return;
        }
        UserEntity sender = userMapper.selectById(m.getSenderId());

        WsEnvelope env = new WsEnvelope();
        env.type = t.getKind() == ThreadKind.SUBJECT ? WsEnvelope.TYPE_THREAD_NEW_MESSAGE : WsEnvelope.TYPE_DM_NEW_MESSAGE;
        env.threadId = t.getId();
        env.messageId = m.getId();
        env.senderId = m.getSenderId();
        env.senderName = sender == null ? null : sender.displayName();
        env.body = m.getBody();
        if (t.getKind() == ThreadKind.SUBJECT) {
            env.subjectId = t.getSubjectId();
        }
        env.ts = m.getCreatedAt().atZone(ZoneId.systemDefault()).toInstant().toEpochMilli();
        fanoutBridge.publish(recipientId, env);
    }

    @Override
    public ThreadDetailDto openDirectThread(long userId, String recipientUsername) {
        if (recipientUsername == null || recipientUsername.isBlank()) {
            throw BizException.badRequest("recipient_username_required");
        }
        String name = recipientUsername.trim();
        UserEntity recipient = userMapper.selectOne(new LambdaQueryWrapper<UserEntity>()
                .eq(UserEntity::getUsername, name)
                .last("limit 1"));
        if (recipient == null) {
            recipient = userMapper.selectOne(new LambdaQueryWrapper<UserEntity>()
                    .eq(UserEntity::getLoginName, name)
                    .last("limit 1"));
        }
        if (recipient == null) {
            throw BizException.notFound("recipient_not_found");
        }
        ThreadEntity t = conversationStore.getOrCreateThread(userId, recipient.getId());
        return detail(t, userId);
    }

    @Override
    public ThreadDetailDto openSubjectThread(long subjectId, long ownerId, long userId) {
        if (ownerId > 0 && userMapper.selectById(ownerId) == null) {
            throw BizException.notFound("owner_not_found");
        }
        ThreadEntity t = conversationStore.getOrCreateSubjectThread(subjectId, ownerId, userId);
        return detail(t, userId);
    }

    @Override
    public ThreadDetailDto threadDetail(long threadId, long userId, ThreadKind requiredKind) {
        ThreadEntity t = conversationStore.getThreadFor(threadId, userId, requiredKind);
        return detail(t, userId);
    }

    private ThreadDetailDto detail(ThreadEntity t, long userId) {
        int marked = conversationStore.markRead(t.getId(), userId);
        List<MessageEntity> messages = conversationStore.listMessages(t.getId(), userId);

        Long other = t.counterpartOf(userId);
        UserEntity counterpart = other == null ? null : userMapper.selectById(other);

        ThreadDetailDto dto = new ThreadDetailDto();
        dto.setThreadId(t.getId());
        dto.setKind(t.getKind());
        dto.setSubjectId(t.getSubjectId());
        dto.setOwnerId(t.getKind() == ThreadKind.SUBJECT ? t.getUserAId() : null);
        dto.setCounterpartId(other);
        dto.setCounterpartName(counterpart == null ? null : counterpart.displayName());
        dto.setActive(t.isActiveThread());
        dto.setMarkedRead(marked);
        List<MessageDto> out = new ArrayList<>(messages.size());
        for (MessageEntity m : messages) {
            out.add(MessageDto.from(m, userId));
        }
        dto.setMessages(out);
        return dto;
    }
}
