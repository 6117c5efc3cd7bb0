package com.scoutim.domain.service;

import com.scoutim.domain.dto.MessageDto;
import com.scoutim.domain.dto.ThreadDetailDto;
import com.scoutim.domain.enums.ThreadKind;

/**
 * 发消息与打开会话的应用层流程：落库 + 实时投递。
 */
public interface ChatMessageAppService {

    /**
     * 落库后向对方投递新消息事件。投递失败只记日志，不影响发送结果。
     */
    default MessageDto send(long threadId, long senderId, String body) {
        return send(threadId, senderId, body, null);
    }

    /**
     * @param requiredKind 为 null 时不限会话类型；类型不符按会话不存在处理
     */
    MessageDto send(long threadId, long senderId, String body, ThreadKind requiredKind);

    /**
     * 按用户名打开（必要时创建）与对方的私信。
     */
    ThreadDetailDto openDirectThread(long userId, String recipientUsername);

    /**
     * 打开（必要时创建）围绕 subject 的会话，owner 为主题对象所属用户，userId 为发起查看的一方。
     */
    ThreadDetailDto openSubjectThread(long subjectId, long ownerId, long userId);

    /**
     * 会话详情：先把对方发来的未读消息标记为已读，再返回全部消息。
     */
    default ThreadDetailDto threadDetail(long threadId, long userId) {
        return threadDetail(threadId, userId, null);
    }

    ThreadDetailDto threadDetail(long threadId, long userId, ThreadKind requiredKind);
}
