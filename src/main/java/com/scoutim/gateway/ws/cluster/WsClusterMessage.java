package com.scoutim.gateway.ws.cluster;

import com.scoutim.gateway.ws.WsEnvelope;

/**
 * 跨进程广播的消息体。originNodeId 用于让发布方忽略自己发出的广播（发布方已在本地投递过）。
 */
public record WsClusterMessage(
        String type,
        String originNodeId,
        Long userId,
        WsEnvelope envelope,
        Long ts
) {

    public static final String TYPE_PUSH = "PUSH";

    public static WsClusterMessage push(String originNodeId, long userId, WsEnvelope envelope) {
        return new WsClusterMessage(TYPE_PUSH, originNodeId, userId, envelope, System.currentTimeMillis());
    }
}
