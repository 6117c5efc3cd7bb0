package com.scoutim.gateway.ws;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

/**
 * WS 文本帧的 JSON 结构（服务端下发的事件与心跳共用）。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WsEnvelope {

    public static final String TYPE_DM_NEW_MESSAGE = "DM_NEW_MESSAGE";
    public static final String TYPE_THREAD_NEW_MESSAGE = "THREAD_NEW_MESSAGE";
    public static final String TYPE_PING = "PING";
    public static final String TYPE_PONG = "PONG";
    public static final String TYPE_ERROR = "ERROR";

    /**
     * 消息类型（路由字段）：DM_NEW_MESSAGE / THREAD_NEW_MESSAGE / PING / PONG / ERROR。
     */
    public String type;

    public Long threadId;

    public Long messageId;

    /** 服务端确认的发送方 userId。 */
    public Long senderId;

    /** 发送方展示名。 */
    public String senderName;

    /** 消息正文。 */
    public String body;

    /** 主题会话的主题对象 id；私信不下发。 */
    public Long subjectId;

    /** 时间戳（毫秒）。新消息事件为消息创建时间。 */
    public Long ts;

    /** 错误原因（ERROR 时返回）。 */
    public String reason;

    public static WsEnvelope of(String type, long ts) {
        WsEnvelope env = new WsEnvelope();
        env.type = type;
        env.ts = ts;
        return env;
    }
}
