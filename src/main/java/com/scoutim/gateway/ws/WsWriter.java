package com.scoutim.gateway.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelPromise;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * WS 文本协议统一写出器：
 * - 统一序列化/错误回包
 * - 保证 ch.writeAndFlush 在对应 channel eventLoop 执行
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WsWriter {

    private final ObjectMapper objectMapper;

    public String encode(WsEnvelope env) throws JsonProcessingException {
        return objectMapper.writeValueAsString(env);
    }

    public ChannelFuture write(Channel ch, WsEnvelope env) {
        if (ch == null) {
            throw new IllegalArgumentException("channel is null");
        }
        String json;
        try {
            json = encode(env);
        } catch (Exception e) {
            log.warn("ws serialize failed: type={}, err={}", env == null ? null : env.type, e.toString());
            return ch.newFailedFuture(e);
        }
        return writeJson(ch, json);
    }

    /**
     * 写出已序列化好的 JSON；同一事件发往多条连接时只序列化一次。
     */
    public ChannelFuture writeJson(Channel ch, String json) {
        if (ch == null) {
            throw new IllegalArgumentException("channel is null");
        }
        if (ch.eventLoop().inEventLoop()) {
            return doWrite(ch, json);
        }
        ChannelPromise promise = ch.newPromise();
        try {
            ch.eventLoop().execute(() -> doWrite(ch, json).addListener(f -> {
                if (f.isSuccess()) {
                    promise.setSuccess();
                } else {
                    promise.setFailure(f.cause());
                }
            }));
        } catch (Exception e) {
            promise.setFailure(e);
        }
        return promise;
    }

    public ChannelFuture writeError(Channel ch, String reason) {
        WsEnvelope err = WsEnvelope.of(WsEnvelope.TYPE_ERROR, Instant.now().toEpochMilli());
        err.reason = reason;
        return write(ch, err);
    }

    private static ChannelFuture doWrite(Channel ch, String json) {
        try {
            return ch.writeAndFlush(new TextWebSocketFrame(json));
        } catch (Exception e) {
            return ch.newFailedFuture(e);
        }
    }
}
