package com.scoutim.gateway.ws;

import com.scoutim.gateway.session.ConnectionRegistry;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 本进程投递：把事件写给某个用户在本进程上的全部连接。
 *
 * <p>尽力而为：写失败或连接已关闭时把该连接从 {@link ConnectionRegistry} 移除，不向调用方抛异常。</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WsPushService {

    private final ConnectionRegistry connectionRegistry;
    private final WsWriter wsWriter;

    /**
     * @return 尝试写出的连接数（用户在本进程不在线时为 0）
     */
    public int deliverToUser(long userId, WsEnvelope envelope) {
        if (envelope == null) {
            return 0;
        }
        List<Channel> channels = connectionRegistry.handlesFor(userId);
        if (channels.isEmpty()) {
            return 0;
        }

        String json;
        try {
            json = wsWriter.encode(envelope);
        } catch (Exception e) {
            log.warn("push serialize failed: userId={}, type={}, err={}", userId, envelope.type, e.toString());
            return 0;
        }

        int attempted = 0;
        for (Channel ch : channels) {
            if (ch == null) {
                continue;
            }
            if (!ch.isActive()) {
                connectionRegistry.unregister(userId, ch);
                continue;
            }
            attempted++;
            try {
                ChannelFuture f = wsWriter.writeJson(ch, json);
                f.addListener(done -> {
                    if (!done.isSuccess()) {
                        dropDeadChannel(userId, ch, done.cause());
                    }
                });
            } catch (Exception e) {
                dropDeadChannel(userId, ch, e);
            }
        }
        return attempted;
    }

    private void dropDeadChannel(long userId, Channel ch, Throwable cause) {
        log.debug("push failed, dropping connection: userId={}, channel={}, err={}",
                userId, ch.id().asShortText(), cause == null ? null : cause.toString());
        connectionRegistry.unregister(userId, ch);
        try {
            ch.close();
        } catch (Exception e) {
            log.debug("close channel failed: userId={}, err={}", userId, e.toString());
        }
    }
}
