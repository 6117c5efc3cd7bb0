package com.scoutim.gateway.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scoutim.gateway.session.ConnectionRegistry;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;

/**
 * 握手完成后的连接生命周期：
 * <ul>
 *   <li>握手完成：按绑定的 userId 登记到 {@link ConnectionRegistry}</li>
 *   <li>客户端 PING -> 服务端 PONG；WRITER_IDLE -> 服务端 PING</li>
 *   <li>连接关闭/异常：同步移除登记</li>
 * </ul>
 *
 * <p>本服务的 WS 只用于服务端下发，客户端发消息走 HTTP。</p>
 */
@Slf4j
public class WsConnectionHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

    private final ObjectMapper objectMapper;
    private final ConnectionRegistry connectionRegistry;
    private final WsWriter wsWriter;

    public WsConnectionHandler(ObjectMapper objectMapper, ConnectionRegistry connectionRegistry, WsWriter wsWriter) {
        this.objectMapper = objectMapper;
        this.connectionRegistry = connectionRegistry;
        this.wsWriter = wsWriter;
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            onHandshakeComplete(ctx);
            return;
        }
        if (evt instanceof IdleStateEvent idle && idle.state() == IdleState.WRITER_IDLE) {
            onWriterIdle(ctx);
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    void onHandshakeComplete(ChannelHandlerContext ctx) {
        Channel ch = ctx.channel();
        Long userId = connectionRegistry.userIdOf(ch);
        if (userId == null) {
            wsWriter.writeError(ch, "unauthorized");
            ctx.close();
            return;
        }
        connectionRegistry.register(userId, ch);
        log.info("ws connected: userId={}, channel={}, totalConnections={}",
                userId, ch.id().asShortText(), connectionRegistry.connectionCount());
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
        if (!(frame instanceof TextWebSocketFrame text)) {
            return;
        }
        WsEnvelope in;
        try {
            in = objectMapper.readValue(text.text(), WsEnvelope.class);
        } catch (Exception e) {
            wsWriter.writeError(ctx.channel(), "bad_json");
            return;
        }
        if (in == null || in.type == null) {
            wsWriter.writeError(ctx.channel(), "missing_type");
            return;
        }
        if (WsEnvelope.TYPE_PING.equalsIgnoreCase(in.type)) {
            wsWriter.write(ctx.channel(), WsEnvelope.of(WsEnvelope.TYPE_PONG, Instant.now().toEpochMilli()));
            return;
        }
        if (WsEnvelope.TYPE_PONG.equalsIgnoreCase(in.type)) {
            return;
        }
        wsWriter.writeError(ctx.channel(), "unsupported_type");
    }

    private void onWriterIdle(ChannelHandlerContext ctx) {
        // WS 层 ping 让客户端自动回 pong，用于 NAT/代理保活
        ctx.writeAndFlush(new PingWebSocketFrame());
        wsWriter.write(ctx.channel(), WsEnvelope.of(WsEnvelope.TYPE_PING, Instant.now().toEpochMilli()));
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        Channel ch = ctx.channel();
        if (connectionRegistry.unregister(ch)) {
            log.info("ws disconnected: userId={}, channel={}, totalConnections={}",
                    connectionRegistry.userIdOf(ch), ch.id().asShortText(), connectionRegistry.connectionCount());
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        Channel ch = ctx.channel();
        log.debug("ws channel error: userId={}, channel={}, err={}",
                connectionRegistry.userIdOf(ch), ch.id().asShortText(), cause.toString());
        connectionRegistry.unregister(ch);
        ctx.close();
    }
}
