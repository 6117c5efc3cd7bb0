package com.scoutim.gateway.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scoutim.auth.service.JwtService;
import com.scoutim.gateway.config.GatewayProperties;
import com.scoutim.gateway.session.ConnectionRegistry;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleStateHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@Component
@ConditionalOnProperty(name = "im.gateway.ws.enabled", havingValue = "true", matchIfMissing = true)
public class NettyWsServer implements SmartLifecycle {

    private final GatewayProperties props;
    private final ObjectMapper objectMapper;
    private final JwtService jwtService;
    private final ConnectionRegistry connectionRegistry;
    private final WsWriter wsWriter;

    private EventLoopGroup boss;
    private EventLoopGroup worker;
    private Channel serverChannel;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public NettyWsServer(GatewayProperties props,
                         ObjectMapper objectMapper,
                         JwtService jwtService,
                         ConnectionRegistry connectionRegistry,
                         WsWriter wsWriter) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.jwtService = jwtService;
        this.connectionRegistry = connectionRegistry;
        this.wsWriter = wsWriter;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }

        String host = props.hostEffective();
        String path = props.pathEffective();
        log.info("Starting Netty WS gateway on {}:{}{}", host, props.port(), path);

        boss = new NioEventLoopGroup(1);
        worker = new NioEventLoopGroup();

        ServerBootstrap b = new ServerBootstrap();
        b.group(boss, worker)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();

                        // 1) 握手阶段是 HTTP：编解码 + 聚合成 FullHttpRequest
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(props.maxHttpContentBytesEffective()));

                        // 2) writerIdle 间隔内没有任何写出 -> 触发服务端心跳
                        p.addLast(new IdleStateHandler(0, props.writerIdleSecondsEffective(), 0));

                        // 3) 握手鉴权：校验 accessToken，把 userId 绑定到 channel
                        p.addLast(new WsHandshakeAuthHandler(path, jwtService));

                        // 4) WebSocket 协议：upgrade、协议层 ping/pong、close 帧
                        WebSocketServerProtocolConfig wsConfig = WebSocketServerProtocolConfig.newBuilder()
                                .websocketPath(path)
                                .checkStartsWith(true)
                                .allowExtensions(true)
                                .build();
                        p.addLast(new WebSocketServerProtocolHandler(wsConfig));

                        // 5) 连接登记、JSON 心跳、断开清理
                        p.addLast(new WsConnectionHandler(objectMapper, connectionRegistry, wsWriter));
                    }
                });

        try {
            serverChannel = b.bind(host, props.port()).syncUninterruptibly().channel();
            log.info("Netty WS gateway started, listening on {}", serverChannel.localAddress());
        } catch (Exception e) {
            log.error("Failed to start Netty WS gateway on {}:{}{}", host, props.port(), path, e);
            stop();
            throw e;
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping Netty WS gateway...");
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        if (worker != null) {
            worker.shutdownGracefully();
        }
        if (boss != null) {
            boss.shutdownGracefully();
        }
        log.info("Netty WS gateway stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        return Integer.MIN_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    @Override
    public void stop(Runnable callback) {
        stop();
        callback.run();
    }
}
