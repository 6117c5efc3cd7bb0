package com.scoutim.gateway.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scoutim.gateway.session.ConnectionRegistry;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOutboundHandlerAdapter;
import io.netty.channel.ChannelPromise;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.util.ReferenceCountUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class WsPushServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ConnectionRegistry registry;
    private WsPushService pushService;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry();
        pushService = new WsPushService(registry, new WsWriter(objectMapper));
    }

    @Test
    void eachConnectionReceivesTheEventOnce_AndUnregisteredOneReceivesNothing() throws Exception {
        EmbeddedChannel a = new EmbeddedChannel();
        EmbeddedChannel b = new EmbeddedChannel();
        registry.register(7L, a);
        registry.register(7L, b);

        assertThat(pushService.deliverToUser(7L, newMessage(11L, "hello"))).isEqualTo(2);

        assertSingleFrame(a, 11L, "hello");
        assertSingleFrame(b, 11L, "hello");

        registry.unregister(7L, a);
        assertThat(pushService.deliverToUser(7L, newMessage(12L, "again"))).isEqualTo(1);

        assertThat((Object) a.readOutbound()).isNull();
        assertSingleFrame(b, 12L, "again");
    }

    @Test
    void offlineUser_NothingAttempted() {
        assertThat(pushService.deliverToUser(99L, newMessage(1L, "x"))).isZero();
    }

    @Test
    void closedConnection_IsDroppedWithoutWriting() {
        EmbeddedChannel a = new EmbeddedChannel();
        registry.register(7L, a);
        a.close();

        assertThat(pushService.deliverToUser(7L, newMessage(1L, "x"))).isZero();
        assertThat(registry.handlesFor(7L)).isEmpty();
    }

    @Test
    void failedWrite_UnregistersConnection_AndDoesNotThrow() {
        EmbeddedChannel broken = new EmbeddedChannel(new ChannelOutboundHandlerAdapter() {
            @Override
            public void write(ChannelHandlerContext ctx, Object msg, ChannelPromise promise) {
                ReferenceCountUtil.release(msg);
                promise.setFailure(new IOException("broken pipe"));
            }
        });
        EmbeddedChannel healthy = new EmbeddedChannel();
        registry.register(9L, broken);
        registry.register(9L, healthy);

        assertThat(pushService.deliverToUser(9L, newMessage(5L, "x"))).isEqualTo(2);

        assertThat(registry.handlesFor(9L)).containsExactly(healthy);
        assertSingleFrame(healthy, 5L, "x");
    }

    private static WsEnvelope newMessage(long threadId, String body) {
        WsEnvelope env = WsEnvelope.of(WsEnvelope.TYPE_DM_NEW_MESSAGE, 1_700_000_000_000L);
        env.threadId = threadId;
        env.messageId = 1000L + threadId;
        env.senderId = 1L;
        env.body = body;
        return env;
    }

    private void assertSingleFrame(EmbeddedChannel ch, long threadId, String body) {
        TextWebSocketFrame frame = ch.readOutbound();
        assertThat(frame).isNotNull();
        try {
            WsEnvelope got = objectMapper.readValue(frame.text(), WsEnvelope.class);
            assertThat(got.type).isEqualTo(WsEnvelope.TYPE_DM_NEW_MESSAGE);
            assertThat(got.threadId).isEqualTo(threadId);
            assertThat(got.body).isEqualTo(body);
        } catch (IOException e) {
            throw new AssertionError(e);
        } finally {
            frame.release();
        }
        assertThat((Object) ch.readOutbound()).isNull();
    }
}
