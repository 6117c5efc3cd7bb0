package com.scoutim.gateway.ws.cluster;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scoutim.gateway.config.FanoutProperties;
import com.scoutim.gateway.ws.WsEnvelope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class WsClusterBusTest {

    private StringRedisTemplate redis;
    private WsClusterBus bus;

    @BeforeEach
    void setUp() {
        redis = mock(StringRedisTemplate.class);
        FanoutProperties props = new FanoutProperties();
        props.setNodeId("node-a");
        bus = new WsClusterBus(redis, new ObjectMapper(), props);
    }

    @Test
    void publish_SendsJsonToTopic() {
        assertThat(bus.publish(WsClusterMessage.push("node-a", 7L, WsEnvelope.of(WsEnvelope.TYPE_DM_NEW_MESSAGE, 1L))))
                .isTrue();

        verify(redis).convertAndSend(eq(FanoutProperties.DEFAULT_TOPIC), contains("\"originNodeId\":\"node-a\""));
    }

    @Test
    void redisFailure_OpensFailFastWindow() {
        doThrow(new RedisConnectionFailureException("down")).when(redis).convertAndSend(anyString(), any());
        WsClusterMessage msg = WsClusterMessage.push("node-a", 7L, WsEnvelope.of(WsEnvelope.TYPE_DM_NEW_MESSAGE, 1L));

        assertThat(bus.publish(msg)).isFalse();
        assertThat(bus.shouldFailFast()).isTrue();
        assertThat(bus.publish(msg)).isFalse();

        verify(redis, times(1)).convertAndSend(anyString(), any());
    }

    @Test
    void nullMessage_IsNotPublished() {
        assertThat(bus.publish(null)).isFalse();
    }
}
