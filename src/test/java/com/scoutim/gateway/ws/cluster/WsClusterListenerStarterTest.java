package com.scoutim.gateway.ws.cluster;

import org.junit.jupiter.api.Test;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class WsClusterListenerStarterTest {

    @Test
    void backoff_DoublesAndIsCapped() {
        assertThat(WsClusterListenerStarter.backoffMs(0)).isEqualTo(200);
        assertThat(WsClusterListenerStarter.backoffMs(1)).isEqualTo(200);
        assertThat(WsClusterListenerStarter.backoffMs(2)).isEqualTo(400);
        assertThat(WsClusterListenerStarter.backoffMs(5)).isEqualTo(3200);
        assertThat(WsClusterListenerStarter.backoffMs(6)).isEqualTo(5000);
        assertThat(WsClusterListenerStarter.backoffMs(50)).isEqualTo(5000);
    }

    @Test
    void failedStart_IsRetriedInBackground() {
        RedisMessageListenerContainer container = mock(RedisMessageListenerContainer.class);
        doThrow(new IllegalStateException("redis down")).doNothing().when(container).start();
        WsClusterListenerStarter starter = new WsClusterListenerStarter(container);

        starter.start();

        verify(container, timeout(3000).times(2)).start();
        starter.stop();
        verify(container, times(1)).stop();
    }
}
