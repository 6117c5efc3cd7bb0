package com.scoutim.gateway.session;

import io.netty.channel.Channel;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionRegistryTest {

    @Test
    void registerTwoConnections_ThenUnregisterOne_OnlyOtherRemains() {
        ConnectionRegistry registry = new ConnectionRegistry();
        EmbeddedChannel a = new EmbeddedChannel();
        EmbeddedChannel b = new EmbeddedChannel();

        registry.register(7L, a);
        registry.register(7L, b);
        assertThat(registry.handlesFor(7L)).containsExactlyInAnyOrder(a, b);
        assertThat(registry.connectionCount()).isEqualTo(2);

        assertThat(registry.unregister(7L, a)).isTrue();
        assertThat(registry.handlesFor(7L)).containsExactly(b);
        assertThat(registry.isOnline(7L)).isTrue();
    }

    @Test
    void lastConnectionRemoved_UserEntryIsPruned() {
        ConnectionRegistry registry = new ConnectionRegistry();
        EmbeddedChannel a = new EmbeddedChannel();
        registry.register(7L, a);

        assertThat(registry.unregister(a)).isTrue();

        assertThat(registry.handlesFor(7L)).isEmpty();
        assertThat(registry.onlineUserIds()).doesNotContain(7L);
        assertThat(registry.isOnline(7L)).isFalse();
        assertThat(registry.unregister(7L, a)).isFalse();
    }

    @Test
    void unregisterByChannel_UsesBoundUserId() {
        ConnectionRegistry registry = new ConnectionRegistry();
        EmbeddedChannel a = new EmbeddedChannel();
        EmbeddedChannel unbound = new EmbeddedChannel();
        registry.register(11L, a);

        assertThat(registry.userIdOf(a)).isEqualTo(11L);
        assertThat(registry.unregister(unbound)).isFalse();
        assertThat(registry.unregister(a)).isTrue();
        assertThat(registry.connectionCount()).isZero();
    }

    @Test
    void snapshotIsNotAffectedByLaterChanges() {
        ConnectionRegistry registry = new ConnectionRegistry();
        EmbeddedChannel a = new EmbeddedChannel();
        registry.register(3L, a);

        List<Channel> snapshot = registry.handlesFor(3L);
        registry.unregister(3L, a);

        assertThat(snapshot).containsExactly(a);
    }

    @Test
    void concurrentRegisterAndUnregister_LeavesRegistryEmpty() throws Exception {
        ConnectionRegistry registry = new ConnectionRegistry();
        int threads = 8;
        int perThread = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                long userId = 100L + (t % 3);
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        EmbeddedChannel ch = new EmbeddedChannel();
                        registry.register(userId, ch);
                        registry.handlesFor(userId);
                        registry.unregister(userId, ch);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(registry.connectionCount()).isZero();
        assertThat(registry.onlineUserIds()).isEmpty();
    }
}
