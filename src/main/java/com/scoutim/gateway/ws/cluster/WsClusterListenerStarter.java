package com.scoutim.gateway.ws.cluster;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 让 Redis Pub/Sub 监听器在 Redis 不可用时也不阻断启动，并在后台按指数退避重试。
 *
 * <p>Redis 恢复前其他进程的事件收不到，本进程的本地投递不受影响。</p>
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "im.fanout.redis.enabled", havingValue = "true")
public class WsClusterListenerStarter implements SmartLifecycle {

    private final RedisMessageListenerContainer container;
    private final ScheduledExecutorService retryScheduler;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicInteger attempt = new AtomicInteger(0);

    public WsClusterListenerStarter(RedisMessageListenerContainer container) {
        this.container = container;
        this.retryScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ws-cluster-listener-retry");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        tryStart(0);
    }

    private void tryStart(long delayMs) {
        retryScheduler.schedule(() -> {
            if (!started.get()) {
                return;
            }
            try {
                container.start();
                attempt.set(0);
                log.info("ws cluster listener started");
            } catch (Exception e) {
                int n = attempt.incrementAndGet();
                long nextDelayMs = backoffMs(n);
                log.warn("ws cluster listener start failed (attempt={}, retryInMs={}): {}", n, nextDelayMs, e.toString());
                tryStart(nextDelayMs);
            }
        }, Math.max(0, delayMs), TimeUnit.MILLISECONDS);
    }

    static long backoffMs(int attempt) {
        if (attempt <= 0) {
            return 200;
        }
        long v = 200L * (1L << Math.min(6, attempt - 1));
        return Math.min(5000L, Math.max(200L, v));
    }

    @Override
    public void stop() {
        started.set(false);
        try {
            container.stop();
        } catch (Exception e) {
            log.debug("stop ws cluster listener failed: {}", e.toString());
        }
        retryScheduler.shutdownNow();
    }

    @Override
    public boolean isRunning() {
        return started.get() && container.isRunning();
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}
