package com.scoutim.gateway.ws.cluster;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scoutim.gateway.config.FanoutProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 通过 Redis Pub/Sub 把投递事件广播给所有进程。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "im.fanout.redis.enabled", havingValue = "true")
public class WsClusterBus {

    /**
     * Redis 故障后的 fail-fast 窗口：窗口内直接放弃发布，不让扩散线程阻塞在 Redis 超时上。
     */
    static final long REDIS_FAIL_FAST_MS = 10_000;

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final FanoutProperties fanoutProps;

    private final AtomicLong redisUnavailableUntilMs = new AtomicLong(0);

    /**
     * @return 是否已交给 Redis
     */
    public boolean publish(WsClusterMessage msg) {
        if (msg == null) {
            return false;
        }
        if (shouldFailFast()) {
            log.debug("ws cluster publish skipped (fail-fast): type={}, userId={}", msg.type(), msg.userId());
            return false;
        }
        try {
            String json = objectMapper.writeValueAsString(msg);
            redis.convertAndSend(fanoutProps.effectiveTopic(), json);
            return true;
        } catch (Exception e) {
            log.warn("ws cluster publish failed: type={}, userId={}, err={}", msg.type(), msg.userId(), e.toString());
            markRedisDown();
            return false;
        }
    }

    boolean shouldFailFast() {
        return System.currentTimeMillis() < redisUnavailableUntilMs.get();
    }

    private void markRedisDown() {
        long until = System.currentTimeMillis() + REDIS_FAIL_FAST_MS;
        while (true) {
            long prev = redisUnavailableUntilMs.get();
            if (prev >= until) {
                return;
            }
            if (redisUnavailableUntilMs.compareAndSet(prev, until)) {
                return;
            }
        }
    }
}
