package com.scoutim.gateway.ws.cluster;

import com.scoutim.gateway.config.FanoutProperties;
import com.scoutim.gateway.ws.WsEnvelope;
import com.scoutim.gateway.ws.WsPushService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 实时投递入口：先投递本进程的连接，再广播给其他进程。
 *
 * <p>两步都在 imFanoutExecutor（单线程）上执行：调用方不等待网络 I/O，同一进程内按提交顺序投递。
 * 未启用 Redis 时只做本地投递。</p>
 */
@Slf4j
@Component
public class FanoutBridge {

    private final WsPushService pushService;
    private final Optional<WsClusterBus> clusterBus;
    private final FanoutProperties fanoutProps;
    private final Executor fanoutExecutor;

    public FanoutBridge(WsPushService pushService,
                        Optional<WsClusterBus> clusterBus,
                        FanoutProperties fanoutProps,
                        @Qualifier("imFanoutExecutor") Executor fanoutExecutor) {
        this.pushService = pushService;
        this.clusterBus = clusterBus;
        this.fanoutProps = fanoutProps;
        this.fanoutExecutor = fanoutExecutor;
    }

    public void publish(long targetUserId, WsEnvelope envelope) {
        if (targetUserId <= 0 || envelope == null) {
            return;
        }
        try {
            fanoutExecutor.execute(() -> deliver(targetUserId, envelope));
        } catch (RejectedExecutionException e) {
            log.warn("fanout rejected: userId={}, type={}, err={}", targetUserId, envelope.type, e.toString());
        }
    }

    public boolean isClustered() {
        return clusterBus.isPresent();
    }

    private void deliver(long targetUserId, WsEnvelope envelope) {
        try {
            pushService.deliverToUser(targetUserId, envelope);
        } catch (Exception e) {
            log.warn("local delivery failed: userId={}, type={}, err={}", targetUserId, envelope.type, e.toString());
        }
        if (clusterBus.isEmpty()) {
            return;
        }
        try {
            clusterBus.get().publish(WsClusterMessage.push(fanoutProps.effectiveNodeId(), targetUserId, envelope));
        } catch (Exception e) {
            log.warn("fanout broadcast failed: userId={}, type={}, err={}", targetUserId, envelope.type, e.toString());
        }
    }
}
