package com.scoutim.config;

import com.baomidou.mybatisplus.core.incrementer.DefaultIdentifierGenerator;
import com.baomidou.mybatisplus.core.incrementer.IdentifierGenerator;
import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 多进程部署时每个节点需要不同的雪花 workerId，否则同一毫秒内可能生成相同的 thread/message id。
 *
 * <p>优先用 {@code im.id.worker-id}；未配置时由 {@code im.fanout.node-id} 散列得到；都没有则保持 MyBatis-Plus 默认。</p>
 */
@Configuration
public class IdWorkerConfig {
    private static final Logger log = LoggerFactory.getLogger(IdWorkerConfig.class);

    private final long datacenterId;
    private final long workerId;
    private final String nodeId;

    public IdWorkerConfig(
            @Value("${im.id.datacenter-id:1}") long datacenterId,
            @Value("${im.id.worker-id:-1}") long workerId,
            @Value("${im.fanout.node-id:}") String nodeId
    ) {
        this.datacenterId = datacenterId;
        this.workerId = workerId;
        this.nodeId = nodeId;
    }

    @Bean
    public IdentifierGenerator identifierGenerator() {
        long wid = resolveWorkerId(workerId, nodeId);
        if (wid < 0) {
            log.info("IdWorker: keep default (no im.id.worker-id and no im.fanout.node-id)");
            return DefaultIdentifierGenerator.getInstance();
        }
        long dc = normalize5Bits(datacenterId);
        IdWorker.initSequence(wid, dc);
        log.info("IdWorker: initSequence(workerId={}, datacenterId={}, nodeId={})", wid, dc, nodeId);
        return new DefaultIdentifierGenerator(wid, dc);
    }

    static long resolveWorkerId(long configured, String nodeId) {
        if (configured >= 0) {
            return normalize5Bits(configured);
        }
        if (nodeId == null || nodeId.isBlank()) {
            return -1;
        }
        return normalize5Bits(nodeId.hashCode());
    }

    static long normalize5Bits(long v) {
        long x = v % 32;
        return x < 0 ? x + 32 : x;
    }
}
