package com.scoutim.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 跨进程扩散执行器。固定单线程，保证同一进程内按提交顺序发布。
 */
@ConfigurationProperties(prefix = "im.executors.fanout")
public record ImFanoutExecutorProperties(
        Integer queueCapacity
) {

    public int queueCapacityEffective() {
        Integer v = queueCapacity;
        if (v == null) {
            return 10_000;
        }
        return Math.max(0, v);
    }
}
