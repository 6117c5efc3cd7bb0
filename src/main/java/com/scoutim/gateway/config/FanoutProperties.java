package com.scoutim.gateway.config;

import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.UUID;

/**
 * 跨进程扩散配置。
 *
 * <p>redis.enabled=false 时只做本进程投递（单进程部署）。</p>
 */
@Data
@ConfigurationProperties(prefix = "im.fanout")
public class FanoutProperties {

    public static final String DEFAULT_TOPIC = "im:fanout:events";

    /** 进程标识；为空时启动后随机生成一次，之后不变。 */
    private String nodeId;

    private String topic = DEFAULT_TOPIC;

    private Redis redis = new Redis();

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private volatile String generatedNodeId;

    public String effectiveNodeId() {
        if (nodeId != null && !nodeId.isBlank()) {
            return nodeId;
        }
        String v = generatedNodeId;
        if (v == null) {
            synchronized (this) {
                if (generatedNodeId == null) {
                    generatedNodeId = UUID.randomUUID().toString();
                }
                v = generatedNodeId;
            }
        }
        return v;
    }

    public String effectiveTopic() {
        return topic == null || topic.isBlank() ? DEFAULT_TOPIC : topic;
    }

    @Data
    public static class Redis {
        private boolean enabled;
    }
}
