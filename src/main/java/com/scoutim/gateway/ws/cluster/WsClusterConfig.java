package com.scoutim.gateway.ws.cluster;

import com.scoutim.gateway.config.FanoutProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.util.backoff.FixedBackOff;

@Configuration
@ConditionalOnProperty(name = "im.fanout.redis.enabled", havingValue = "true")
public class WsClusterConfig {

    @Bean
    public RedisMessageListenerContainer wsClusterListenerContainer(
            RedisConnectionFactory connectionFactory,
            WsClusterListener listener,
            FanoutProperties fanoutProps
    ) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer() {
            @Override
            public boolean isAutoStartup() {
                return false;
            }
        };
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(listener, new ChannelTopic(fanoutProps.effectiveTopic()));

        // 由 WsClusterListenerStarter 在后台启动并重试，Redis 不可用时不阻断启动
        container.setRecoveryBackoff(new FixedBackOff(1000, FixedBackOff.UNLIMITED_ATTEMPTS));
        return container;
    }
}
