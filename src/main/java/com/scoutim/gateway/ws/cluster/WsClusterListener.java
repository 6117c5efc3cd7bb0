package com.scoutim.gateway.ws.cluster;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scoutim.gateway.config.FanoutProperties;
import com.scoutim.gateway.ws.WsEnvelope;
import com.scoutim.gateway.ws.WsPushService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "im.fanout.redis.enabled", havingValue = "true")
public class WsClusterListener implements MessageListener {

    private final ObjectMapper objectMapper;
    private final WsPushService pushService;
    private final FanoutProperties fanoutProps;

    @Override
    public void onMessage(Message message, byte[] pattern) {
        if (message == null || message.getBody() == null) {
            return;
        }
        String raw = new String(message.getBody(), StandardCharsets.UTF_8);
        WsClusterMessage msg;
        try {
            msg = objectMapper.readValue(raw, WsClusterMessage.class);
        } catch (Exception e) {
            log.debug("ws cluster message parse failed: {}", e.toString());
            return;
        }
        if (msg == null || msg.type() == null) {
            return;
        }
        // 本进程发布的广播：发布前已经在本地投递过
        if (fanoutProps.effectiveNodeId().equals(msg.originNodeId())) {
            return;
        }
        if (WsClusterMessage.TYPE_PUSH.equalsIgnoreCase(msg.type())) {
            handlePush(msg);
        }
    }

    private void handlePush(WsClusterMessage msg) {
        WsEnvelope env = msg.envelope();
        Long userId = msg.userId();
        if (env == null || userId == null || userId <= 0) {
            return;
        }
        int n = pushService.deliverToUser(userId, env);
        if (n > 0) {
            log.debug("ws cluster push delivered: origin={}, userId={}, connections={}", msg.originNodeId(), userId, n);
        }
    }
}
