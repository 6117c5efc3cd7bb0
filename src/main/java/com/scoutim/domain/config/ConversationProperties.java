package com.scoutim.domain.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "im.conversation")
public record ConversationProperties(
        Integer maxBodyLength
) {

    public int maxBodyLengthEffective() {
        Integer v = maxBodyLength;
        if (v == null || v <= 0) {
            return 4000;
        }
        return v;
    }
}
