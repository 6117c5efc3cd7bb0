package com.scoutim.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "im.gateway.ws")
public record GatewayProperties(
        Boolean enabled,
        String host,
        int port,
        String path,
        Integer writerIdleSeconds,
        Integer maxHttpContentBytes
) {

    public String hostEffective() {
        return host == null || host.isBlank() ? "0.0.0.0" : host;
    }

    public String pathEffective() {
        return path == null || path.isBlank() ? "/ws" : path;
    }

    public int writerIdleSecondsEffective() {
        Integer v = writerIdleSeconds;
        if (v == null || v < 0) {
            return 60;
        }
        return v;
    }

    public int maxHttpContentBytesEffective() {
        Integer v = maxHttpContentBytes;
        if (v == null || v <= 0) {
            return 65536;
        }
        return v;
    }
}
