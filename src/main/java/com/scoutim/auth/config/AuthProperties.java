package com.scoutim.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * accessToken 校验参数。签发由账号服务负责，这里只需要与其一致的 issuer 和密钥。
 */
@ConfigurationProperties(prefix = "im.auth")
public record AuthProperties(
        String issuer,
        String jwtSecret,
        long accessTokenTtlSeconds
) {

    public long accessTokenTtlSecondsEffective() {
        return accessTokenTtlSeconds > 0 ? accessTokenTtlSeconds : 86_400;
    }
}
