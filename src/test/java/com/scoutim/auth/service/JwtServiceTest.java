package com.scoutim.auth.service;

import com.scoutim.auth.config.AuthProperties;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JwtServiceTest {

    private static final String SECRET = "test-secret-test-secret-test-secret-0001";

    private final JwtService jwtService = new JwtService(new AuthProperties("scout-im", SECRET, 3600L));

    @Test
    void issuedToken_ResolvesToSameUser() {
        String token = jwtService.issueAccessToken(1001L);

        assertThat(jwtService.verifyAndGetUserId(token)).isEqualTo(1001L);
    }

    @Test
    void otherIssuer_IsRejected() {
        JwtService other = new JwtService(new AuthProperties("someone-else", SECRET, 3600L));
        String token = other.issueAccessToken(1001L);

        assertThrows(JwtException.class, () -> jwtService.verifyAndGetUserId(token));
    }

    @Test
    void otherSecret_IsRejected() {
        JwtService other = new JwtService(new AuthProperties("scout-im", "another-secret-another-secret-0002", 3600L));
        String token = other.issueAccessToken(1001L);

        assertThrows(JwtException.class, () -> jwtService.verifyAndGetUserId(token));
    }

    @Test
    void nonAccessTokenType_IsRejected() {
        String refresh = Jwts.builder()
                .issuer("scout-im")
                .issuedAt(new Date())
                .expiration(new Date(System.currentTimeMillis() + 60_000))
                .claims(Map.of(JwtService.CLAIM_USER_ID, 1001L, JwtService.CLAIM_TOKEN_TYPE, "refresh"))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
                .compact();

        assertThrows(JwtException.class, () -> jwtService.verifyAndGetUserId(refresh));
    }

    @Test
    void expiredToken_IsRejected() {
        String expired = Jwts.builder()
                .issuer("scout-im")
                .issuedAt(new Date(System.currentTimeMillis() - 120_000))
                .expiration(new Date(System.currentTimeMillis() - 60_000))
                .claims(Map.of(JwtService.CLAIM_USER_ID, 1001L, JwtService.CLAIM_TOKEN_TYPE, JwtService.TOKEN_TYPE_ACCESS))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
                .compact();

        assertThrows(JwtException.class, () -> jwtService.verifyAndGetUserId(expired));
    }
}
