package com.scoutim.auth.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scoutim.auth.config.AuthProperties;
import com.scoutim.auth.service.JwtService;
import com.scoutim.common.api.ApiCodes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

class AccessTokenInterceptorTest {

    private final JwtService jwtService =
            new JwtService(new AuthProperties("scout-im", "test-secret-test-secret-test-secret-0001", 3600L));
    private final AccessTokenInterceptor interceptor = new AccessTokenInterceptor(jwtService, new ObjectMapper());

    @AfterEach
    void tearDown() {
        AuthContext.clear();
    }

    @Test
    void noAuthorizationHeader_PassesWithoutUser() {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/threads");

        assertThat(interceptor.preHandle(req, new MockHttpServletResponse(), new Object())).isTrue();
        assertThat(AuthContext.getUserId()).isNull();
    }

    @Test
    void validBearer_SetsAuthContext_AndAfterCompletionClearsIt() {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/threads");
        req.addHeader("Authorization", "Bearer " + jwtService.issueAccessToken(77L));
        MockHttpServletResponse resp = new MockHttpServletResponse();

        assertThat(interceptor.preHandle(req, resp, new Object())).isTrue();
        assertThat(AuthContext.getUserId()).isEqualTo(77L);
        assertThat(req.getAttribute(AccessTokenInterceptor.REQ_ATTR_USER_ID)).isEqualTo(77L);

        interceptor.afterCompletion(req, resp, new Object(), null);
        assertThat(AuthContext.getUserId()).isNull();
    }

    @Test
    void invalidBearer_Writes401Result() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/threads");
        req.addHeader("Authorization", "Bearer broken");
        MockHttpServletResponse resp = new MockHttpServletResponse();

        assertThat(interceptor.preHandle(req, resp, new Object())).isFalse();
        assertThat(resp.getStatus()).isEqualTo(401);
        assertThat(resp.getContentAsString()).contains("\"code\":" + ApiCodes.UNAUTHORIZED);
        assertThat(AuthContext.getUserId()).isNull();
    }
}
