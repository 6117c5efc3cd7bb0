package com.scoutim.auth.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scoutim.auth.service.JwtService;
import com.scoutim.common.api.ApiCodes;
import com.scoutim.common.api.Result;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * HTTP 侧的 accessToken 解析。
 *
 * <ul>
 *   <li>没有 Authorization 头：放行，由 controller 判断 AuthContext 是否为空并返回 401</li>
 *   <li>Bearer token 有效：userId 写入 request attribute 与 AuthContext</li>
 *   <li>token 无效：直接返回 401 + 统一 Result JSON</li>
 * </ul>
 */
@Slf4j
@Component
public class AccessTokenInterceptor implements HandlerInterceptor {

    public static final String REQ_ATTR_USER_ID = "X-Auth-UserId";

    private final JwtService jwtService;
    private final ObjectMapper objectMapper;

    public AccessTokenInterceptor(JwtService jwtService, ObjectMapper objectMapper) {
        this.jwtService = jwtService;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String header = request.getHeader("Authorization");
        if (header == null || !header.startsWith("Bearer ")) {
            return true;
        }

        String token = header.substring("Bearer ".length()).trim();
        try {
            long userId = jwtService.verifyAndGetUserId(token);
            request.setAttribute(REQ_ATTR_USER_ID, userId);
            AuthContext.setUserId(userId);
            return true;
        } catch (Exception e) {
            log.debug("access token rejected: path={}, err={}", request.getRequestURI(), e.toString());
            response.setStatus(401);
            response.setCharacterEncoding("UTF-8");
            response.setContentType("application/json;charset=UTF-8");
            try {
                String json = objectMapper.writeValueAsString(Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized"));
                response.getWriter().write(json);
            } catch (Exception writeErr) {
                log.debug("write unauthorized response failed: path={}, err={}", request.getRequestURI(), writeErr.toString());
            }
            return false;
        }
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        AuthContext.clear();
    }
}
