package com.scoutim.gateway.ws;

import com.scoutim.auth.service.JwtService;
import com.scoutim.gateway.session.ConnectionRegistry;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import io.netty.handler.codec.http.cookie.Cookie;
import io.netty.handler.codec.http.cookie.ServerCookieDecoder;
import io.netty.util.CharsetUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * WebSocket 握手阶段（HTTP Upgrade）鉴权：
 * <ul>
 *   <li>accessToken 依次从 Authorization: Bearer、query 参数 token/accessToken、cookie access_token 中取</li>
 *   <li>校验通过：把 userId 绑定到 channel，握手完成后由 {@link WsConnectionHandler} 登记连接</li>
 *   <li>校验失败：返回 HTTP 401 并关闭连接</li>
 * </ul>
 */
@Slf4j
public class WsHandshakeAuthHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    public static final String COOKIE_ACCESS_TOKEN = "access_token";

    private final String wsPath;
    private final JwtService jwtService;

    public WsHandshakeAuthHandler(String wsPath, JwtService jwtService) {
        this.wsPath = wsPath;
        this.jwtService = jwtService;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        if (uri == null || !uri.startsWith(wsPath)) {
            ctx.fireChannelRead(req.retain());
            return;
        }

        if (ctx.channel().attr(ConnectionRegistry.ATTR_USER_ID).get() != null) {
            ctx.fireChannelRead(req.retain());
            return;
        }

        String token = extractAccessToken(req);
        if (token == null || token.isBlank()) {
            writeUnauthorizedAndClose(ctx, "missing_access_token");
            return;
        }

        long userId;
        try {
            userId = jwtService.verifyAndGetUserId(token);
        } catch (Exception e) {
            log.debug("ws handshake rejected: remote={}, err={}", ctx.channel().remoteAddress(), e.toString());
            writeUnauthorizedAndClose(ctx, "invalid_access_token");
            return;
        }
        ctx.channel().attr(ConnectionRegistry.ATTR_USER_ID).set(userId);
        ctx.fireChannelRead(req.retain());
    }

    static String extractAccessToken(HttpRequest req) {
        String auth = req.headers().get(HttpHeaderNames.AUTHORIZATION);
        if (auth != null && auth.startsWith("Bearer ")) {
            String v = auth.substring("Bearer ".length()).trim();
            if (!v.isEmpty()) {
                return v;
            }
        }

        QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
        Map<String, List<String>> params = decoder.parameters();

        String fromToken = first(params, "token");
        if (fromToken != null && !fromToken.isBlank()) {
            return fromToken;
        }
        String fromAccessToken = first(params, "accessToken");
        if (fromAccessToken != null && !fromAccessToken.isBlank()) {
            return fromAccessToken;
        }

        String cookieHeader = req.headers().get(HttpHeaderNames.COOKIE);
        if (cookieHeader != null && !cookieHeader.isBlank()) {
            Set<Cookie> cookies = ServerCookieDecoder.LAX.decode(cookieHeader);
            for (Cookie c : cookies) {
                if (COOKIE_ACCESS_TOKEN.equals(c.name()) && c.value() != null && !c.value().isBlank()) {
                    return c.value();
                }
            }
        }
        return null;
    }

    private static String first(Map<String, List<String>> params, String key) {
        List<String> list = params.get(key);
        if (list == null || list.isEmpty()) {
            return null;
        }
        return list.get(0);
    }

    private void writeUnauthorizedAndClose(ChannelHandlerContext ctx, String reason) {
        byte[] bytes = reason.getBytes(CharsetUtil.UTF_8);
        FullHttpResponse resp = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1,
                HttpResponseStatus.UNAUTHORIZED,
                Unpooled.wrappedBuffer(bytes)
        );
        resp.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=UTF-8");
        resp.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        ctx.writeAndFlush(resp);
        ctx.close();
    }
}
