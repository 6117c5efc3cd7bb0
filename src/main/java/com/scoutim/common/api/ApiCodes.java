package com.scoutim.common.api;

/**
 * 统一错误码定义。
 *
 * <p>按 HTTP 语义分段：400xx 参数/业务校验，401xx 未登录，403xx 无权限，404xx 不存在，500xx 服务端异常。</p>
 */
public final class ApiCodes {

    private ApiCodes() {
    }

    /** 参数不合法 / 业务校验失败 */
    public static final int BAD_REQUEST = 40000;

    /** 未登录 / token 无效 */
    public static final int UNAUTHORIZED = 40100;

    /** 不是会话参与者 */
    public static final int FORBIDDEN = 40300;

    /** 会话/消息/用户不存在 */
    public static final int NOT_FOUND = 40400;

    /** 服务端未预期异常 */
    public static final int INTERNAL_ERROR = 50000;
}
