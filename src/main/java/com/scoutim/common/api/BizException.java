package com.scoutim.common.api;

/**
 * 业务异常：调用方可以通过 {@link #getCode()} 区分“参数错误 / 无权限 / 不存在”。
 *
 * <p>只用于可预期的业务失败；存储不可用等致命错误直接以 DataAccessException 向上抛。</p>
 */
public class BizException extends RuntimeException {

    private final int code;

    public BizException(int code, String message) {
        super(message);
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static BizException badRequest(String message) {
        return new BizException(ApiCodes.BAD_REQUEST, message);
    }

    public static BizException forbidden(String message) {
        return new BizException(ApiCodes.FORBIDDEN, message);
    }

    public static BizException notFound(String message) {
        return new BizException(ApiCodes.NOT_FOUND, message);
    }

    public boolean isBadRequest() {
        return code == ApiCodes.BAD_REQUEST;
    }

    public boolean isForbidden() {
        return code == ApiCodes.FORBIDDEN;
    }

    public boolean isNotFound() {
        return code == ApiCodes.NOT_FOUND;
    }
}
