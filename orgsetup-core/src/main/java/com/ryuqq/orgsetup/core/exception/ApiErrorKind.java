package com.ryuqq.orgsetup.core.exception;

/**
 * 리소스 API 호출 오류의 종류.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ApiErrorKind {
    NETWORK_TIMEOUT,
    CONNECTION_RESET,
    SERVER_ERROR,
    RATE_LIMITED,
    CONFLICT,
    VALIDATION,
    UNAUTHORIZED,
    FORBIDDEN,
    NOT_FOUND,
    UNKNOWN;

    /**
     * HTTP 상태 코드로 오류 종류 판별.
     *
     * @param status HTTP 상태 코드
     * @return ApiErrorKind
     */
    public static ApiErrorKind fromStatus(int status) {
        if (status == 400 || status == 422) {
            return VALIDATION;
        }
        if (status == 401) {
            return UNAUTHORIZED;
        }
        if (status == 403) {
            return FORBIDDEN;
        }
        if (status == 404) {
            return NOT_FOUND;
        }
        if (status == 408 || status == 504) {
            return NETWORK_TIMEOUT;
        }
        if (status == 409) {
            return CONFLICT;
        }
        if (status == 429) {
            return RATE_LIMITED;
        }
        if (status >= 500 && status <= 599) {
            return SERVER_ERROR;
        }
        return UNKNOWN;
    }
}
