package com.ryuqq.orgsetup.core.exception;

/**
 * 조직 셋업 예외의 최상위 타입.
 *
 * <p>모든 하위 예외는 분류와 로깅에 사용하는 오류 코드를 가집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class OrgSetupException extends RuntimeException {

    private final String errorCode;

    public OrgSetupException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public OrgSetupException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드 (예: SETUP_FAILED)
     */
    public String getErrorCode() {
        return errorCode;
    }
}
