package com.ryuqq.orgsetup.core.exception;

import java.util.List;

/**
 * 셋업 요청 유효성 검증 실패.
 *
 * <p>멱등성 키 예약 전에 발생하므로 어떤 리소스도 생성되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SetupValidationException extends OrgSetupException {

    public static final String ERROR_CODE = "VALIDATION_FAILED";

    private final List<String> violations;

    public SetupValidationException(List<String> violations) {
        super(ERROR_CODE, "Invalid setup request: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    /**
     * 위반 사항 목록.
     *
     * @return 불변 리스트
     */
    public List<String> getViolations() {
        return violations;
    }
}
