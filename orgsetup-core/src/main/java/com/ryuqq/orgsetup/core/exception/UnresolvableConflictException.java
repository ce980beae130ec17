package com.ryuqq.orgsetup.core.exception;

import com.ryuqq.orgsetup.core.model.ConflictRecord;

/**
 * 기존 리소스를 재사용할 수 없는 충돌.
 *
 * <p>조회 방법이 없거나, 조회에 실패했거나, 조회한 리소스가 이번 요청과
 * 다른 리소스인 경우 발생합니다. 재시도 대상이 아닙니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class UnresolvableConflictException extends OrgSetupException {

    public static final String ERROR_CODE = "CONFLICT_UNRESOLVABLE";

    private final ConflictRecord conflict;

    public UnresolvableConflictException(ConflictRecord conflict, String reason) {
        this(conflict, reason, null);
    }

    public UnresolvableConflictException(ConflictRecord conflict, String reason, Throwable cause) {
        super(ERROR_CODE, "Unresolvable " + conflict.type().code() + " conflict at " + conflict.step() + ": " + reason, cause);
        this.conflict = conflict;
    }

    public ConflictRecord getConflict() {
        return conflict;
    }
}
