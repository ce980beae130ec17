package com.ryuqq.orgsetup.core.statemachine;

/**
 * 셋업 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>IDLE → CREATING_ORGANIZATION</li>
 *   <li>CREATING_ORGANIZATION → CREATING_TENANT, FAILED</li>
 *   <li>CREATING_TENANT → CREATING_ADMIN_USER, FAILED</li>
 *   <li>CREATING_ADMIN_USER → GENERATING_API_KEY, FAILED</li>
 *   <li>GENERATING_API_KEY → CONFIGURING_DOMAIN, COMPLETED, FAILED</li>
 *   <li>CONFIGURING_DOMAIN → COMPLETED, FAILED</li>
 *   <li>FAILED → ROLLING_BACK</li>
 *   <li>ROLLING_BACK → ROLLED_BACK</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(COMPLETED, ROLLED_BACK)에서는 어떤 상태로도 전이 불가</li>
 *   <li>단계 건너뛰기 불가 (GENERATING_API_KEY → COMPLETED는 도메인 단계 생략 시에만 사용)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SetupStateTransition {

    // Utility class - prevent instantiation
    private SetupStateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(SetupState from, SetupState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case IDLE -> to == SetupState.CREATING_ORGANIZATION;
            case CREATING_ORGANIZATION -> to == SetupState.CREATING_TENANT || to == SetupState.FAILED;
            case CREATING_TENANT -> to == SetupState.CREATING_ADMIN_USER || to == SetupState.FAILED;
            case CREATING_ADMIN_USER -> to == SetupState.GENERATING_API_KEY || to == SetupState.FAILED;
            case GENERATING_API_KEY -> to == SetupState.CONFIGURING_DOMAIN
                || to == SetupState.COMPLETED
                || to == SetupState.FAILED;
            case CONFIGURING_DOMAIN -> to == SetupState.COMPLETED || to == SetupState.FAILED;
            case FAILED -> to == SetupState.ROLLING_BACK;
            case ROLLING_BACK -> to == SetupState.ROLLED_BACK;
            case COMPLETED, ROLLED_BACK -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static SetupState transition(SetupState current, SetupState next) {
        validate(current, next);
        return next;
    }
}
