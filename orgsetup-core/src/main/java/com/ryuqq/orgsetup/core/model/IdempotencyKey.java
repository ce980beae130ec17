package com.ryuqq.orgsetup.core.model;

/**
 * 조직 셋업 실행 단위의 멱등성 키.
 *
 * <p>동일한 키로 들어온 셋업 요청은 최대 한 번만 실제로 실행되며,
 * 이후 요청은 저장된 결과를 그대로 돌려받습니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 콜론(:), 점(.)만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class IdempotencyKey {

    private static final int MAX_LENGTH = 255;

    private final String value;

    private IdempotencyKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("IdempotencyKey cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("IdempotencyKey length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_:.]+$")) {
            throw new IllegalArgumentException(
                "IdempotencyKey contains invalid characters. Only alphanumeric, hyphen, underscore, colon and dot are allowed"
            );
        }
        this.value = value;
    }

    /**
     * IdempotencyKey 생성.
     *
     * @param value 키 값
     * @return IdempotencyKey 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static IdempotencyKey of(String value) {
        return new IdempotencyKey(value);
    }

    /**
     * 키 값 조회.
     *
     * @return 키 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IdempotencyKey that = (IdempotencyKey) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "IdempotencyKey{" + value + '}';
    }
}
