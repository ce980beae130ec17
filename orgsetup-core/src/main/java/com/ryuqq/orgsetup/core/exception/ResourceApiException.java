package com.ryuqq.orgsetup.core.exception;

import java.util.List;
import java.util.Map;

/**
 * 리소스 API(조직, 테넌트, 사용자, API 키, 도메인) 호출 실패.
 *
 * <p>협력자 구현은 전송 계층 오류를 이 예외로 변환하여 던집니다.
 * 재시도 여부는 {@link ApiErrorKind}로 판단합니다.</p>
 *
 * <p>충돌(409)인 경우 conflictCode, conflictFields, existingResourceId,
 * existingValues에 응답 본문에서 추출한 정보를 담습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ResourceApiException extends OrgSetupException {

    private final ApiErrorKind kind;
    private final int httpStatus;
    private final String conflictCode;
    private final List<String> conflictFields;
    private final String existingResourceId;
    private final Map<String, String> existingValues;

    public ResourceApiException(ApiErrorKind kind, int httpStatus, String message) {
        this(kind, httpStatus, message, null, null, null, null, null);
    }

    public ResourceApiException(ApiErrorKind kind, int httpStatus, String message, Throwable cause) {
        this(kind, httpStatus, message, cause, null, null, null, null);
    }

    private ResourceApiException(
        ApiErrorKind kind,
        int httpStatus,
        String message,
        Throwable cause,
        String conflictCode,
        List<String> conflictFields,
        String existingResourceId,
        Map<String, String> existingValues
    ) {
        super("API_" + requireKind(kind).name(), message, cause);
        this.kind = kind;
        this.httpStatus = httpStatus;
        this.conflictCode = conflictCode;
        this.conflictFields = conflictFields == null ? List.of() : List.copyOf(conflictFields);
        this.existingResourceId = existingResourceId;
        this.existingValues = existingValues == null ? Map.of() : Map.copyOf(existingValues);
    }

    private static ApiErrorKind requireKind(ApiErrorKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        return kind;
    }

    /**
     * HTTP 상태 코드로 예외 생성.
     *
     * @param status HTTP 상태 코드
     * @param message 오류 메시지
     * @return ResourceApiException
     */
    public static ResourceApiException ofStatus(int status, String message) {
        return new ResourceApiException(ApiErrorKind.fromStatus(status), status, message);
    }

    public static ResourceApiException timeout(String message) {
        return new ResourceApiException(ApiErrorKind.NETWORK_TIMEOUT, 0, message);
    }

    public static ResourceApiException connectionReset(String message) {
        return new ResourceApiException(ApiErrorKind.CONNECTION_RESET, 0, message);
    }

    public static ResourceApiException serverError(int status, String message) {
        return new ResourceApiException(ApiErrorKind.SERVER_ERROR, status, message);
    }

    public static ResourceApiException notFound(String message) {
        return new ResourceApiException(ApiErrorKind.NOT_FOUND, 404, message);
    }

    public static ResourceApiException validation(String message) {
        return new ResourceApiException(ApiErrorKind.VALIDATION, 400, message);
    }

    /**
     * 충돌(409) 예외 생성.
     *
     * @param conflictCode 충돌 코드 (예: email_exists)
     * @param fields 충돌 필드
     * @param existingResourceId 기존 리소스 ID (모르면 null)
     * @param existingValues 기존 리소스의 충돌 필드 값 (null 가능)
     * @param message 오류 메시지
     * @return 충돌 ResourceApiException
     */
    public static ResourceApiException conflict(
        String conflictCode,
        List<String> fields,
        String existingResourceId,
        Map<String, String> existingValues,
        String message
    ) {
        return new ResourceApiException(
            ApiErrorKind.CONFLICT, 409, message, null,
            conflictCode, fields, existingResourceId, existingValues
        );
    }

    public ApiErrorKind getKind() {
        return kind;
    }

    /**
     * HTTP 상태 코드 (전송 계층 오류는 0).
     *
     * @return HTTP 상태 코드
     */
    public int getHttpStatus() {
        return httpStatus;
    }

    public boolean isConflict() {
        return kind == ApiErrorKind.CONFLICT;
    }

    public String getConflictCode() {
        return conflictCode;
    }

    public List<String> getConflictFields() {
        return conflictFields;
    }

    public String getExistingResourceId() {
        return existingResourceId;
    }

    public Map<String, String> getExistingValues() {
        return existingValues;
    }
}
