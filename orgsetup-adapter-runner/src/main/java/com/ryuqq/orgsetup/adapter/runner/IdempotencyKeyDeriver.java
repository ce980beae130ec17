package com.ryuqq.orgsetup.adapter.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.ryuqq.orgsetup.core.model.IdempotencyKey;
import com.ryuqq.orgsetup.core.model.SetupRequest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * 셋업 요청으로부터 멱등성 키와 fingerprint 생성.
 *
 * <p>요청의 정규화된 필드를 키 정렬 JSON으로 직렬화한 뒤 SHA-256으로 해시합니다.
 * 비밀번호는 포함하지 않습니다.</p>
 *
 * <p><strong>정규화:</strong></p>
 * <ul>
 *   <li>문자열 앞뒤 공백 제거</li>
 *   <li>서브도메인, 커스텀 도메인, 이메일은 소문자</li>
 *   <li>settings는 중첩 맵까지 키 정렬</li>
 * </ul>
 *
 * <p><strong>키 형식:</strong> {@code org_setup_<timeBucket>_<sha256 앞 32자>}.
 * timeBucket은 {@code epochSeconds / bucketSeconds}이므로 같은 요청도
 * 버킷이 바뀌면 새 키가 됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class IdempotencyKeyDeriver {

    static final String KEY_PREFIX = "org_setup_";
    private static final int KEY_HASH_LENGTH = 32;

    private static final ObjectMapper objectMapper = JsonMapper.builder()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .build();

    private final Clock clock;
    private final Duration timeBucket;

    /**
     * 생성자.
     *
     * @param clock 시간 버킷 계산용 Clock
     * @param timeBucket 시간 버킷 크기 (1초 이상)
     * @throws IllegalArgumentException clock이 null이거나 timeBucket이 1초 미만인 경우
     */
    public IdempotencyKeyDeriver(Clock clock, Duration timeBucket) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (timeBucket == null || timeBucket.getSeconds() < 1) {
            throw new IllegalArgumentException("timeBucket must be at least 1 second (current: " + timeBucket + ")");
        }
        this.clock = clock;
        this.timeBucket = timeBucket;
    }

    /**
     * 요청으로부터 멱등성 키 생성.
     *
     * @param request 셋업 요청
     * @return 파생된 IdempotencyKey
     */
    public IdempotencyKey derive(SetupRequest request) {
        long bucket = clock.instant().getEpochSecond() / timeBucket.getSeconds();
        return IdempotencyKey.of(KEY_PREFIX + bucket + "_" + fingerprint(request).substring(0, KEY_HASH_LENGTH));
    }

    /**
     * 요청 내용 fingerprint (SHA-256 hex, 시간 버킷 미포함).
     *
     * @param request 셋업 요청
     * @return 64자 hex 문자열
     * @throws IllegalArgumentException request가 null이거나 settings를 직렬화할 수 없는 경우 ({@link SetupRequest#violations()}가 먼저 걸러냄)
     */
    public String fingerprint(SetupRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        return sha256Hex(canonicalJson(request));
    }

    String canonicalJson(SetupRequest request) {
        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("name", trim(request.name()));
        canonical.put("subdomain", lower(request.subdomain()));
        canonical.put("custom_domain", lower(request.customDomain()));
        canonical.put("admin_name", trim(request.adminName()));
        canonical.put("admin_email", lower(request.adminEmail()));
        canonical.put("admin_role", trim(request.adminRole()));
        canonical.put("settings", request.settings());
        try {
            return objectMapper.writeValueAsString(canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Setup request settings are not serializable", e);
        }
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }

    private static String lower(String value) {
        return value == null ? null : value.trim().toLowerCase(Locale.ROOT);
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
