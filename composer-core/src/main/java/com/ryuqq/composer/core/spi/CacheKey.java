package com.ryuqq.composer.core.spi;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * 캐시 키 (결정적 fingerprint).
 *
 * <p>같은 계산 함수와 같은 인자는 항상 같은 키를 만듭니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CacheKey rules = CacheKey.of("rules:ESS");
 * CacheKey prompt = CacheKey.fingerprint("definition", "vergunning", List.of("juridisch"));
 * // prompt.getValue() → "definition:9f2c...(sha-256 hex)"
 * </pre>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class CacheKey {

    private final String value;

    private CacheKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CacheKey cannot be null or blank");
        }
        this.value = value;
    }

    /**
     * 문자열 그대로 키 생성.
     *
     * @param value 키 값 (예: rules:ESS)
     * @return CacheKey 인스턴스
     */
    public static CacheKey of(String value) {
        return new CacheKey(value);
    }

    /**
     * 함수 이름과 인자로부터 fingerprint 키 생성.
     *
     * <p>인자는 {@link Arrays#deepToString(Object[])}로 정규화한 뒤 SHA-256으로 해시합니다.
     * 인자의 toString()이 결정적이어야 합니다.</p>
     *
     * @param function 계산 함수 이름
     * @param args 인자
     * @return "function:sha256hex" 형식의 CacheKey
     */
    public static CacheKey fingerprint(String function, Object... args) {
        if (function == null || function.isBlank()) {
            throw new IllegalArgumentException("function cannot be null or blank");
        }
        String canonical = Arrays.deepToString(args);
        return new CacheKey(function + ":" + sha256(canonical));
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CacheKey cacheKey = (CacheKey) o;
        return value.equals(cacheKey.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
