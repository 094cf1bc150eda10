package com.ryuqq.hitl.core.model;

import java.security.SecureRandom;
import java.util.regex.Pattern;

/**
 * Pending request의 전역 고유 식별자.
 *
 * <p>RequestId는 외부 resolver가 결정을 전달할 때 사용하는 유일한 핸들입니다.
 * 서버에서 생성되며 transport 계층을 통해 문자열로 왕복합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>생성 전략:</strong> {@link SecureRandom} 128비트, 소문자 hex 32자</p>
 * <p><strong>유효성 검증 ({@link #of(String)}):</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author HITL Team
 * @since 1.0.0
 */
public final class RequestId {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-zA-Z0-9\\-_]+$");
    private static final int RANDOM_BYTES = 16;
    private static final char[] HEX = "0123456789abcdef".toCharArray();
    private static final SecureRandom RANDOM = new SecureRandom();

    private final String value;

    private RequestId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RequestId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("RequestId length cannot exceed 255 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("RequestId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * 외부에서 전달된 값으로 RequestId 생성.
     *
     * @param value RequestId 값
     * @return RequestId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static RequestId of(String value) {
        return new RequestId(value);
    }

    /**
     * 새로운 RequestId 생성 (128비트 난수).
     *
     * @return 새 RequestId
     */
    public static RequestId generate() {
        byte[] bytes = new byte[RANDOM_BYTES];
        RANDOM.nextBytes(bytes);
        char[] chars = new char[RANDOM_BYTES * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            chars[i * 2] = HEX[v >>> 4];
            chars[i * 2 + 1] = HEX[v & 0x0F];
        }
        return new RequestId(new String(chars));
    }

    /**
     * RequestId 값 조회.
     *
     * @return RequestId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RequestId requestId = (RequestId) o;
        return value.equals(requestId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "RequestId{" + value + '}';
    }
}
