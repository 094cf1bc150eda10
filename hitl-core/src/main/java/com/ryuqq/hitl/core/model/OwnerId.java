package com.ryuqq.hitl.core.model;

/**
 * Pending request의 소유자(tenant/user) 식별자.
 *
 * <p>OwnerId는 인증/세션 컴포넌트가 제공하는 키로, 요청의 가시성 범위를 구분합니다.
 * 한 소유자의 요청 목록은 다른 소유자에게 보이지 않습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>OwnerId.of("alice")</li>
 *   <li>OwnerId.of("tenant-42:user-7")</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * @author HITL Team
 * @since 1.0.0
 */
public final class OwnerId {

    private final String value;

    private OwnerId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("OwnerId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("OwnerId length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * OwnerId 생성.
     *
     * @param value OwnerId 값
     * @return OwnerId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static OwnerId of(String value) {
        return new OwnerId(value);
    }

    /**
     * OwnerId 값 조회.
     *
     * @return OwnerId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OwnerId ownerId = (OwnerId) o;
        return value.equals(ownerId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "OwnerId{" + value + '}';
    }
}
