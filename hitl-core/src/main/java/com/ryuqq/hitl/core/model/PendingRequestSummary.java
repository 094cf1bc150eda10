package com.ryuqq.hitl.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * 목록 조회용 요청 요약 (불변 record).
 *
 * <p>presentation 계층이 대기 목록을 렌더링할 때 사용합니다.
 * WaitHandle을 노출하지 않으므로 요약본을 통해 요청 상태를 바꿀 수 없습니다.</p>
 *
 * @param id 요청 ID (resolve 시 사용)
 * @param owner 소유자
 * @param name 작업 이름
 * @param description 작업 설명 (빈 문자열 가능)
 * @param arguments 호출 인자 (수정 불가)
 * @param createdAt 생성 시각
 *
 * @author HITL Team
 * @since 1.0.0
 */
public record PendingRequestSummary(
    RequestId id,
    OwnerId owner,
    String name,
    String description,
    Map<String, Object> arguments,
    Instant createdAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id, owner, name, createdAt이 null인 경우
     */
    public PendingRequestSummary {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        description = description == null ? "" : description;
        arguments = arguments == null ? Map.of() : arguments;
    }
}
