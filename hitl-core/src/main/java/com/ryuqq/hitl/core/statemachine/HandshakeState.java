package com.ryuqq.hitl.core.statemachine;

/**
 * 승인 핸드셰이크의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PENDING → DECIDED (외부 결정이 먼저 도착)</li>
 *   <li>PENDING → TIMED_OUT (타임아웃이 먼저 발생, 기본 결정 적용)</li>
 *   <li>PENDING → CANCELLED (대기자 취소)</li>
 *   <li><strong>역방향 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING
 *    │
 *    ├─► DECIDED (approved | rejected)
 *    │
 *    ├─► TIMED_OUT (default decision)
 *    │
 *    └─► CANCELLED
 *
 * 금지된 전이:
 * - 종료 상태 → PENDING ❌
 * - 종료 상태 ↔ 종료 상태 ❌
 * </pre>
 *
 * @author HITL Team
 * @since 1.0.0
 */
public enum HandshakeState {

    /**
     * 결정 대기 중.
     */
    PENDING,

    /**
     * 외부 resolver가 결정을 전달함.
     */
    DECIDED,

    /**
     * 타임아웃 발생 (기본 결정 적용).
     */
    TIMED_OUT,

    /**
     * 대기자가 취소됨.
     */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * <p>PENDING을 제외한 모든 상태는 종료 상태이며, 각 요청은 정확히 하나의 종료 상태에 도달합니다.</p>
     *
     * @return PENDING이 아닌 경우 true
     */
    public boolean isTerminal() {
        return this != PENDING;
    }
}
