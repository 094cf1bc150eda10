package com.ryuqq.hitl.core.wait;

import com.ryuqq.hitl.core.statemachine.HandshakeState;

/**
 * {@link WaitHandle} 대기 결과.
 *
 * <p>WaitOutcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Decided}: 외부 resolver가 결정을 전달함</li>
 *   <li>{@link TimedOut}: 결정 없이 타임아웃 발생</li>
 *   <li>{@link Cancelled}: 대기자가 취소됨 (인터럽트 또는 명시적 취소)</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 제한합니다.</p>
 *
 * @author HITL Team
 * @since 1.0.0
 */
public sealed interface WaitOutcome permits Decided, TimedOut, Cancelled {

    /**
     * 이 결과에 대응하는 종료 상태.
     *
     * @return 종료 상태 (PENDING 아님)
     */
    HandshakeState state();

    /**
     * 외부 결정이 전달되었는지 확인.
     *
     * @return Decided인 경우 true
     */
    default boolean isDecided() {
        return this instanceof Decided;
    }

    /**
     * 타임아웃인지 확인.
     *
     * @return TimedOut인 경우 true
     */
    default boolean isTimedOut() {
        return this instanceof TimedOut;
    }

    /**
     * 취소되었는지 확인.
     *
     * @return Cancelled인 경우 true
     */
    default boolean isCancelled() {
        return this instanceof Cancelled;
    }
}
