package com.ryuqq.hitl.core.wait;

import com.ryuqq.hitl.core.statemachine.HandshakeState;

/**
 * 타임아웃 결과.
 *
 * <p>오류가 아니며, 호출자가 설정한 기본 결정으로 매핑됩니다.</p>
 *
 * @author HITL Team
 * @since 1.0.0
 */
public record TimedOut() implements WaitOutcome {

    @Override
    public HandshakeState state() {
        return HandshakeState.TIMED_OUT;
    }
}
