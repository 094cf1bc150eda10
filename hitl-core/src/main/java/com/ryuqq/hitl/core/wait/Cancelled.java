package com.ryuqq.hitl.core.wait;

import com.ryuqq.hitl.core.statemachine.HandshakeState;

/**
 * 취소 결과.
 *
 * <p>결정으로 변환되지 않고 대기자에게 그대로 전파됩니다.</p>
 *
 * @author HITL Team
 * @since 1.0.0
 */
public record Cancelled() implements WaitOutcome {

    @Override
    public HandshakeState state() {
        return HandshakeState.CANCELLED;
    }
}
