package com.ryuqq.hitl.core.wait;

import com.ryuqq.hitl.core.model.Decision;
import com.ryuqq.hitl.core.statemachine.HandshakeState;

/**
 * 외부 결정 도착 결과.
 *
 * @param decision 전달된 결정
 *
 * @author HITL Team
 * @since 1.0.0
 */
public record Decided(Decision decision) implements WaitOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException decision이 null인 경우
     */
    public Decided {
        if (decision == null) {
            throw new IllegalArgumentException("decision cannot be null");
        }
    }

    @Override
    public HandshakeState state() {
        return HandshakeState.DECIDED;
    }
}
