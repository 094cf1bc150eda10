package com.ryuqq.hitl.core.model;

/**
 * 승인 요청에 대한 최종 결정.
 *
 * @author HITL Team
 * @since 1.0.0
 */
public enum Decision {

    /**
     * 승인 (작업 진행).
     */
    APPROVED,

    /**
     * 거절 (작업 중단).
     */
    REJECTED;

    /**
     * transport 계층의 boolean 값 변환 (예: {@code {"approved": true}}).
     *
     * @param approved 승인 여부
     * @return APPROVED 또는 REJECTED
     */
    public static Decision of(boolean approved) {
        return approved ? APPROVED : REJECTED;
    }

    /**
     * 승인 여부 확인.
     *
     * @return APPROVED인 경우 true
     */
    public boolean isApproved() {
        return this == APPROVED;
    }
}
