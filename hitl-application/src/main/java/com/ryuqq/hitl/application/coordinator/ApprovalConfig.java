package com.ryuqq.hitl.application.coordinator;

import com.ryuqq.hitl.core.model.Decision;

import java.time.Duration;

/**
 * 승인 대기 설정 (불변 record).
 *
 * <p>설정 항목:</p>
 * <ul>
 *   <li>approvalTimeout: 사용자 응답 대기 시간 (기본 30초)</li>
 *   <li>autoApproveOnTimeout: 타임아웃 시 자동 승인 여부 (기본 false = 자동 거절)</li>
 * </ul>
 *
 * <p><strong>주의:</strong> 위험한 작업을 막는 용도라면 autoApproveOnTimeout은 false로 유지해야 합니다.
 * true로 설정하면 아무도 응답하지 않은 요청이 승인됩니다.</p>
 *
 * @author HITL Team
 * @since 1.0.0
 * @param approvalTimeout 대기 시간 (양수, 최대 24시간)
 * @param autoApproveOnTimeout 타임아웃 시 자동 승인 여부
 */
public record ApprovalConfig(Duration approvalTimeout, boolean autoApproveOnTimeout) {

    /**
     * 허용되는 최대 대기 시간.
     */
    public static final Duration MAX_TIMEOUT = Duration.ofHours(24);

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: approvalTimeout=30초, autoApproveOnTimeout=false</p>
     */
    public ApprovalConfig() {
        this(Duration.ofSeconds(30), false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ApprovalConfig {
        if (approvalTimeout == null) {
            throw new IllegalArgumentException("approvalTimeout cannot be null");
        }
        if (approvalTimeout.isZero() || approvalTimeout.isNegative()) {
            throw new IllegalArgumentException(
                "approvalTimeout must be positive (current: " + approvalTimeout + ")"
            );
        }
        if (approvalTimeout.compareTo(MAX_TIMEOUT) > 0) {
            throw new IllegalArgumentException(
                "approvalTimeout cannot exceed " + MAX_TIMEOUT + " (current: " + approvalTimeout + ")"
            );
        }
    }

    /**
     * 타임아웃 시 적용할 기본 결정.
     *
     * @return autoApproveOnTimeout이면 APPROVED, 아니면 REJECTED
     */
    public Decision defaultDecision() {
        return Decision.of(autoApproveOnTimeout);
    }

    /**
     * approvalTimeout만 변경한 새 인스턴스 생성.
     *
     * @param approvalTimeout 새로운 대기 시간
     * @return 새 ApprovalConfig 인스턴스
     */
    public ApprovalConfig withApprovalTimeout(Duration approvalTimeout) {
        return new ApprovalConfig(approvalTimeout, this.autoApproveOnTimeout);
    }

    /**
     * autoApproveOnTimeout만 변경한 새 인스턴스 생성.
     *
     * @param autoApproveOnTimeout 새로운 자동 승인 여부
     * @return 새 ApprovalConfig 인스턴스
     */
    public ApprovalConfig withAutoApproveOnTimeout(boolean autoApproveOnTimeout) {
        return new ApprovalConfig(this.approvalTimeout, autoApproveOnTimeout);
    }
}
