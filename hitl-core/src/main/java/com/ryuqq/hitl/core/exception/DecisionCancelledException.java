package com.ryuqq.hitl.core.exception;

import com.ryuqq.hitl.core.model.RequestId;

/**
 * 결정 대기가 취소된 경우.
 *
 * <p>취소는 결정으로 변환되지 않습니다. 작업을 중단할지 여부는 호출자가 판단합니다.
 * 스레드 인터럽트로 취소된 경우 인터럽트 플래그는 이미 복원된 상태입니다.</p>
 *
 * @author HITL Team
 * @since 1.0.0
 */
public class DecisionCancelledException extends RuntimeException {

    private final RequestId requestId;

    public DecisionCancelledException(RequestId requestId) {
        super("Decision wait cancelled: " + requestId);
        this.requestId = requestId;
    }

    public RequestId getRequestId() {
        return requestId;
    }
}
