package com.ryuqq.hitl.core.exception;

import com.ryuqq.hitl.core.model.RequestId;

/**
 * 존재하지 않거나 이미 정리된 요청을 조회한 경우.
 *
 * <p>transport 계층이 클라이언트에게 "no such request"로 전달하는 용도이며, 치명적 오류가 아닙니다.</p>
 *
 * @author HITL Team
 * @since 1.0.0
 */
public class RequestNotFoundException extends RuntimeException {

    private final RequestId requestId;

    public RequestNotFoundException(RequestId requestId) {
        super("No pending request: " + requestId);
        this.requestId = requestId;
    }

    public RequestId getRequestId() {
        return requestId;
    }
}
