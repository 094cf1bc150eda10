package com.ryuqq.hitl.core.exception;

import com.ryuqq.hitl.core.model.RequestId;

/**
 * Registry에 이미 존재하는 RequestId로 등록을 시도한 경우.
 *
 * <p>128비트 난수 ID에서는 사실상 발생하지 않지만,
 * 발생 시 기존 요청을 덮어쓰지 않고 즉시 실패합니다.</p>
 *
 * @author HITL Team
 * @since 1.0.0
 */
public class DuplicateRequestIdException extends IllegalStateException {

    private final RequestId requestId;

    public DuplicateRequestIdException(RequestId requestId) {
        super("Request already registered: " + requestId);
        this.requestId = requestId;
    }

    public RequestId getRequestId() {
        return requestId;
    }
}
