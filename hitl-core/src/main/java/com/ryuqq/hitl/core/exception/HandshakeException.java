package com.ryuqq.hitl.core.exception;

/**
 * 핸드셰이크 내부 오류 (invariant 위반).
 *
 * <p>대기를 시작하기 전에 registry 등록이 실패한 경우 등에 발생합니다.
 * 조용히 상태를 덮어쓰는 대신 호출자에게 실패를 알립니다.</p>
 *
 * @author HITL Team
 * @since 1.0.0
 */
public class HandshakeException extends RuntimeException {

    public HandshakeException(String message) {
        super(message);
    }

    public HandshakeException(String message, Throwable cause) {
        super(message, cause);
    }
}
