/**
 * 핸드셰이크 오류 분류.
 *
 * <ul>
 *   <li>{@link com.ryuqq.hitl.core.exception.RequestNotFoundException} - 알 수 없거나 이미 정리된 요청</li>
 *   <li>{@link com.ryuqq.hitl.core.exception.DuplicateRequestIdException} - registry ID 충돌</li>
 *   <li>{@link com.ryuqq.hitl.core.exception.HandshakeException} - 내부 invariant 위반</li>
 *   <li>{@link com.ryuqq.hitl.core.exception.DecisionCancelledException} - 대기자 취소</li>
 * </ul>
 *
 * <p>타임아웃은 오류가 아니며 기본 결정으로 매핑됩니다.</p>
 *
 * @author HITL Team
 * @since 1.0.0
 */
package com.ryuqq.hitl.core.exception;
