/**
 * 단일 결정 대기 프리미티브.
 *
 * <p>{@link com.ryuqq.hitl.core.wait.WaitHandle}과 그 결과 타입
 * ({@link com.ryuqq.hitl.core.wait.Decided}, {@link com.ryuqq.hitl.core.wait.TimedOut},
 * {@link com.ryuqq.hitl.core.wait.Cancelled})을 포함합니다.</p>
 *
 * @author HITL Team
 * @since 1.0.0
 */
package com.ryuqq.hitl.core.wait;
