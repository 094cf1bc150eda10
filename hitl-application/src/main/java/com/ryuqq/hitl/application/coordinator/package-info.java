/**
 * HITL Application Layer - 승인 핸드셰이크 API.
 *
 * <p>정책 코드(waiter)와 transport/presentation 계층(resolver, lister)이 사용하는 포트입니다.</p>
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.hitl.application.coordinator.ApprovalCoordinator} - 핸드셰이크 조정자</li>
 *   <li>{@link com.ryuqq.hitl.application.coordinator.ApprovalConfig} - 기본 timeout 및 타임아웃 시 결정</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 * </ul>
 *
 * @author HITL Team
 * @since 1.0.0
 */
package com.ryuqq.hitl.application.coordinator;
