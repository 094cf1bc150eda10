/**
 * 승인 핸드셰이크 Runner 구현체.
 *
 * <p>이 패키지는 {@link com.ryuqq.hitl.application.coordinator.ApprovalCoordinator}의
 * 블로킹 구현과 보조 컴포넌트를 제공합니다.</p>
 *
 * <p><strong>구성 요소:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.hitl.adapter.runner.BlockingApprovalCoordinator}: 대기자 스레드를 블로킹하는 핸드셰이크</li>
 *   <li>{@link com.ryuqq.hitl.adapter.runner.DecisionHandlerDispatcher}: 새 요청을 DecisionHandler에 전달하는 리스너</li>
 *   <li>{@link com.ryuqq.hitl.adapter.runner.StaleRequestMonitor}: 오래 남은 요청 감지 (보고 전용)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * PendingRequestRegistry registry = new InMemoryPendingRequestRegistry();
 * BlockingApprovalCoordinator coordinator =
 *     new BlockingApprovalCoordinator(registry, new ApprovalConfig().withApprovalTimeout(Duration.ofMinutes(2)));
 *
 * StaleRequestMonitor monitor = new StaleRequestMonitor(registry, new StaleRequestMonitorConfig());
 * monitor.start();
 * </pre>
 *
 * @author HITL Team
 * @since 1.0.0
 */
package com.ryuqq.hitl.adapter.runner;
