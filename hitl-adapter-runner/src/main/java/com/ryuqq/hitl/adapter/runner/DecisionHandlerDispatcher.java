package com.ryuqq.hitl.adapter.runner;

import com.ryuqq.hitl.application.coordinator.ApprovalCoordinator;
import com.ryuqq.hitl.core.model.Decision;
import com.ryuqq.hitl.core.model.PendingRequestSummary;
import com.ryuqq.hitl.core.model.RequestId;
import com.ryuqq.hitl.core.spi.PendingRequestListener;
import com.ryuqq.hitl.core.statemachine.HandshakeState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * DecisionHandler 디스패처.
 *
 * <p>새 대기 요청마다 {@link DecisionHandler}를 워커 풀에서 실행하고,
 * 반환된 결정을 {@link ApprovalCoordinator#resolve(RequestId, Decision)}로 전달합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * onPending(summary)            (대기자 스레드)
 *   ↓
 * FutureTask 생성 → inFlight 등록 → 워커 풀 제출
 *   ↓
 * handler.decide(summary)       (워커 스레드)
 *   ├─ Decision → coordinator.resolve(id, decision)
 *   ├─ null     → 기권 (타임아웃 또는 다른 resolver 대기)
 *   └─ 예외     → 로그 (대기자는 타임아웃으로 종료)
 *
 * onClosed(summary, state)      (대기자 스레드, finally)
 *   ↓
 * inFlight 제거 → handler가 아직 결정 중이면 cancel(true) (워커 인터럽트)
 * </pre>
 *
 * <p>handler가 이미 반환한 뒤라면 (결정 전달 중 포함) 취소하지 않습니다.
 * 전달 중인 resolve를 인터럽트하거나 완료된 handler를 취소된 것으로 기록하지 않기 위함입니다.</p>
 *
 * <p>onPending과 onClosed는 같은 대기자 스레드에서 순서대로 호출되므로,
 * onClosed 시점에는 항상 해당 요청의 task가 inFlight에 등록되어 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * BlockingApprovalCoordinator coordinator = new BlockingApprovalCoordinator(registry, new ApprovalConfig());
 * DecisionHandlerDispatcher dispatcher = new DecisionHandlerDispatcher(
 *     coordinator, consolePrompt, new HandlerDispatcherConfig());
 * coordinator.addListener(dispatcher);
 * </pre>
 *
 * @author HITL Team
 * @since 1.0.0
 */
public final class DecisionHandlerDispatcher implements PendingRequestListener {

    private static final Logger log = LoggerFactory.getLogger(DecisionHandlerDispatcher.class);

    private final ApprovalCoordinator coordinator;
    private final DecisionHandler handler;
    private final HandlerDispatcherConfig config;
    private final ExecutorService workerExecutor;
    private final Map<RequestId, InFlightHandler> inFlight = new ConcurrentHashMap<>();

    /**
     * 실행 중인 handler task와 handler 반환 여부.
     */
    private record InFlightHandler(Future<?> task, AtomicBoolean returned) {
    }

    /**
     * 생성자.
     *
     * @param coordinator 결정을 전달할 coordinator
     * @param handler 결정 제공자
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DecisionHandlerDispatcher(ApprovalCoordinator coordinator, DecisionHandler handler, HandlerDispatcherConfig config) {
        if (coordinator == null) {
            throw new IllegalArgumentException("coordinator cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.coordinator = coordinator;
        this.handler = handler;
        this.config = config;
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency());
    }

    @Override
    public void onPending(PendingRequestSummary summary) {
        AtomicBoolean returned = new AtomicBoolean(false);
        FutureTask<Void> task = new FutureTask<>(() -> runHandler(summary, returned), null);
        inFlight.put(summary.id(), new InFlightHandler(task, returned));
        try {
            workerExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            inFlight.remove(summary.id());
            log.warn("Dispatcher is shut down, request {} left to other resolvers", summary.id().getValue());
        }
    }

    @Override
    public void onClosed(PendingRequestSummary summary, HandshakeState finalState) {
        InFlightHandler handler = inFlight.remove(summary.id());
        if (handler == null) {
            return;
        }
        if (handler.returned().get()) {
            log.debug("Handler for request {} had already returned ({})", summary.id().getValue(), finalState);
            return;
        }
        if (handler.task().cancel(true)) {
            log.debug("Handler for request {} cancelled ({})", summary.id().getValue(), finalState);
        }
    }

    /**
     * 진행 중인 handler 수.
     *
     * <p>테스트 검증용입니다.</p>
     *
     * @return inFlight 항목 수
     */
    public int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Dispatcher 종료 (리소스 정리).
     *
     * <p>새 요청 수락을 중단하고 진행 중인 handler를 shutdownTimeoutMs 동안 기다린 뒤,
     * 남은 handler는 인터럽트합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            workerExecutor.shutdownNow();
        }
    }

    /**
     * handler 실행 후 결과 전달.
     *
     * <p>예외 발생 시 로그만 남기고 워커 스레드를 유지합니다.</p>
     *
     * @param summary 대기 요청 요약
     * @param returned handler 반환 시 true로 설정
     */
    private void runHandler(PendingRequestSummary summary, AtomicBoolean returned) {
        String id = summary.id().getValue();
        try {
            Decision decision = handler.decide(summary);
            returned.set(true);
            if (decision == null) {
                log.debug("Handler abstained on request {}", id);
                return;
            }
            if (!coordinator.resolve(summary.id(), decision)) {
                log.info("Request {} closed before handler decision {} was delivered", id, decision);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Handler for request {} interrupted", id);
        } catch (RuntimeException e) {
            log.error("Decision handler failed for request {}", id, e);
        }
    }
}
