package com.ryuqq.hitl.adapter.runner;

import com.ryuqq.hitl.application.coordinator.ApprovalConfig;
import com.ryuqq.hitl.application.coordinator.ApprovalCoordinator;
import com.ryuqq.hitl.core.exception.DecisionCancelledException;
import com.ryuqq.hitl.core.exception.DuplicateRequestIdException;
import com.ryuqq.hitl.core.exception.HandshakeException;
import com.ryuqq.hitl.core.model.ApprovalPayload;
import com.ryuqq.hitl.core.model.Decision;
import com.ryuqq.hitl.core.model.OwnerId;
import com.ryuqq.hitl.core.model.PendingRequest;
import com.ryuqq.hitl.core.model.PendingRequestSummary;
import com.ryuqq.hitl.core.model.RequestId;
import com.ryuqq.hitl.core.spi.PendingRequestListener;
import com.ryuqq.hitl.core.spi.PendingRequestRegistry;
import com.ryuqq.hitl.core.statemachine.HandshakeState;
import com.ryuqq.hitl.core.wait.Decided;
import com.ryuqq.hitl.core.wait.WaitOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * 블로킹 방식 승인 핸드셰이크 구현체.
 *
 * <p>호출 스레드를 {@link com.ryuqq.hitl.core.wait.WaitHandle}에서 블로킹하고,
 * 외부 resolver의 결정 또는 타임아웃으로 깨웁니다.</p>
 *
 * <p><strong>동작 방식 (requestDecision):</strong></p>
 * <ol>
 *   <li>입력 검증 (timeout 필수, 양수, 최대 24시간)</li>
 *   <li>PendingRequest 생성 (RequestId + 대기 준비된 WaitHandle)</li>
 *   <li>registry.insert → 실패 시 대기 없이 HandshakeException</li>
 *   <li>listener.onPending 통지</li>
 *   <li>WaitHandle.await(timeout) (registry 락 미보유)</li>
 *   <li>finally: handle.cancel (방치된 경우만 효과) → registry.remove → listener.onClosed</li>
 *   <li>결과 매핑: Decided → 결정, TimedOut → 기본 결정, Cancelled → DecisionCancelledException</li>
 * </ol>
 *
 * <p><strong>정리 책임:</strong> registry 제거는 오직 대기자 스레드의 finally 블록에서만 일어납니다.
 * resolve/cancel은 WaitHandle에 신호만 보내므로, 타임아웃과 resolver가 공유 상태 정리를 두고 경쟁하지 않습니다.</p>
 *
 * <p><strong>동시 resolve:</strong> 결정이 전달되면 대기자가 곧바로 registry에서 요청을 제거하므로,
 * 같은 요청에 동시에 도착한 나머지 resolver는 registry에서 요청을 찾지 못할 수 있습니다.
 * DECIDED로 종료된 요청은 registry 제거 전에 {@link RecentlyDecidedRequests}에 기록되고,
 * resolve/cancel은 이 기록도 found로 취급합니다 (보관 기간 {@link #DECIDED_RETENTION},
 * 최대 {@link #DECIDED_CAPACITY}건). 타임아웃/취소로 종료된 요청은 기록하지 않습니다.</p>
 *
 * <p><strong>Thread-safety:</strong> 인스턴스 상태는 불변 의존성, CopyOnWriteArrayList 리스너 목록,
 * 동기화된 최근 결정 기록뿐입니다.</p>
 *
 * @author HITL Team
 * @since 1.0.0
 */
public final class BlockingApprovalCoordinator implements ApprovalCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BlockingApprovalCoordinator.class);

    /**
     * 결정된 요청 ID를 found로 취급하는 기간.
     */
    static final Duration DECIDED_RETENTION = Duration.ofSeconds(30);

    /**
     * 최근 결정 기록 최대 보관 수.
     */
    static final int DECIDED_CAPACITY = 10_000;

    private final PendingRequestRegistry registry;
    private final ApprovalConfig config;
    private final Clock clock;
    private final RecentlyDecidedRequests recentlyDecided;
    private final List<PendingRequestListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * 생성자 (시스템 UTC 시계 사용).
     *
     * @param registry pending request registry
     * @param config 승인 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public BlockingApprovalCoordinator(PendingRequestRegistry registry, ApprovalConfig config) {
        this(registry, config, Clock.systemUTC());
    }

    /**
     * 생성자 (시계 주입).
     *
     * @param registry pending request registry
     * @param config 승인 설정
     * @param clock createdAt 기록용 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public BlockingApprovalCoordinator(PendingRequestRegistry registry, ApprovalConfig config, Clock clock) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.registry = registry;
        this.config = config;
        this.clock = clock;
        this.recentlyDecided = new RecentlyDecidedRequests(clock, DECIDED_RETENTION, DECIDED_CAPACITY);
    }

    /**
     * 리스너 등록.
     *
     * @param listener 새 요청/종료 통지를 받을 리스너
     * @throws IllegalArgumentException listener가 null인 경우
     */
    public void addListener(PendingRequestListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
    }

    /**
     * 리스너 해제.
     *
     * @param listener 해제할 리스너
     * @return 등록되어 있었으면 true
     */
    public boolean removeListener(PendingRequestListener listener) {
        return listeners.remove(listener);
    }

    @Override
    public Decision requestDecision(OwnerId owner, ApprovalPayload payload) {
        return requestDecision(owner, payload, config.approvalTimeout(), config.defaultDecision());
    }

    @Override
    public Decision requestDecision(OwnerId owner, ApprovalPayload payload, Duration timeout, Decision defaultDecision) {
        validateInput(owner, payload, timeout, defaultDecision);

        // 1. PendingRequest 생성 (WaitHandle은 생성자에서 준비됨)
        PendingRequest request = PendingRequest.create(owner, payload, clock.instant());

        // 2. Registry 등록 (대기 시작 전 실패 처리)
        try {
            registry.insert(request);
        } catch (DuplicateRequestIdException e) {
            throw new HandshakeException("Failed to register pending request " + request.id().getValue(), e);
        }
        log.debug("Pending request registered: {} (owner={}, name={})",
            request.id().getValue(), owner.getValue(), payload.getName());

        PendingRequestSummary summary = request.toSummary();
        WaitOutcome outcome;
        try {
            // 3. 통지 후 대기 (락 미보유)
            notifyPending(summary);
            outcome = request.waitHandle().await(timeout);
        } finally {
            // 4. 모든 종료 경로에서 정리
            request.waitHandle().cancel();
            if (request.state() == HandshakeState.DECIDED) {
                recentlyDecided.record(request.id(), owner);
            }
            registry.remove(owner, request.id());
            notifyClosed(summary, request.state());
        }

        // 5. 결과 매핑
        return mapOutcome(request, outcome, timeout, defaultDecision);
    }

    @Override
    public boolean resolve(RequestId id, Decision decision) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (decision == null) {
            throw new IllegalArgumentException("decision cannot be null");
        }

        Optional<PendingRequest> found = registry.find(id);
        if (found.isEmpty()) {
            return resolveClosed(id, decision, recentlyDecided.ownerOf(id).isPresent());
        }
        deliver(found.get(), decision);
        return true;
    }

    @Override
    public boolean resolve(OwnerId owner, RequestId id, Decision decision) {
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (decision == null) {
            throw new IllegalArgumentException("decision cannot be null");
        }

        Optional<PendingRequest> found = registry.find(id);
        if (found.isEmpty()) {
            return resolveClosed(id, decision, recentlyDecided.ownerOf(id).filter(owner::equals).isPresent());
        }
        PendingRequest request = found.get();
        if (!request.owner().equals(owner)) {
            log.warn("Owner {} attempted to resolve request {} owned by another owner",
                owner.getValue(), id.getValue());
            return false;
        }
        deliver(request, decision);
        return true;
    }

    @Override
    public boolean cancel(RequestId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }

        Optional<PendingRequest> found = registry.find(id);
        if (found.isEmpty()) {
            boolean decided = recentlyDecided.ownerOf(id).isPresent();
            if (decided) {
                log.info("Cancel for request {} arrived after it was already DECIDED", id.getValue());
            }
            return decided;
        }
        PendingRequest request = found.get();
        if (request.waitHandle().cancel()) {
            log.info("Pending request {} cancelled", id.getValue());
        } else {
            log.info("Cancel for request {} arrived after it was already {}", id.getValue(), request.state());
        }
        return true;
    }

    @Override
    public List<PendingRequestSummary> listPending(OwnerId owner) {
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }

        return registry.list(owner).stream()
            .filter(request -> request.state() == HandshakeState.PENDING)
            .map(PendingRequest::toSummary)
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * 입력 유효성 검증.
     *
     * @throws IllegalArgumentException 유효하지 않은 입력인 경우
     */
    private void validateInput(OwnerId owner, ApprovalPayload payload, Duration timeout, Decision defaultDecision) {
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        if (timeout.isZero() || timeout.isNegative() || timeout.compareTo(ApprovalConfig.MAX_TIMEOUT) > 0) {
            throw new IllegalArgumentException(
                String.format("timeout must be positive and at most %s (current: %s)",
                    ApprovalConfig.MAX_TIMEOUT, timeout));
        }
        if (defaultDecision == null) {
            throw new IllegalArgumentException("defaultDecision cannot be null");
        }
    }

    /**
     * WaitHandle에 결정 전달 (registry 제거 없음).
     *
     * @param request 대상 요청
     * @param decision 결정
     */
    private void deliver(PendingRequest request, Decision decision) {
        if (request.waitHandle().resolve(decision)) {
            log.info("Request {} resolved: {}", request.id().getValue(), decision);
        } else {
            log.info("Decision {} for request {} arrived too late (already {})",
                decision, request.id().getValue(), request.state());
        }
    }

    /**
     * registry에 없는 요청에 대한 resolve 결과.
     *
     * @param id 요청 ID
     * @param decision 늦게 도착한 결정
     * @param decided 최근 결정 기록에 있는지 여부
     * @return decided 그대로 (found)
     */
    private boolean resolveClosed(RequestId id, Decision decision, boolean decided) {
        if (decided) {
            log.info("Decision {} for request {} arrived too late (already DECIDED)", decision, id.getValue());
        } else {
            log.debug("Resolve for unknown request: {}", id.getValue());
        }
        return decided;
    }

    /**
     * 대기 결과를 반환값으로 매핑.
     *
     * @return 결정 (Cancelled인 경우 예외)
     * @throws DecisionCancelledException 취소된 경우
     */
    private Decision mapOutcome(PendingRequest request, WaitOutcome outcome, Duration timeout, Decision defaultDecision) {
        String id = request.id().getValue();
        String name = request.payload().getName();

        if (outcome instanceof Decided) {
            Decision decision = ((Decided) outcome).decision();
            log.info("User {} {}: {}", decision.isApproved() ? "approved" : "rejected", name, id);
            return decision;
        }

        if (outcome.isTimedOut()) {
            log.warn("Approval timed out after {} ms for {}: {}", timeout.toMillis(), name, id);
            if (defaultDecision.isApproved()) {
                log.warn("Auto-approving {} due to timeout (risky!)", name);
            } else {
                log.info("Auto-rejecting {} due to timeout (safer)", name);
            }
            return defaultDecision;
        }

        log.info("Approval wait cancelled for {}: {}", name, id);
        throw new DecisionCancelledException(request.id());
    }

    private void notifyPending(PendingRequestSummary summary) {
        for (PendingRequestListener listener : listeners) {
            try {
                listener.onPending(summary);
            } catch (RuntimeException e) {
                log.error("Listener {} failed on pending request {}", listener, summary.id().getValue(), e);
            }
        }
    }

    private void notifyClosed(PendingRequestSummary summary, HandshakeState finalState) {
        for (PendingRequestListener listener : listeners) {
            try {
                listener.onClosed(summary, finalState);
            } catch (RuntimeException e) {
                log.error("Listener {} failed on closed request {}", listener, summary.id().getValue(), e);
            }
        }
    }
}
