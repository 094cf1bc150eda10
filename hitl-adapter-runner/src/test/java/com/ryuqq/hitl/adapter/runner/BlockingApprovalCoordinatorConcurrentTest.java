package com.ryuqq.hitl.adapter.runner;

import com.ryuqq.hitl.adapter.inmemory.registry.InMemoryPendingRequestRegistry;
import com.ryuqq.hitl.application.coordinator.ApprovalConfig;
import com.ryuqq.hitl.core.model.Decision;
import com.ryuqq.hitl.core.model.OwnerId;
import com.ryuqq.hitl.core.model.PendingRequestSummary;
import com.ryuqq.hitl.core.model.RequestId;
import com.ryuqq.hitl.core.statemachine.HandshakeState;
import com.ryuqq.hitl.testkit.contract.RecordingPendingRequestListener;
import com.ryuqq.hitl.testkit.contract.TestPayloads;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * BlockingApprovalCoordinator 멀티스레드 안전성 테스트.
 *
 * <p>다수의 대기자와 resolver가 동시에 동작할 때를 검증합니다:</p>
 * <ul>
 *   <li>모든 대기자가 자신의 결정을 정확히 한 번 받음</li>
 *   <li>한 요청에 동시에 도착한 resolve는 모두 found=true</li>
 *   <li>타임아웃과 resolve 경쟁 시 멈추지 않음</li>
 *   <li>종료 후 registry에 잔여 항목 없음</li>
 * </ul>
 *
 * @author HITL Team
 * @since 1.0.0
 */
class BlockingApprovalCoordinatorConcurrentTest {

    private static final long WAIT_MILLIS = 10000;

    private InMemoryPendingRequestRegistry registry;
    private BlockingApprovalCoordinator coordinator;
    private RecordingPendingRequestListener listener;
    private ExecutorService executorService;

    @BeforeEach
    void setUp() {
        registry = new InMemoryPendingRequestRegistry();
        coordinator = new BlockingApprovalCoordinator(registry, new ApprovalConfig());
        listener = new RecordingPendingRequestListener();
        coordinator.addListener(listener);
        executorService = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
    }

    @Test
    void 대기자_50개와_resolver_8개_동시_실행_시_모든_대기자가_자신의_결정을_받음() throws Exception {
        // given
        int waiterCount = 50;
        int ownerCount = 5;
        int resolverCount = 8;
        List<Future<Decision>> waiters = new ArrayList<>();
        List<Decision> expected = new ArrayList<>();

        // when - 대기자 시작 (짝수 번째는 승인, 홀수 번째는 거절을 기대)
        for (int i = 0; i < waiterCount; i++) {
            OwnerId owner = OwnerId.of("owner-" + (i % ownerCount));
            String path = "/data/file-" + i;
            expected.add(i % 2 == 0 ? Decision.APPROVED : Decision.REJECTED);
            waiters.add(executorService.submit(() -> coordinator.requestDecision(
                owner, TestPayloads.deleteFile(path), Duration.ofSeconds(30), Decision.REJECTED)));
        }

        List<PendingRequestSummary> pending = new ArrayList<>();
        for (int i = 0; i < waiterCount; i++) {
            pending.add(listener.awaitPending(WAIT_MILLIS));
        }

        // when - resolver들이 나누어 동시에 결정 전달
        CountDownLatch startLatch = new CountDownLatch(1);
        AtomicInteger found = new AtomicInteger(0);
        List<Future<?>> resolvers = new ArrayList<>();
        for (int r = 0; r < resolverCount; r++) {
            int offset = r;
            resolvers.add(executorService.submit(() -> {
                startLatch.await();
                for (int i = offset; i < pending.size(); i += resolverCount) {
                    PendingRequestSummary summary = pending.get(i);
                    int index = indexOf(summary);
                    Decision decision = index % 2 == 0 ? Decision.APPROVED : Decision.REJECTED;
                    coordinator.listPending(summary.owner());
                    if (coordinator.resolve(summary.id(), decision)) {
                        found.incrementAndGet();
                    }
                }
                return null;
            }));
        }
        startLatch.countDown();
        for (Future<?> resolver : resolvers) {
            resolver.get(WAIT_MILLIS, TimeUnit.MILLISECONDS);
        }

        // then
        assertThat(found.get()).isEqualTo(waiterCount);
        for (int i = 0; i < waiterCount; i++) {
            assertThat(waiters.get(i).get(WAIT_MILLIS, TimeUnit.MILLISECONDS)).isEqualTo(expected.get(i));
        }
        assertThat(registry.size()).isZero();
        assertThat(registry.ownerCount()).isZero();
    }

    @RepeatedTest(20)
    void 동시에_도착한_resolve_N개는_모두_found이고_결정은_하나만_전달됨() throws Exception {
        // given
        int resolverCount = 8;
        Future<Decision> waiter = executorService.submit(() -> coordinator.requestDecision(
            OwnerId.of("contended"), TestPayloads.deleteFile("/tmp/contended"), Duration.ofSeconds(30), Decision.REJECTED));
        PendingRequestSummary summary = listener.awaitPending(WAIT_MILLIS);

        // when - latch로 동시에 출발 (짝수 번째 승인, 홀수 번째 거절)
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<Boolean>> resolvers = new ArrayList<>();
        for (int r = 0; r < resolverCount; r++) {
            Decision decision = r % 2 == 0 ? Decision.APPROVED : Decision.REJECTED;
            resolvers.add(executorService.submit(() -> {
                startLatch.await();
                return coordinator.resolve(summary.id(), decision);
            }));
        }
        startLatch.countDown();

        // then - 모든 resolver가 found=true, 대기자는 정확히 하나의 결정을 받음
        for (Future<Boolean> resolver : resolvers) {
            assertThat(resolver.get(WAIT_MILLIS, TimeUnit.MILLISECONDS)).isTrue();
        }
        assertThat(waiter.get(WAIT_MILLIS, TimeUnit.MILLISECONDS)).isIn(Decision.APPROVED, Decision.REJECTED);
        assertThat(listener.awaitClosed(WAIT_MILLIS)).isEqualTo(summary.id());
        assertThat(listener.closedState(summary.id())).isEqualTo(HandshakeState.DECIDED);
        assertThat(listener.closedCount()).isEqualTo(1);
        assertThat(registry.size()).isZero();
    }

    @RepeatedTest(10)
    void timeout과_resolve가_경쟁해도_대기자는_멈추지_않고_registry는_정리됨() throws Exception {
        // given
        Duration timeout = Duration.ofMillis(50);
        Future<Decision> waiter = executorService.submit(() -> coordinator.requestDecision(
            OwnerId.of("racer"), TestPayloads.named("op"), timeout, Decision.REJECTED));
        PendingRequestSummary summary = listener.awaitPending(WAIT_MILLIS);

        // when - timeout 무렵에 resolve
        Thread.sleep(timeout.toMillis());
        coordinator.resolve(summary.id(), Decision.APPROVED);

        // then - 결과는 둘 중 하나이며, 반드시 반환됨
        Decision decision = waiter.get(WAIT_MILLIS, TimeUnit.MILLISECONDS);
        assertThat(decision).isIn(Decision.APPROVED, Decision.REJECTED);
        assertThat(registry.size()).isZero();
    }

    @Test
    void resolve가_반환된_요청은_이후_listPending에_나타나지_않음() throws Exception {
        // given
        OwnerId owner = OwnerId.of("lister");
        int waiterCount = 20;
        List<Future<Decision>> waiters = new ArrayList<>();
        for (int i = 0; i < waiterCount; i++) {
            waiters.add(executorService.submit(() -> coordinator.requestDecision(
                owner, TestPayloads.named("op"), Duration.ofSeconds(30), Decision.REJECTED)));
        }
        List<PendingRequestSummary> pending = new ArrayList<>();
        for (int i = 0; i < waiterCount; i++) {
            pending.add(listener.awaitPending(WAIT_MILLIS));
        }

        // when - resolve 진행 중에 다른 스레드가 계속 목록 조회
        Set<RequestId> resolved = ConcurrentHashMap.newKeySet();
        AtomicInteger violations = new AtomicInteger(0);
        AtomicBoolean resolving = new AtomicBoolean(true);
        Future<?> lister = executorService.submit(() -> {
            while (resolving.get()) {
                Set<RequestId> resolvedBefore = Set.copyOf(resolved);
                for (PendingRequestSummary summary : coordinator.listPending(owner)) {
                    if (resolvedBefore.contains(summary.id())) {
                        violations.incrementAndGet();
                    }
                }
            }
            return null;
        });
        for (PendingRequestSummary summary : pending) {
            coordinator.resolve(summary.id(), Decision.APPROVED);
            resolved.add(summary.id());
        }

        // then
        for (Future<Decision> waiter : waiters) {
            assertThat(waiter.get(WAIT_MILLIS, TimeUnit.MILLISECONDS)).isEqualTo(Decision.APPROVED);
        }
        resolving.set(false);
        lister.get(WAIT_MILLIS, TimeUnit.MILLISECONDS);
        assertThat(violations.get()).isZero();
        assertThat(coordinator.listPending(owner)).isEmpty();
        assertThat(registry.hasOwner(owner)).isFalse();
    }

    private int indexOf(PendingRequestSummary summary) {
        String path = (String) summary.arguments().get("path");
        return Integer.parseInt(path.substring(path.lastIndexOf('-') + 1));
    }
}
