package com.ryuqq.hitl.core.wait;

import com.ryuqq.hitl.core.model.Decision;
import com.ryuqq.hitl.core.statemachine.HandshakeState;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 단일 결정(single-resolution) 동기화 핸들.
 *
 * <p>대기자 스레드 하나가 {@link #await(Duration)}로 블로킹하고,
 * 다른 스레드가 {@link #resolve(Decision)} 또는 {@link #cancel()}로 결과를 전달합니다.</p>
 *
 * <p><strong>단일 결정 보장:</strong></p>
 * <ul>
 *   <li>resolve, cancel, 타임아웃 모두 동일한 {@link CompletableFuture#complete} 게이트를 통과</li>
 *   <li>가장 먼저 도착한 쪽만 true를 받고, 이후 시도는 false (덮어쓰기 없음, 예외 없음)</li>
 *   <li>타임아웃과 resolve가 거의 동시에 발생해도 결과는 정확히 하나</li>
 * </ul>
 *
 * <p><strong>취소:</strong> 대기 중인 스레드가 인터럽트되면 {@link Cancelled}를 반환하고
 * 인터럽트 플래그를 복원합니다. 단, 이미 결정이 도착했다면 그 결정이 우선합니다.</p>
 *
 * <p><strong>락:</strong> 이 클래스는 registry 락을 전혀 알지 못하며, 대기 중 어떤 락도 보유하지 않습니다.</p>
 *
 * @author HITL Team
 * @since 1.0.0
 */
public final class WaitHandle {

    private final CompletableFuture<WaitOutcome> outcome = new CompletableFuture<>();
    private final AtomicBoolean awaited = new AtomicBoolean(false);

    /**
     * 결정 대기.
     *
     * @param timeout 최대 대기 시간 (양수)
     * @return Decided, TimedOut 또는 Cancelled
     * @throws IllegalArgumentException timeout이 null이거나 양수가 아닌 경우
     * @throws IllegalStateException 이미 다른 대기자가 await를 호출한 경우
     */
    public WaitOutcome await(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        if (!awaited.compareAndSet(false, true)) {
            throw new IllegalStateException("WaitHandle can be awaited only once");
        }

        try {
            return outcome.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            // resolver가 간발의 차로 먼저 도착했다면 complete는 false, 그 결정을 반환
            outcome.complete(new TimedOut());
            return outcome.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome.complete(new Cancelled());
            return outcome.join();
        } catch (ExecutionException e) {
            throw new IllegalStateException("WaitHandle completed exceptionally", e.getCause());
        }
    }

    /**
     * 결정 전달.
     *
     * <p>대기자와 다른 스레드에서 호출해도 안전합니다.</p>
     *
     * @param decision 전달할 결정
     * @return 이 호출이 경쟁에서 이긴 경우 true, 이미 종료된 경우 false
     * @throws IllegalArgumentException decision이 null인 경우
     */
    public boolean resolve(Decision decision) {
        return outcome.complete(new Decided(decision));
    }

    /**
     * 대기 취소.
     *
     * @return 이 호출이 경쟁에서 이긴 경우 true, 이미 종료된 경우 false
     */
    public boolean cancel() {
        return outcome.complete(new Cancelled());
    }

    /**
     * 현재 상태 조회.
     *
     * @return 아직 결과가 없으면 PENDING, 그 외에는 결과의 종료 상태
     */
    public HandshakeState state() {
        WaitOutcome current = outcome.getNow(null);
        return current == null ? HandshakeState.PENDING : current.state();
    }

    /**
     * 종료 여부 확인.
     *
     * @return 결과가 확정된 경우 true
     */
    public boolean isResolved() {
        return outcome.isDone();
    }

    @Override
    public String toString() {
        return "WaitHandle{state=" + state() + '}';
    }
}
