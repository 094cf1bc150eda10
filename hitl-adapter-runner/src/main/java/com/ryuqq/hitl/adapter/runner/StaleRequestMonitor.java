package com.ryuqq.hitl.adapter.runner;

import com.ryuqq.hitl.core.model.PendingRequest;
import com.ryuqq.hitl.core.model.PendingRequestSummary;
import com.ryuqq.hitl.core.spi.PendingRequestRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * StaleRequestMonitor 컴포넌트.
 *
 * <p>registry에 오래 남아 있는 대기 요청을 감지하여 로그로 보고합니다.</p>
 *
 * <p><strong>감지 시나리오:</strong></p>
 * <pre>
 * 1. requestDecision() 호출 → registry 등록 → 대기
 * 2. 정상 경로: 결정/타임아웃/취소 → finally에서 registry 제거
 * 3. 비정상 경로: 대기자 스레드가 멈춤 또는 매우 긴 timeout 사용
 * 4. Monitor가 주기적 스캔 (예: 1분마다)
 * 5. createdAt이 staleThreshold 이전인 요청 발견 → WARN 로그
 * </pre>
 *
 * <p><strong>제거하지 않음:</strong> registry 제거는 대기자 스레드의 책임입니다.
 * Monitor가 항목을 지우면 대기자의 정리 단계와 경쟁하게 되므로 보고만 합니다.</p>
 *
 * @author HITL Team
 * @since 1.0.0
 */
public final class StaleRequestMonitor {

    private static final Logger log = LoggerFactory.getLogger(StaleRequestMonitor.class);

    private final PendingRequestRegistry registry;
    private final StaleRequestMonitorConfig config;
    private final Clock clock;
    private final Object lifecycleLock = new Object();
    private ScheduledExecutorService scheduler;

    /**
     * 생성자 (시스템 UTC 시계 사용).
     *
     * @param registry pending request registry
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StaleRequestMonitor(PendingRequestRegistry registry, StaleRequestMonitorConfig config) {
        this(registry, config, Clock.systemUTC());
    }

    /**
     * 생성자 (시계 주입).
     *
     * @param registry pending request registry
     * @param config 설정
     * @param clock 현재 시각 기준 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StaleRequestMonitor(PendingRequestRegistry registry, StaleRequestMonitorConfig config, Clock clock) {
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
    }

    /**
     * 오래된 대기 요청 스캔.
     *
     * <p><strong>처리 흐름:</strong></p>
     * <pre>
     * 1. cutoff = now - staleThreshold
     * 2. scanCreatedBefore(cutoff, batchSize) → 오래된 순서
     * 3. 각 요청 WARN 로그 (owner, name, 경과 시간)
     * 4. 결과 카운트 로깅
     * </pre>
     *
     * @return 감지된 요청 요약 (오래된 순서)
     */
    public List<PendingRequestSummary> scan() {
        log.info("Stale request scan started");

        // 1. 임계값 이전에 생성된 요청 조회
        Instant now = clock.instant();
        Instant cutoff = now.minusMillis(config.staleThresholdMs());
        List<PendingRequest> stale = registry.scanCreatedBefore(cutoff, config.batchSize());

        // 2. 각 요청 보고
        for (PendingRequest request : stale) {
            Duration age = Duration.between(request.createdAt(), now);
            log.warn("Request {} for {} (owner={}) pending for {} ms, state={}",
                request.id().getValue(), request.payload().getName(), request.owner().getValue(),
                age.toMillis(), request.state());
        }

        // 3. 결과 로깅
        log.info("Stale request scan completed: {} stale out of {} pending", stale.size(), registry.size());

        return stale.stream()
            .map(PendingRequest::toSummary)
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * 주기적 스캔 시작.
     *
     * @throws IllegalStateException 이미 시작된 경우
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (scheduler != null) {
                throw new IllegalStateException("StaleRequestMonitor already started");
            }
            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "hitl-stale-request-monitor");
                thread.setDaemon(true);
                return thread;
            });
            scheduler.scheduleWithFixedDelay(this::scanSafely,
                config.scanIntervalMs(), config.scanIntervalMs(), TimeUnit.MILLISECONDS);
        }
        log.info("StaleRequestMonitor started (interval={} ms, threshold={} ms)",
            config.scanIntervalMs(), config.staleThresholdMs());
    }

    /**
     * 주기적 스캔 중지.
     *
     * <p>시작되지 않은 경우 아무 것도 하지 않습니다.</p>
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public void stop() throws InterruptedException {
        ScheduledExecutorService current;
        synchronized (lifecycleLock) {
            current = scheduler;
            scheduler = null;
        }
        if (current == null) {
            return;
        }
        current.shutdown();
        if (!current.awaitTermination(5, TimeUnit.SECONDS)) {
            current.shutdownNow();
        }
        log.info("StaleRequestMonitor stopped");
    }

    /**
     * 실행 여부 확인.
     *
     * @return start 후 stop 전이면 true
     */
    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return scheduler != null;
        }
    }

    /**
     * 스케줄러용 스캔.
     *
     * <p>예외가 스케줄러로 전파되면 이후 실행이 중단되므로 로그로 남기고 계속 진행합니다.</p>
     */
    private void scanSafely() {
        try {
            scan();
        } catch (RuntimeException e) {
            log.error("Stale request scan failed", e);
        }
    }
}
