package com.ryuqq.hitl.adapter.runner;

/**
 * DecisionHandlerDispatcher 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 동시에 실행할 handler 수 (기본 4)</li>
 *   <li>shutdownTimeoutMs: shutdown 시 진행 중인 handler 대기 시간 (기본 10000ms = 10초)</li>
 * </ul>
 *
 * <p>handler가 사람의 응답을 기다리며 블로킹하는 경우, concurrency는 동시에 표시할 수 있는
 * 최대 요청 수가 됩니다. 초과한 요청은 워커가 빌 때까지 큐에서 기다립니다.</p>
 *
 * @author HITL Team
 * @since 1.0.0
 * @param concurrency 워커 스레드 수 (1 이상이어야 함)
 * @param shutdownTimeoutMs shutdown 대기 시간 (밀리초, 양수여야 함)
 */
public record HandlerDispatcherConfig(
    int concurrency,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: concurrency=4, shutdownTimeoutMs=10000ms</p>
     */
    public HandlerDispatcherConfig() {
        this(4, 10000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public HandlerDispatcherConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * concurrency만 변경한 새 인스턴스 생성.
     */
    public HandlerDispatcherConfig withConcurrency(int concurrency) {
        return new HandlerDispatcherConfig(concurrency, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public HandlerDispatcherConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new HandlerDispatcherConfig(concurrency, shutdownTimeoutMs);
    }
}
