package com.ryuqq.hitl.adapter.runner;

/**
 * StaleRequestMonitor 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 스캔 주기 (기본 60000ms = 1분)</li>
 *   <li>staleThresholdMs: 오래된 요청 판단 기준 (기본 300000ms = 5분)</li>
 *   <li>batchSize: 한 번에 보고할 최대 요청 수 (기본 100)</li>
 * </ul>
 *
 * <p><strong>임계값 설정 가이드:</strong></p>
 * <ul>
 *   <li>staleThresholdMs는 일반적인 approvalTimeout보다 길게 잡아야 합니다.</li>
 *   <li>정상 요청은 타임아웃으로 정리되므로, 임계값을 넘은 요청은 대기자 스레드가 멈췄거나
 *       아주 긴 타임아웃을 쓰는 경우입니다.</li>
 * </ul>
 *
 * @author HITL Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수여야 함)
 * @param staleThresholdMs 임계값 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 */
public record StaleRequestMonitorConfig(
    long scanIntervalMs,
    long staleThresholdMs,
    int batchSize
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanIntervalMs=60000ms (1분), staleThresholdMs=300000ms (5분), batchSize=100</p>
     */
    public StaleRequestMonitorConfig() {
        this(60000, 300000, 100);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public StaleRequestMonitorConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (staleThresholdMs <= 0) {
            throw new IllegalArgumentException(
                "staleThresholdMs must be positive (current: " + staleThresholdMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
    }

    /**
     * scanIntervalMs만 변경한 새 인스턴스 생성.
     */
    public StaleRequestMonitorConfig withScanIntervalMs(long scanIntervalMs) {
        return new StaleRequestMonitorConfig(scanIntervalMs, staleThresholdMs, batchSize);
    }

    /**
     * staleThresholdMs만 변경한 새 인스턴스 생성.
     */
    public StaleRequestMonitorConfig withStaleThresholdMs(long staleThresholdMs) {
        return new StaleRequestMonitorConfig(scanIntervalMs, staleThresholdMs, batchSize);
    }

    /**
     * batchSize만 변경한 새 인스턴스 생성.
     */
    public StaleRequestMonitorConfig withBatchSize(int batchSize) {
        return new StaleRequestMonitorConfig(scanIntervalMs, staleThresholdMs, batchSize);
    }
}
