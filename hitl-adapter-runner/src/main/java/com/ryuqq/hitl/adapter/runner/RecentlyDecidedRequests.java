package com.ryuqq.hitl.adapter.runner;

import com.ryuqq.hitl.core.model.OwnerId;
import com.ryuqq.hitl.core.model.RequestId;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 최근 결정되어 registry에서 제거된 요청 기록.
 *
 * <p>결정이 전달되면 대기자는 곧바로 깨어나 registry에서 요청을 제거합니다.
 * 같은 요청에 동시에 도착한 나머지 resolver는 registry에서 요청을 찾지 못하지만,
 * 요청은 존재했고 결정도 이미 전달되었으므로 found=true를 받아야 합니다.
 * 이 기록이 그 간격을 메웁니다.</p>
 *
 * <p><strong>기록 대상:</strong> DECIDED로 종료된 요청만 기록합니다.
 * 타임아웃/취소로 종료된 요청은 기록하지 않으므로, 그 이후 도착한 resolve는 not found입니다.</p>
 *
 * <p><strong>메모리 상한:</strong></p>
 * <ul>
 *   <li>retention이 지난 항목은 다음 접근 시 제거</li>
 *   <li>capacity를 넘으면 가장 오래된 항목부터 제거</li>
 * </ul>
 *
 * <p><strong>Thread-safety:</strong> 모든 메서드는 인스턴스 모니터로 동기화됩니다.
 * 만료 제거는 삽입 순서의 앞쪽부터 진행하므로 호출당 상환 O(1)입니다.</p>
 *
 * @author HITL Team
 * @since 1.0.0
 */
final class RecentlyDecidedRequests {

    private final Clock clock;
    private final Duration retention;
    private final int capacity;

    /**
     * 삽입 순서 = 결정 시각 순서. Key: RequestId, Value: 소유자 + 기록 시각
     */
    private final LinkedHashMap<RequestId, Entry> entries = new LinkedHashMap<>();

    private record Entry(OwnerId owner, Instant recordedAt) {
    }

    /**
     * 생성자.
     *
     * @param clock 기록 시각 기준 시계
     * @param retention 보관 기간 (양수)
     * @param capacity 최대 보관 수 (1 이상)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    RecentlyDecidedRequests(Clock clock, Duration retention, int capacity) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (retention == null || retention.isZero() || retention.isNegative()) {
            throw new IllegalArgumentException("retention must be positive (current: " + retention + ")");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        this.clock = clock;
        this.retention = retention;
        this.capacity = capacity;
    }

    /**
     * 결정된 요청 기록.
     *
     * @param id 요청 ID
     * @param owner 소유자
     */
    synchronized void record(RequestId id, OwnerId owner) {
        Instant now = clock.instant();
        entries.put(id, new Entry(owner, now));
        evict(now);
    }

    /**
     * 최근 결정된 요청의 소유자 조회.
     *
     * @param id 요청 ID
     * @return 보관 기간 내 기록이 있으면 소유자, 없으면 empty
     */
    synchronized Optional<OwnerId> ownerOf(RequestId id) {
        evict(clock.instant());
        Entry entry = entries.get(id);
        return entry == null ? Optional.empty() : Optional.of(entry.owner());
    }

    /**
     * 현재 보관 중인 기록 수.
     *
     * @return 기록 수
     */
    synchronized int size() {
        evict(clock.instant());
        return entries.size();
    }

    private void evict(Instant now) {
        Instant expiry = now.minus(retention);
        Iterator<Map.Entry<RequestId, Entry>> iterator = entries.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<RequestId, Entry> eldest = iterator.next();
            if (entries.size() > capacity || !eldest.getValue().recordedAt().isAfter(expiry)) {
                iterator.remove();
            } else {
                break;
            }
        }
    }
}
