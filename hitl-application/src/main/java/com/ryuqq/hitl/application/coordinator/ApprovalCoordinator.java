package com.ryuqq.hitl.application.coordinator;

import com.ryuqq.hitl.core.exception.DecisionCancelledException;
import com.ryuqq.hitl.core.exception.HandshakeException;
import com.ryuqq.hitl.core.exception.RequestNotFoundException;
import com.ryuqq.hitl.core.model.ApprovalPayload;
import com.ryuqq.hitl.core.model.Decision;
import com.ryuqq.hitl.core.model.OwnerId;
import com.ryuqq.hitl.core.model.PendingRequestSummary;
import com.ryuqq.hitl.core.model.RequestId;

import java.time.Duration;
import java.util.List;

/**
 * 승인 핸드셰이크 조정자.
 *
 * <p>작업 스레드(waiter)와 외부 결정자(resolver) 사이의 랑데부 지점입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * // 정책 코드 (waiter 스레드)
 * Decision decision = coordinator.requestDecision(
 *     OwnerId.of("alice"),
 *     ApprovalPayload.of("delete_file", "Delete a file", Map.of("path", "/tmp/a.txt")),
 *     Duration.ofSeconds(30),
 *     Decision.REJECTED
 * );
 * if (decision.isApproved()) {
 *     // 작업 수행
 * }
 *
 * // transport 계층 (다른 스레드)
 * List&lt;PendingRequestSummary&gt; pending = coordinator.listPending(OwnerId.of("alice"));
 * boolean found = coordinator.resolve(pending.get(0).id(), Decision.APPROVED);
 * </pre>
 *
 * @author HITL Team
 * @since 1.0.0
 */
public interface ApprovalCoordinator {

    /**
     * 결정을 요청하고 도착할 때까지 대기.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>RequestId 생성 (128비트 난수)</li>
     *   <li>PendingRequest + WaitHandle 생성 후 registry 등록</li>
     *   <li>timeout 동안 대기 (스레드 인터럽트 = 취소 신호)</li>
     *   <li>모든 종료 경로에서 registry 정리</li>
     *   <li>결정 → 그대로 반환, 타임아웃 → defaultDecision, 취소 → 예외</li>
     * </ol>
     *
     * @param owner 소유자
     * @param payload 승인 대상
     * @param timeout 최대 대기 시간 (필수, 양수, 최대 24시간)
     * @param defaultDecision 타임아웃 시 적용할 결정
     * @return 최종 결정
     * @throws IllegalArgumentException 인자가 null이거나 timeout이 허용 범위를 벗어난 경우
     * @throws HandshakeException registry 등록 실패 시 (대기 시작 전)
     * @throws DecisionCancelledException 대기 중 취소된 경우
     */
    Decision requestDecision(OwnerId owner, ApprovalPayload payload, Duration timeout, Decision defaultDecision);

    /**
     * 설정된 {@link ApprovalConfig}의 timeout과 기본 결정으로 결정 요청.
     *
     * @param owner 소유자
     * @param payload 승인 대상
     * @return 최종 결정
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws HandshakeException registry 등록 실패 시
     * @throws DecisionCancelledException 대기 중 취소된 경우
     */
    Decision requestDecision(OwnerId owner, ApprovalPayload payload);

    /**
     * 결정 전달.
     *
     * <p>요청을 registry에서 제거하지 않습니다. 제거는 대기자 자신의 정리 단계에서만 일어납니다.</p>
     *
     * <p>N개의 resolve가 동시에 도착하면 결정은 정확히 하나만 전달되고, 모든 호출이 true를 받습니다.
     * 승리한 결정으로 대기자가 먼저 정리된 경우에도 마찬가지입니다.</p>
     *
     * @param id 요청 ID
     * @param decision 결정
     * @return 요청이 존재하면 true (다른 결정이나 타임아웃과의 경쟁에서 져서 반영되지 않은 경우 포함)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    boolean resolve(RequestId id, Decision decision);

    /**
     * 소유자 검증 후 결정 전달.
     *
     * <p>다른 소유자의 요청은 존재 여부를 노출하지 않도록 찾지 못한 것으로 처리합니다.</p>
     *
     * @param owner 결정을 전달하는 소유자
     * @param id 요청 ID
     * @param decision 결정
     * @return 해당 소유자의 요청이 존재하면 true
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    boolean resolve(OwnerId owner, RequestId id, Decision decision);

    /**
     * 결정 전달 (요청이 없으면 예외).
     *
     * @param id 요청 ID
     * @param decision 결정
     * @throws RequestNotFoundException 요청이 없거나 이미 정리된 경우
     */
    default void resolveOrThrow(RequestId id, Decision decision) {
        if (!resolve(id, decision)) {
            throw new RequestNotFoundException(id);
        }
    }

    /**
     * 대기 중인 요청 취소 (상위 요청이 중단된 경우 등).
     *
     * @param id 요청 ID
     * @return 요청이 존재하면 true
     * @throws IllegalArgumentException id가 null인 경우
     */
    boolean cancel(RequestId id);

    /**
     * 소유자의 대기 중인 요청 목록.
     *
     * <p>읽기 전용, 비블로킹. 생성 순서대로 정렬되며
     * 이미 결정/타임아웃/취소된 요청은 registry 정리 전이라도 포함되지 않습니다.</p>
     *
     * @param owner 소유자
     * @return 요청 요약 스냅샷
     * @throws IllegalArgumentException owner가 null인 경우
     */
    List<PendingRequestSummary> listPending(OwnerId owner);
}
