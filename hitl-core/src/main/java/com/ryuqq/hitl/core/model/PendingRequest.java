package com.ryuqq.hitl.core.model;

import com.ryuqq.hitl.core.statemachine.HandshakeState;
import com.ryuqq.hitl.core.wait.WaitHandle;

import java.time.Instant;

/**
 * 처리 대기 중인 승인 요청 하나.
 *
 * <p>{@link WaitHandle}은 생성자에서 함께 만들어지므로,
 * registry에 등록되어 다른 스레드가 관찰하는 시점에는 항상 대기 준비가 끝난 상태입니다.</p>
 *
 * <p><strong>불변성:</strong> id, owner, payload, createdAt은 생성 후 변경 불가.
 * 변하는 것은 WaitHandle의 상태뿐입니다.</p>
 *
 * <p><strong>createdAt:</strong> 화면 표시와 staleness 진단 용도입니다.
 * 핸드셰이크 타임아웃은 대기 시작 시점부터 별도로 측정됩니다.</p>
 *
 * @author HITL Team
 * @since 1.0.0
 */
public final class PendingRequest {

    private final RequestId id;
    private final OwnerId owner;
    private final ApprovalPayload payload;
    private final Instant createdAt;
    private final WaitHandle waitHandle;

    private PendingRequest(RequestId id, OwnerId owner, ApprovalPayload payload, Instant createdAt) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        this.id = id;
        this.owner = owner;
        this.payload = payload;
        this.createdAt = createdAt;
        this.waitHandle = new WaitHandle();
    }

    /**
     * 새 RequestId로 PendingRequest 생성.
     *
     * @param owner 소유자
     * @param payload 승인 대상
     * @param createdAt 생성 시각
     * @return PendingRequest 인스턴스
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static PendingRequest create(OwnerId owner, ApprovalPayload payload, Instant createdAt) {
        return new PendingRequest(RequestId.generate(), owner, payload, createdAt);
    }

    /**
     * 지정한 RequestId로 PendingRequest 생성.
     *
     * @param id 요청 ID
     * @param owner 소유자
     * @param payload 승인 대상
     * @param createdAt 생성 시각
     * @return PendingRequest 인스턴스
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static PendingRequest of(RequestId id, OwnerId owner, ApprovalPayload payload, Instant createdAt) {
        return new PendingRequest(id, owner, payload, createdAt);
    }

    public RequestId id() {
        return id;
    }

    public OwnerId owner() {
        return owner;
    }

    public ApprovalPayload payload() {
        return payload;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /**
     * 이 요청 전용 WaitHandle.
     *
     * @return WaitHandle (요청과 생명주기를 함께함)
     */
    public WaitHandle waitHandle() {
        return waitHandle;
    }

    /**
     * 현재 핸드셰이크 상태.
     *
     * @return WaitHandle의 상태
     */
    public HandshakeState state() {
        return waitHandle.state();
    }

    /**
     * 목록 조회용 요약본 생성.
     *
     * @return PendingRequestSummary
     */
    public PendingRequestSummary toSummary() {
        return new PendingRequestSummary(
            id,
            owner,
            payload.getName(),
            payload.getDescription(),
            payload.getArguments(),
            createdAt
        );
    }

    @Override
    public String toString() {
        return "PendingRequest{id=" + id.getValue() + ", owner=" + owner.getValue()
            + ", name=" + payload.getName() + ", state=" + state() + '}';
    }
}
