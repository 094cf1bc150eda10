package com.ryuqq.hitl.adapter.runner;

import com.ryuqq.hitl.core.model.Decision;
import com.ryuqq.hitl.core.model.PendingRequestSummary;

/**
 * 결정 제공자 SPI.
 *
 * <p>새 대기 요청을 사용자에게 보여주고 응답을 받아오는 표시 계층(CLI 프롬프트, 채팅 봇 등)이 구현합니다.
 * {@link DecisionHandlerDispatcher}가 자체 워커 스레드에서 호출합니다.</p>
 *
 * <p><strong>구현 규칙:</strong></p>
 * <ul>
 *   <li>블로킹해도 됩니다. 핸드셰이크가 먼저 종료되면 워커 스레드가 인터럽트됩니다.</li>
 *   <li>null 반환은 기권입니다. 대기자는 다른 resolver 또는 타임아웃을 기다립니다.</li>
 *   <li>예외는 로그로만 남고 핸드셰이크에 영향을 주지 않습니다.</li>
 * </ul>
 *
 * @author HITL Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface DecisionHandler {

    /**
     * 대기 요청에 대한 결정.
     *
     * @param summary 대기 요청 요약
     * @return 결정, 기권 시 null
     * @throws InterruptedException 핸드셰이크가 먼저 종료되어 인터럽트된 경우
     */
    Decision decide(PendingRequestSummary summary) throws InterruptedException;
}
