package com.ryuqq.hitl.core.spi;

import com.ryuqq.hitl.core.model.PendingRequestSummary;
import com.ryuqq.hitl.core.statemachine.HandshakeState;

/**
 * Pending request lifecycle listener SPI.
 *
 * <p>Lets a presentation surface (CLI prompt, chat notification, web push) learn about new
 * requests without polling. Callbacks run on the waiter's thread, outside any registry lock,
 * and must return quickly.</p>
 *
 * <p>Exceptions thrown by a listener are logged by the coordinator and never affect the handshake.</p>
 *
 * @author HITL Team
 * @since 1.0.0
 */
public interface PendingRequestListener {

    /**
     * Called after the request has been registered, before the waiter starts blocking.
     *
     * @param summary the new pending request
     */
    void onPending(PendingRequestSummary summary);

    /**
     * Called after the request has been removed from the registry.
     *
     * @param summary the closed request
     * @param finalState terminal state reached by the handshake
     */
    default void onClosed(PendingRequestSummary summary, HandshakeState finalState) {
    }
}
