package com.ryuqq.hitl.testkit.contract;

import com.ryuqq.hitl.core.model.PendingRequestSummary;
import com.ryuqq.hitl.core.model.RequestId;
import com.ryuqq.hitl.core.spi.PendingRequestListener;
import com.ryuqq.hitl.core.statemachine.HandshakeState;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * {@link PendingRequestListener} that records every callback for later assertions.
 *
 * <p>Lets a test wait for a waiter to register without polling the registry:</p>
 * <pre>
 * RecordingPendingRequestListener listener = new RecordingPendingRequestListener();
 * coordinator.addListener(listener);
 * executor.submit(() -&gt; coordinator.requestDecision(owner, payload, timeout, Decision.REJECTED));
 *
 * PendingRequestSummary pending = listener.awaitPending(1000);
 * coordinator.resolve(pending.id(), Decision.APPROVED);
 * </pre>
 *
 * @author HITL Team
 * @since 1.0.0
 */
public class RecordingPendingRequestListener implements PendingRequestListener {

    private final BlockingQueue<PendingRequestSummary> pendingQueue = new LinkedBlockingQueue<>();
    private final List<PendingRequestSummary> pendingHistory = new CopyOnWriteArrayList<>();
    private final Map<RequestId, HandshakeState> closedStates = new ConcurrentHashMap<>();
    private final BlockingQueue<RequestId> closedQueue = new LinkedBlockingQueue<>();

    @Override
    public void onPending(PendingRequestSummary summary) {
        pendingHistory.add(summary);
        pendingQueue.add(summary);
    }

    @Override
    public void onClosed(PendingRequestSummary summary, HandshakeState finalState) {
        closedStates.put(summary.id(), finalState);
        closedQueue.add(summary.id());
    }

    /**
     * Waits for the next onPending callback not yet consumed.
     *
     * @param timeoutMillis maximum wait
     * @return the pending request summary
     * @throws AssertionError if no request became pending in time
     */
    public PendingRequestSummary awaitPending(long timeoutMillis) {
        try {
            PendingRequestSummary summary = pendingQueue.poll(timeoutMillis, TimeUnit.MILLISECONDS);
            if (summary == null) {
                throw new AssertionError("No pending request within " + timeoutMillis + " ms");
            }
            return summary;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("Interrupted while waiting for a pending request", e);
        }
    }

    /**
     * Waits for the next onClosed callback not yet consumed.
     *
     * @param timeoutMillis maximum wait
     * @return id of the closed request
     * @throws AssertionError if no request closed in time
     */
    public RequestId awaitClosed(long timeoutMillis) {
        try {
            RequestId id = closedQueue.poll(timeoutMillis, TimeUnit.MILLISECONDS);
            if (id == null) {
                throw new AssertionError("No closed request within " + timeoutMillis + " ms");
            }
            return id;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("Interrupted while waiting for a closed request", e);
        }
    }

    /**
     * All onPending callbacks received so far, in arrival order.
     *
     * @return snapshot of pending summaries
     */
    public List<PendingRequestSummary> pendingHistory() {
        return new ArrayList<>(pendingHistory);
    }

    /**
     * Final state reported for a closed request.
     *
     * @param id request id
     * @return terminal state, or null if the request has not closed
     */
    public HandshakeState closedState(RequestId id) {
        return closedStates.get(id);
    }

    /**
     * Number of onClosed callbacks received.
     *
     * @return closed count
     */
    public int closedCount() {
        return closedStates.size();
    }
}
