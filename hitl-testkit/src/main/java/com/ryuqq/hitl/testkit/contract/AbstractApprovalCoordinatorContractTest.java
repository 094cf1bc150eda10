package com.ryuqq.hitl.testkit.contract;

import com.ryuqq.hitl.application.coordinator.ApprovalConfig;
import com.ryuqq.hitl.application.coordinator.ApprovalCoordinator;
import com.ryuqq.hitl.core.exception.RequestNotFoundException;
import com.ryuqq.hitl.core.model.Decision;
import com.ryuqq.hitl.core.model.OwnerId;
import com.ryuqq.hitl.core.model.PendingRequestSummary;
import com.ryuqq.hitl.core.model.RequestId;
import com.ryuqq.hitl.core.spi.PendingRequestRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract tests every {@link ApprovalCoordinator} implementation must pass.
 *
 * <p>Waiters run on a cached thread pool; the test thread plays the resolver.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>End-to-end: alice requests delete_file, resolver lists and approves it</li>
 *   <li>Timeout returns the default decision within a bounded margin</li>
 *   <li>Owner isolation for listing and resolving</li>
 *   <li>Per-owner insertion order in listings</li>
 *   <li>Cleanup: no registry residue after any exit path</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyCoordinatorContractTest extends AbstractApprovalCoordinatorContractTest {
 *     {@literal @}Override
 *     protected PendingRequestRegistry createRegistry() {
 *         return new InMemoryPendingRequestRegistry();
 *     }
 *
 *     {@literal @}Override
 *     protected ApprovalCoordinator createCoordinator(PendingRequestRegistry registry, ApprovalConfig config) {
 *         return new MyCoordinator(registry, config);
 *     }
 * }
 * </pre>
 *
 * @author HITL Team
 * @since 1.0.0
 */
public abstract class AbstractApprovalCoordinatorContractTest {

    protected static final OwnerId ALICE = OwnerId.of("alice");
    protected static final OwnerId BOB = OwnerId.of("bob");

    /**
     * Waiter timeout for tests that resolve explicitly; long enough to never fire.
     */
    protected static final Duration LONG_TIMEOUT = Duration.ofSeconds(10);

    /**
     * Upper bound on how long a test waits for a waiter to register or finish.
     */
    protected static final long WAIT_MILLIS = 5000;

    protected PendingRequestRegistry registry;
    protected ApprovalCoordinator coordinator;
    protected ExecutorService waiters;

    /**
     * Creates a fresh, empty registry.
     *
     * @return registry backing the coordinator
     */
    protected abstract PendingRequestRegistry createRegistry();

    /**
     * Creates the coordinator under test.
     *
     * @param registry registry from {@link #createRegistry()}
     * @param config approval configuration
     * @return coordinator under test
     */
    protected abstract ApprovalCoordinator createCoordinator(PendingRequestRegistry registry, ApprovalConfig config);

    @BeforeEach
    void setUpCoordinator() {
        registry = createRegistry();
        coordinator = createCoordinator(registry, new ApprovalConfig());
        waiters = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDownCoordinator() {
        waiters.shutdownNow();
    }

    // ============================================================
    // 1. end-to-end
    // ============================================================

    @Test
    void testRequestDecision_ApprovedByResolver_ReturnsApprovedAndCleansUp() throws Exception {
        // Given: alice's worker asks to delete a file
        Future<Decision> waiter = startWaiter(ALICE, "/tmp/report.txt", LONG_TIMEOUT, Decision.REJECTED);

        // When: resolver lists alice's requests and approves
        List<PendingRequestSummary> pending = awaitListed(ALICE, 1);
        PendingRequestSummary summary = pending.get(0);
        assertEquals("delete_file", summary.name());
        assertEquals("/tmp/report.txt", summary.arguments().get("path"));
        assertEquals(ALICE, summary.owner());

        boolean found = coordinator.resolve(summary.id(), Decision.APPROVED);

        // Then
        assertTrue(found);
        assertEquals(Decision.APPROVED, waiter.get(WAIT_MILLIS, TimeUnit.MILLISECONDS));
        assertTrue(coordinator.listPending(ALICE).isEmpty());
        assertFalse(registry.hasOwner(ALICE), "Owner bucket must be removed after cleanup");
        assertEquals(0, registry.size());
    }

    @Test
    void testRequestDecision_RejectedByResolver_ReturnsRejected() throws Exception {
        // Given
        Future<Decision> waiter = startWaiter(ALICE, "/etc/passwd", LONG_TIMEOUT, Decision.APPROVED);
        PendingRequestSummary summary = awaitListed(ALICE, 1).get(0);

        // When
        coordinator.resolve(summary.id(), Decision.REJECTED);

        // Then
        assertEquals(Decision.REJECTED, waiter.get(WAIT_MILLIS, TimeUnit.MILLISECONDS));
    }

    // ============================================================
    // 2. timeout
    // ============================================================

    @Test
    void testRequestDecision_NoResolver_ReturnsDefaultAfterTimeout() throws Exception {
        // Given
        Duration timeout = Duration.ofMillis(200);
        long start = System.nanoTime();

        // When
        Future<Decision> waiter = startWaiter(ALICE, "/tmp/a.txt", timeout, Decision.APPROVED);
        Decision decision = waiter.get(WAIT_MILLIS, TimeUnit.MILLISECONDS);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        // Then
        assertEquals(Decision.APPROVED, decision);
        assertTrue(elapsedMillis >= 190, "Returned too early: " + elapsedMillis + " ms");
        assertTrue(elapsedMillis < 200 + 2000, "Returned too late: " + elapsedMillis + " ms");
        assertEquals(0, registry.size());
    }

    @Test
    void testResolve_AfterTimeoutCleanup_ReturnsFalse() throws Exception {
        // Given
        Future<Decision> waiter = startWaiter(ALICE, "/tmp/a.txt", Duration.ofMillis(300), Decision.REJECTED);
        RequestId id = awaitListed(ALICE, 1).get(0).id();
        assertEquals(Decision.REJECTED, waiter.get(WAIT_MILLIS, TimeUnit.MILLISECONDS));

        // When
        boolean found = coordinator.resolve(id, Decision.APPROVED);

        // Then
        assertFalse(found);
        assertThrows(RequestNotFoundException.class, () -> coordinator.resolveOrThrow(id, Decision.APPROVED));
    }

    // ============================================================
    // 3. not found / isolation
    // ============================================================

    @Test
    void testResolve_UnknownId_ReturnsFalse() {
        assertFalse(coordinator.resolve(RequestId.generate(), Decision.APPROVED));
        assertTrue(coordinator.listPending(ALICE).isEmpty());
    }

    @Test
    void testOwners_AreIsolated() throws Exception {
        // Given
        Future<Decision> aliceWaiter = startWaiter(ALICE, "/home/alice/a", LONG_TIMEOUT, Decision.REJECTED);
        Future<Decision> bobWaiter = startWaiter(BOB, "/home/bob/b", LONG_TIMEOUT, Decision.REJECTED);
        PendingRequestSummary alicePending = awaitListed(ALICE, 1).get(0);
        PendingRequestSummary bobPending = awaitListed(BOB, 1).get(0);

        // Then: each owner sees only their own request
        assertEquals("/home/alice/a", alicePending.arguments().get("path"));
        assertEquals("/home/bob/b", bobPending.arguments().get("path"));

        // When: bob's request is approved
        coordinator.resolve(bobPending.id(), Decision.APPROVED);

        // Then: alice is unaffected
        assertEquals(Decision.APPROVED, bobWaiter.get(WAIT_MILLIS, TimeUnit.MILLISECONDS));
        assertFalse(aliceWaiter.isDone());
        assertEquals(1, coordinator.listPending(ALICE).size());

        coordinator.resolve(alicePending.id(), Decision.REJECTED);
        assertEquals(Decision.REJECTED, aliceWaiter.get(WAIT_MILLIS, TimeUnit.MILLISECONDS));
    }

    // ============================================================
    // 4. ordering
    // ============================================================

    @Test
    void testListPending_ReturnsInsertionOrder() throws Exception {
        // Given: three requests registered one after another
        List<Future<Decision>> futures = new ArrayList<>();
        for (int i = 1; i <= 3; i++) {
            futures.add(startWaiter(ALICE, "/tmp/file-" + i, LONG_TIMEOUT, Decision.REJECTED));
            awaitListed(ALICE, i);
        }

        // When
        List<PendingRequestSummary> pending = coordinator.listPending(ALICE);

        // Then
        assertEquals(3, pending.size());
        for (int i = 0; i < 3; i++) {
            assertEquals("/tmp/file-" + (i + 1), pending.get(i).arguments().get("path"));
        }

        for (PendingRequestSummary summary : pending) {
            coordinator.resolve(summary.id(), Decision.APPROVED);
        }
        for (Future<Decision> future : futures) {
            assertEquals(Decision.APPROVED, future.get(WAIT_MILLIS, TimeUnit.MILLISECONDS));
        }
        assertFalse(registry.hasOwner(ALICE));
    }

    // ============================================================
    // 5. validation
    // ============================================================

    @Test
    void testRequestDecision_InvalidTimeout_ThrowsBeforeRegistering() {
        assertThrows(IllegalArgumentException.class,
            () -> coordinator.requestDecision(ALICE, TestPayloads.named("op"), null, Decision.REJECTED));
        assertThrows(IllegalArgumentException.class,
            () -> coordinator.requestDecision(ALICE, TestPayloads.named("op"), Duration.ZERO, Decision.REJECTED));
        assertThrows(IllegalArgumentException.class,
            () -> coordinator.requestDecision(ALICE, TestPayloads.named("op"), Duration.ofMillis(-1), Decision.REJECTED));
        assertThrows(IllegalArgumentException.class,
            () -> coordinator.requestDecision(ALICE, TestPayloads.named("op"), Duration.ofHours(25), Decision.REJECTED));
        assertThrows(IllegalArgumentException.class,
            () -> coordinator.requestDecision(ALICE, TestPayloads.named("op"), LONG_TIMEOUT, null));
        assertEquals(0, registry.size());
    }

    // ============================================================
    // helpers
    // ============================================================

    /**
     * Starts a waiter asking for permission to delete the given path.
     */
    protected Future<Decision> startWaiter(OwnerId owner, String path, Duration timeout, Decision defaultDecision) {
        return waiters.submit(() -> coordinator.requestDecision(owner, TestPayloads.deleteFile(path), timeout, defaultDecision));
    }

    /**
     * Polls {@code listPending} until at least {@code count} requests are visible.
     *
     * @param owner owner to list
     * @param count minimum number of pending requests
     * @return the listing that satisfied the condition
     * @throws AssertionError if the requests do not appear within {@link #WAIT_MILLIS}
     */
    protected List<PendingRequestSummary> awaitListed(OwnerId owner, int count) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(WAIT_MILLIS);
        while (System.nanoTime() < deadline) {
            List<PendingRequestSummary> pending = coordinator.listPending(owner);
            if (pending.size() >= count) {
                return pending;
            }
            sleep(5);
        }
        throw new AssertionError("Expected " + count + " pending requests for " + owner + " within " + WAIT_MILLIS + " ms");
    }

    /**
     * Sleeps for the specified duration. Used for polling.
     *
     * @param millis milliseconds to sleep
     */
    protected void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Sleep interrupted", e);
        }
    }
}
