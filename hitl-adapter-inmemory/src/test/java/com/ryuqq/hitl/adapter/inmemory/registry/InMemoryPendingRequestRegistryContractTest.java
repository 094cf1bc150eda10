package com.ryuqq.hitl.adapter.inmemory.registry;

import com.ryuqq.hitl.core.model.OwnerId;
import com.ryuqq.hitl.core.model.PendingRequest;
import com.ryuqq.hitl.core.spi.PendingRequestRegistry;
import com.ryuqq.hitl.testkit.contract.AbstractPendingRequestRegistryContractTest;
import com.ryuqq.hitl.testkit.contract.TestPayloads;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Tests for {@link InMemoryPendingRequestRegistry}.
 *
 * <p>Runs the full registry contract from {@code hitl-testkit} plus the
 * in-memory specific helpers ({@code ownerCount}, {@code clear}).</p>
 *
 * @author HITL Team
 * @since 1.0.0
 */
class InMemoryPendingRequestRegistryContractTest extends AbstractPendingRequestRegistryContractTest {

    @Override
    protected PendingRequestRegistry createRegistry() {
        return new InMemoryPendingRequestRegistry();
    }

    @Test
    void testOwnerCount_TracksNonEmptyBuckets() {
        // Given
        InMemoryPendingRequestRegistry inMemory = (InMemoryPendingRequestRegistry) registry;
        PendingRequest aliceRequest = newRequest(ALICE, "a");
        PendingRequest bobRequest = newRequest(BOB, "b");

        // When
        inMemory.insert(aliceRequest);
        inMemory.insert(bobRequest);

        // Then
        assertEquals(2, inMemory.ownerCount());

        // When
        inMemory.remove(ALICE, aliceRequest.id());

        // Then
        assertEquals(1, inMemory.ownerCount());
    }

    @Test
    void testClear_RemovesEverything() {
        // Given
        InMemoryPendingRequestRegistry inMemory = (InMemoryPendingRequestRegistry) registry;
        PendingRequest request = newRequest(ALICE, "a");
        inMemory.insert(request);

        // When
        inMemory.clear();

        // Then
        assertEquals(0, inMemory.size());
        assertEquals(0, inMemory.ownerCount());
        assertTrue(inMemory.find(request.id()).isEmpty());
    }

    @Test
    void testScanCreatedBefore_ConcurrentWithInsertAndRemove_ReturnsConsistentSnapshots() throws InterruptedException {
        // Given: a stable stale request plus writers churning fresh and stale requests
        Instant cutoff = BASE_TIME.plusSeconds(60);
        PendingRequest anchor = PendingRequest.create(ALICE, TestPayloads.named("anchor"), BASE_TIME.minusSeconds(1));
        registry.insert(anchor);

        int writerCount = 4;
        ExecutorService executorService = Executors.newFixedThreadPool(writerCount + 1);
        CountDownLatch doneLatch = new CountDownLatch(writerCount);
        AtomicBoolean writing = new AtomicBoolean(true);
        List<Throwable> failures = new CopyOnWriteArrayList<>();

        // When
        for (int w = 0; w < writerCount; w++) {
            OwnerId owner = OwnerId.of("writer-" + w);
            executorService.submit(() -> {
                try {
                    for (int i = 0; i < 500; i++) {
                        Instant createdAt = i % 2 == 0 ? BASE_TIME.plusSeconds(i % 50) : BASE_TIME.plusSeconds(3600);
                        PendingRequest request = PendingRequest.create(owner, TestPayloads.named("op-" + i), createdAt);
                        registry.insert(request);
                        registry.remove(owner, request.id());
                    }
                } catch (Throwable e) {
                    failures.add(e);
                } finally {
                    doneLatch.countDown();
                }
            });
        }
        executorService.submit(() -> {
            try {
                while (writing.get()) {
                    List<PendingRequest> stale = registry.scanCreatedBefore(cutoff, 1000);
                    assertEquals(anchor.id(), stale.get(0).id(), "Oldest request must come first");
                    for (int i = 0; i < stale.size(); i++) {
                        assertTrue(stale.get(i).createdAt().isBefore(cutoff));
                        if (i > 0) {
                            assertFalse(stale.get(i).createdAt().isBefore(stale.get(i - 1).createdAt()));
                        }
                    }
                }
            } catch (Throwable e) {
                failures.add(e);
            }
        });

        // Then
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS), "Writers did not finish");
        writing.set(false);
        executorService.shutdown();
        assertTrue(executorService.awaitTermination(10, TimeUnit.SECONDS));
        assertTrue(failures.isEmpty(), "Failures: " + failures);
        assertEquals(List.of(anchor), registry.scanCreatedBefore(cutoff, 10));
    }
}
