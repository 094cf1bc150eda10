package com.ryuqq.hitl.adapter.inmemory.registry;

import com.ryuqq.hitl.core.exception.DuplicateRequestIdException;
import com.ryuqq.hitl.core.model.OwnerId;
import com.ryuqq.hitl.core.model.PendingRequest;
import com.ryuqq.hitl.core.model.RequestId;
import com.ryuqq.hitl.core.spi.PendingRequestRegistry;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link PendingRequestRegistry} SPI.
 *
 * <p>Single-process registry backing the approval handshake.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>buckets:</strong> HashMap&lt;OwnerId, LinkedHashMap&lt;RequestId, PendingRequest&gt;&gt; - per-owner collections in insertion order</li>
 *   <li><strong>requestsById:</strong> ConcurrentHashMap&lt;RequestId, PendingRequest&gt; - global id index for uniqueness checks,
 *       O(1) find and lock-free scans</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>One monitor ({@code lock}) serializes every mutation of both maps, so the id index and the buckets never disagree</li>
 *   <li>{@code scanCreatedBefore} iterates the concurrent id index without the lock (weakly consistent)</li>
 *   <li>Critical sections contain map operations only; callers never block while holding it</li>
 *   <li>Reads copy out of the maps before returning</li>
 * </ul>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>insert / remove / find:</strong> O(1)</li>
 *   <li><strong>list:</strong> O(K) copy of one owner's K requests</li>
 *   <li><strong>scanCreatedBefore:</strong> O(N) outside the lock</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not shared across processes</li>
 * </ul>
 *
 * @author HITL Team
 * @since 1.0.0
 */
public class InMemoryPendingRequestRegistry implements PendingRequestRegistry {

    private final Object lock = new Object();

    /**
     * Owner buckets. An owner key exists only while its bucket is non-empty.
     */
    private final Map<OwnerId, LinkedHashMap<RequestId, PendingRequest>> buckets = new HashMap<>();

    /**
     * Global id index. Key: RequestId, Value: the request (carrying its owner).
     * Written only under {@code lock}; read without it by scans.
     */
    private final Map<RequestId, PendingRequest> requestsById = new ConcurrentHashMap<>();

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Uniqueness checked against the global index, not just the owner's bucket</li>
     *   <li>On duplicate nothing is modified</li>
     * </ul>
     */
    @Override
    public void insert(PendingRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }

        synchronized (lock) {
            if (requestsById.containsKey(request.id())) {
                throw new DuplicateRequestIdException(request.id());
            }
            requestsById.put(request.id(), request);
            buckets.computeIfAbsent(request.owner(), owner -> new LinkedHashMap<>())
                .put(request.id(), request);
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>The id index is consulted first, so a mismatched owner cannot remove another owner's entry</li>
     *   <li>Empty bucket is dropped in the same critical section</li>
     * </ul>
     */
    @Override
    public boolean remove(OwnerId owner, RequestId id) {
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }

        synchronized (lock) {
            PendingRequest existing = requestsById.get(id);
            if (existing == null || !owner.equals(existing.owner())) {
                return false;
            }
            requestsById.remove(id);

            LinkedHashMap<RequestId, PendingRequest> bucket = buckets.get(owner);
            if (bucket == null) {
                return false;
            }
            bucket.remove(id);
            if (bucket.isEmpty()) {
                buckets.remove(owner);
            }
            return true;
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public List<PendingRequest> list(OwnerId owner) {
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }

        synchronized (lock) {
            LinkedHashMap<RequestId, PendingRequest> bucket = buckets.get(owner);
            if (bucket == null) {
                return List.of();
            }
            return List.copyOf(bucket.values());
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<PendingRequest> find(RequestId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }

        synchronized (lock) {
            return Optional.ofNullable(requestsById.get(id));
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public List<PendingRequest> scanCreatedBefore(Instant cutoff, int limit) {
        if (cutoff == null) {
            throw new IllegalArgumentException("cutoff cannot be null");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, but was: " + limit);
        }

        return requestsById.values().stream()
            .filter(request -> request.createdAt().isBefore(cutoff))
            .sorted(Comparator.comparing(PendingRequest::createdAt)
                .thenComparing(request -> request.id().getValue()))
            .limit(limit)
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean hasOwner(OwnerId owner) {
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }

        synchronized (lock) {
            return buckets.containsKey(owner);
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public int size() {
        synchronized (lock) {
            return requestsById.size();
        }
    }

    /**
     * Returns the number of owners that currently have a bucket.
     *
     * <p>This method is used for test assertions.</p>
     *
     * @return owner bucket count
     */
    public int ownerCount() {
        synchronized (lock) {
            return buckets.size();
        }
    }

    /**
     * Clears all stored data.
     *
     * <p>This method is used for test cleanup. Waiters still blocked on cleared requests
     * are not signalled and will end through their own timeout.</p>
     */
    public void clear() {
        synchronized (lock) {
            buckets.clear();
            requestsById.clear();
        }
    }
}
