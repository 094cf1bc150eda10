package com.ryuqq.hitl.core.spi;

import com.ryuqq.hitl.core.exception.DuplicateRequestIdException;
import com.ryuqq.hitl.core.model.OwnerId;
import com.ryuqq.hitl.core.model.PendingRequest;
import com.ryuqq.hitl.core.model.RequestId;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Pending request registry SPI.
 *
 * <p>Owns the mapping from owner to that owner's outstanding requests.
 * The coordinator is the only writer; presentation collaborators read through snapshots.</p>
 *
 * <p><strong>Invariants:</strong></p>
 * <ul>
 *   <li>A given {@link RequestId} appears in at most one owner's collection, at most once</li>
 *   <li>Each owner's collection keeps insertion order</li>
 *   <li>An owner whose collection becomes empty is dropped (no sentinel keys)</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: insert, remove and find are serialized through one mutual-exclusion domain</li>
 *   <li>Lock hold time bounded by map operations; never held across a blocking wait</li>
 *   <li>Read methods return snapshot copies, never live views of internal state</li>
 * </ul>
 *
 * <p>The bundled implementation is single-process and in-memory
 * ({@code hitl-adapter-inmemory}). Durable or distributed backings plug in here.</p>
 *
 * @author HITL Team
 * @since 1.0.0
 */
public interface PendingRequestRegistry {

    /**
     * Adds the request to its owner's collection, creating the collection if needed.
     *
     * @param request the request to register (its wait handle is already armed)
     * @throws IllegalArgumentException if request is null
     * @throws DuplicateRequestIdException if the id is already registered under any owner
     */
    void insert(PendingRequest request);

    /**
     * Removes the request from the owner's collection.
     *
     * <p>Idempotent: removing an absent id (or an id registered under another owner) is a no-op.
     * Drops the owner's collection when it becomes empty.</p>
     *
     * @param owner the owner the request was registered under
     * @param id the request id
     * @return true if an entry was removed
     * @throws IllegalArgumentException if owner or id is null
     */
    boolean remove(OwnerId owner, RequestId id);

    /**
     * Returns an immutable snapshot of the owner's requests in insertion order.
     *
     * @param owner the owner
     * @return snapshot list, empty if the owner has no requests
     * @throws IllegalArgumentException if owner is null
     */
    List<PendingRequest> list(OwnerId owner);

    /**
     * Looks up a request by id across all owners.
     *
     * @param id the request id
     * @return the request (carrying its owner), or empty if not registered
     * @throws IllegalArgumentException if id is null
     */
    Optional<PendingRequest> find(RequestId id);

    /**
     * Returns requests created strictly before the cutoff, oldest first.
     *
     * <p>Used for staleness diagnostics. Never mutates the registry.</p>
     *
     * @param cutoff creation time threshold
     * @param limit maximum number of results (positive)
     * @return snapshot list ordered by createdAt ascending
     * @throws IllegalArgumentException if cutoff is null or limit is not positive
     */
    List<PendingRequest> scanCreatedBefore(Instant cutoff, int limit);

    /**
     * Checks whether the owner currently has a collection.
     *
     * @param owner the owner
     * @return true if the owner has at least one registered request
     */
    boolean hasOwner(OwnerId owner);

    /**
     * Returns the number of registered requests across all owners.
     *
     * @return registered request count
     */
    int size();
}
