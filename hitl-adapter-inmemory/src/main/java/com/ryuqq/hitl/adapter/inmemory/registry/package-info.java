/**
 * In-memory registry adapter implementation package.
 *
 * <p>This package provides the single-process implementation of the
 * {@link com.ryuqq.hitl.core.spi.PendingRequestRegistry} SPI.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.hitl.adapter.inmemory.registry.InMemoryPendingRequestRegistry}:
 *       Thread-safe owner → pending requests registry guarded by a single monitor</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * PendingRequestRegistry registry = new InMemoryPendingRequestRegistry();
 * ApprovalCoordinator coordinator = new BlockingApprovalCoordinator(registry, new ApprovalConfig());
 * </pre>
 *
 * @see com.ryuqq.hitl.core.spi.PendingRequestRegistry
 * @author HITL Team
 * @since 1.0.0
 */
package com.ryuqq.hitl.adapter.inmemory.registry;
