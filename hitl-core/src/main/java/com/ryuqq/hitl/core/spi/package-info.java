/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that must be implemented by infrastructure adapters
 * or presentation collaborators.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.hitl.core.spi.PendingRequestRegistry} - Owner → pending requests storage</li>
 *   <li>{@link com.ryuqq.hitl.core.spi.PendingRequestListener} - New/closed request notifications</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Pluggability:</strong> In-memory registry for single-process use; durable backings are an extension</li>
 * </ul>
 *
 * @since 1.0.0
 * @author HITL Team
 */
package com.ryuqq.hitl.core.spi;
