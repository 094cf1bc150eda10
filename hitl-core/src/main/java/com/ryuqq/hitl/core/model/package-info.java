/**
 * Core domain model package containing value objects and the pending request entity.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.hitl.core.model.RequestId} - Pending request identifier (128-bit random)</li>
 *   <li>{@link com.ryuqq.hitl.core.model.OwnerId} - Tenant/user key scoping visibility</li>
 *   <li>{@link com.ryuqq.hitl.core.model.ApprovalPayload} - What is being approved (tool name, description, arguments)</li>
 *   <li>{@link com.ryuqq.hitl.core.model.Decision} - Approve or reject</li>
 * </ul>
 *
 * <h2>Entities</h2>
 * <ul>
 *   <li>{@link com.ryuqq.hitl.core.model.PendingRequest} - One outstanding request and its wait handle</li>
 *   <li>{@link com.ryuqq.hitl.core.model.PendingRequestSummary} - Read-only listing view</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable (final fields)</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author HITL Team
 */
package com.ryuqq.hitl.core.model;
