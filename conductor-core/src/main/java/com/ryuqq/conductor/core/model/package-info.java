/**
 * Core value types shared by every module.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.model.OperationId} - Operation unique identifier</li>
 *   <li>{@link com.ryuqq.conductor.core.model.OperationKind} - Closed set of operation kinds (single-flight key)</li>
 *   <li>{@link com.ryuqq.conductor.core.model.OperationParams} - Immutable input snapshot taken at start time</li>
 *   <li>{@link com.ryuqq.conductor.core.model.RunningOperation} - (kind, id) pair reported by listRunning</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable (final fields, copied collections)</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Conductor Team
 */
package com.ryuqq.conductor.core.model;
