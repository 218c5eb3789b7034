/**
 * In-memory operation registry implementation.
 *
 * <p>This package provides {@link com.ryuqq.conductor.adapter.inmemory.registry.InMemoryOperationRegistry},
 * the process-local status map with the per-kind single-flight guard.</p>
 *
 * <p><strong>Key Features:</strong></p>
 * <ul>
 *   <li>Atomic check-and-insert registration</li>
 *   <li>Lock-free status reads for the render loop</li>
 *   <li>Monotonic terminal statuses</li>
 *   <li>Bounded age sweep of finished operations</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Conductor Team
 */
package com.ryuqq.conductor.adapter.inmemory.registry;
