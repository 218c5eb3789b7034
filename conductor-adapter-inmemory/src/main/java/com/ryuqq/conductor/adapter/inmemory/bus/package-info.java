/**
 * In-memory event bus implementation.
 *
 * <p>This package provides {@link com.ryuqq.conductor.adapter.inmemory.bus.InMemoryEventBus},
 * a bounded, drop-oldest broadcast channel for delivering operation events to UI subscribers.</p>
 *
 * <p><strong>Key Features:</strong></p>
 * <ul>
 *   <li>Per-subscriber bounded buffers</li>
 *   <li>Drop-oldest overflow with {@link com.ryuqq.conductor.core.event.Lagged} markers</li>
 *   <li>Non-blocking publish and receive</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Conductor Team
 */
package com.ryuqq.conductor.adapter.inmemory.bus;
