/**
 * Event types carried by the event bus.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.event.OperationEvent} - (operationId, kind, payload, timestamp)</li>
 *   <li>{@link com.ryuqq.conductor.core.event.EventPayload} - Progress | Completed | Failed | Cancelled</li>
 *   <li>{@link com.ryuqq.conductor.core.event.Lagged} - overflow marker for slow subscribers</li>
 *   <li>{@link com.ryuqq.conductor.core.event.BusMessage} - what a subscriber receives from tryNext()</li>
 * </ul>
 *
 * <h2>Ordering</h2>
 * <p>Events of one operation reach each subscriber in publication order. No order is
 * defined across operations.</p>
 *
 * @since 1.0.0
 * @author Conductor Team
 */
package com.ryuqq.conductor.core.event;
