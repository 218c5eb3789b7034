/**
 * Service Provider Interfaces (SPI) for Conductor.
 *
 * <p>This package defines the seams between the orchestration logic and its storage and
 * messaging backends:</p>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.spi.EventBus} - bounded broadcast of operation events</li>
 *   <li>{@link com.ryuqq.conductor.core.spi.EventPublisher} - publish-only view handed to workers</li>
 *   <li>{@link com.ryuqq.conductor.core.spi.EventReceiver} - non-blocking receive end of one subscription</li>
 *   <li>{@link com.ryuqq.conductor.core.spi.OperationRegistry} - status map with the single-flight guard</li>
 * </ul>
 *
 * <p>The in-memory implementations live in {@code conductor-adapter-inmemory}; the abstract
 * contract tests in {@code conductor-testkit} pin down the behavior any implementation must
 * provide.</p>
 *
 * @since 1.0.0
 * @author Conductor Team
 */
package com.ryuqq.conductor.core.spi;
