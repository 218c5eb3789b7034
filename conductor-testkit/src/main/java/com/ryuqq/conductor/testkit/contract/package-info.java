/**
 * Abstract SPI contract tests.
 *
 * <p>Adapter modules extend these classes from their own test sources to prove that an
 * implementation honors the SPI guarantees:</p>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.testkit.contract.AbstractEventBusContractTest}</li>
 *   <li>{@link com.ryuqq.conductor.testkit.contract.AbstractOperationRegistryContractTest}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Conductor Team
 */
package com.ryuqq.conductor.testkit.contract;
