package com.ryuqq.conductor.adapter.inmemory.bus;

import com.ryuqq.conductor.core.spi.EventBus;
import com.ryuqq.conductor.testkit.contract.AbstractEventBusContractTest;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract Test for InMemoryEventBus adapter.
 *
 * <p>Runs every scenario of {@link AbstractEventBusContractTest} against
 * {@link InMemoryEventBus}, plus construction checks specific to this adapter.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 * @see AbstractEventBusContractTest
 */
class InMemoryEventBusContractTest extends AbstractEventBusContractTest {

    @Override
    protected EventBus createBus(int capacity) {
        return new InMemoryEventBus(capacity);
    }

    @Test
    void defaultConstructor_UsesDefaultCapacity() {
        assertThat(new InMemoryEventBus().capacity()).isEqualTo(InMemoryEventBus.DEFAULT_CAPACITY);
    }

    @Test
    void constructor_NonPositiveCapacity_ThrowsException() {
        assertThatThrownBy(() -> new InMemoryEventBus(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("capacity must be positive");
    }
}
