package com.ryuqq.factory.adapter.inmemory.queue;

import com.ryuqq.factory.core.spi.EventQueue;
import com.ryuqq.factory.testkit.contract.AbstractEventQueueContractTest;

/**
 * Contract Tests for {@link InMemoryEventQueue}.
 *
 * @author Factory Team
 * @since 1.0.0
 */
class InMemoryEventQueueContractTest extends AbstractEventQueueContractTest {

    @Override
    protected EventQueue createQueue() {
        return new InMemoryEventQueue();
    }
}
