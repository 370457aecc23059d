package com.ryuqq.stepflow.adapter.inmemory.store;

import com.ryuqq.stepflow.core.spi.RunStore;
import com.ryuqq.stepflow.testkit.contract.RunStoreContractTest;

/**
 * Contract Tests for {@link InMemoryRunStore}.
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
class InMemoryRunStoreContractTest extends RunStoreContractTest {

    @Override
    protected RunStore createStore() {
        return new InMemoryRunStore();
    }
}
