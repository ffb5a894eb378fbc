package com.ryuqq.docgate.adapter.inmemory;

import com.ryuqq.docgate.core.spi.DocumentStore;
import com.ryuqq.docgate.testkit.AbstractDocumentStoreContractTest;

/**
 * Contract Tests for InMemoryDocumentStore with simulated latency
 * (futures complete on another thread).
 *
 * @author DocGate Team
 * @since 1.0.0
 */
class DelayedInMemoryDocumentStoreContractTest extends AbstractDocumentStoreContractTest {

    @Override
    protected DocumentStore createStore() {
        return new InMemoryDocumentStore(
            new InMemoryStoreConfig().withLatencyMs(5).withDedupeByContent(true)
        );
    }
}
