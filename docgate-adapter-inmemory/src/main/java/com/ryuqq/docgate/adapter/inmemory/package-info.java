/**
 * In-memory implementation of the DocumentStore SPI.
 *
 * <p>Reference backend for tests and local development. Supports simulated latency,
 * forced save/delete failures, initial feed emission, deep copies and content-based
 * deduplication of feed events, all driven by
 * {@link com.ryuqq.docgate.adapter.inmemory.InMemoryStoreConfig}.</p>
 *
 * @author DocGate Team
 * @since 1.0.0
 */
package com.ryuqq.docgate.adapter.inmemory;
