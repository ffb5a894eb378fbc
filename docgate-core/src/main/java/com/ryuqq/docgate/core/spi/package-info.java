/**
 * Service Provider Interfaces for the backend document store.
 *
 * <p>This package defines the contract that backend adapters must implement
 * to be driven by the gateway.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.docgate.core.spi.DocumentStore} - read, save, delete and live feeds</li>
 *   <li>{@link com.ryuqq.docgate.core.spi.DocumentFeedListener} - receiver of feed updates</li>
 *   <li>{@link com.ryuqq.docgate.core.spi.FeedSubscription} - cancellation handle</li>
 * </ul>
 *
 * <h2>Implementation Guidelines</h2>
 * <ul>
 *   <li><strong>Thread Safety:</strong> All implementations must be thread-safe</li>
 *   <li><strong>Failures:</strong> Raise them freely; the gateway maps them to structured errors</li>
 *   <li><strong>Feeds:</strong> One call to watch means one backend subscription</li>
 * </ul>
 *
 * @since 1.0.0
 * @author DocGate Team
 */
package com.ryuqq.docgate.core.spi;
