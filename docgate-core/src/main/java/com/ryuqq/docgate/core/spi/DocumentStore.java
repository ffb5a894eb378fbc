package com.ryuqq.docgate.core.spi;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Backend document store SPI.
 *
 * <p>This interface abstracts the remote or local store that actually holds keyed
 * JSON-like documents. The gateway layer is the only consumer; it converts every
 * failure raised here into a {@link com.ryuqq.docgate.core.result.Failure}.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Single round-trip read, save and delete of documents</li>
 *   <li>Live document feeds delivering every change of one document</li>
 * </ul>
 *
 * <p><strong>Failure Reporting:</strong></p>
 * <ul>
 *   <li>Any method may throw synchronously</li>
 *   <li>Returned futures may complete exceptionally</li>
 *   <li>Business failures may also be encoded in an otherwise successful payload</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called from multiple threads</li>
 *   <li>Feeds: listener callbacks for one subscription must not overlap</li>
 * </ul>
 *
 * @author DocGate Team
 * @since 1.0.0
 */
public interface DocumentStore {

    /**
     * Reads a document.
     *
     * <p>An empty map is a legal payload; gateways may be configured to treat it as
     * "not found".</p>
     *
     * @param collection the collection name
     * @param docId the document id
     * @return future completing with the stored payload
     * @throws IllegalArgumentException if collection or docId is null or blank
     */
    CompletableFuture<Map<String, Object>> read(String collection, String docId);

    /**
     * Creates or replaces a document.
     *
     * <p>The returned acknowledgement is the payload as stored by the backend, which
     * may differ from the input (server-side defaults, generated ids). Implementations
     * that cannot provide it may complete with the input itself.</p>
     *
     * @param collection the collection name
     * @param docId the document id
     * @param document the payload to store
     * @return future completing with the save acknowledgement
     * @throws IllegalArgumentException if any argument is null or collection/docId is blank
     */
    CompletableFuture<Map<String, Object>> save(String collection, String docId, Map<String, Object> document);

    /**
     * Deletes a document.
     *
     * <p>Deleting an absent document is not an error.</p>
     *
     * @param collection the collection name
     * @param docId the document id
     * @return future completing when the delete is acknowledged
     * @throws IllegalArgumentException if collection or docId is null or blank
     */
    CompletableFuture<Void> delete(String collection, String docId);

    /**
     * Opens a live feed for one document.
     *
     * <p>Each call opens a new, independent backend subscription. Callers that want to
     * share one subscription between many watchers must multiplex it themselves
     * (see {@link com.ryuqq.docgate.core.channel.ChannelRegistry}).</p>
     *
     * @param collection the collection name
     * @param docId the document id
     * @param listener receiver of document updates, errors and completion
     * @return handle used to cancel the subscription
     * @throws IllegalArgumentException if any argument is null or collection/docId is blank
     */
    FeedSubscription watch(String collection, String docId, DocumentFeedListener listener);
}
