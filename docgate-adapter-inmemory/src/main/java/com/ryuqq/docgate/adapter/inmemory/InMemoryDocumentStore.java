package com.ryuqq.docgate.adapter.inmemory;

import com.ryuqq.docgate.core.spi.DocumentFeedListener;
import com.ryuqq.docgate.core.spi.DocumentStore;
import com.ryuqq.docgate.core.spi.FeedSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * In-memory implementation of {@link DocumentStore} SPI for testing and reference purposes.
 *
 * <p>Documents are kept per collection in {@link ConcurrentHashMap}s. Every mutation is applied
 * under the store monitor and queues its feed notifications there. Listeners are then invoked
 * outside the monitor by one draining thread at a time, so all feeds of one document observe
 * mutations in the order they were applied and a listener may call back into the store.</p>
 *
 * <p><strong>Behavior:</strong></p>
 * <ul>
 *   <li><strong>read:</strong> fails with {@link NoSuchElementException} if the document does not exist</li>
 *   <li><strong>save:</strong> completes with the stored copy (the acknowledgement)</li>
 *   <li><strong>delete:</strong> deleting an absent document succeeds; feeds receive {@code {}}</li>
 *   <li><strong>watch:</strong> with {@code emitInitial}, the current document (or {@code {}}) is
 *       delivered before {@code watch} returns unless another thread is draining notifications</li>
 *   <li><strong>close:</strong> every feed receives {@code onClosed}; later calls throw
 *       {@link IllegalStateException}</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryDocumentStore store = new InMemoryDocumentStore(
 *     new InMemoryStoreConfig().withLatencyMs(10));
 *
 * store.save("boards", "b1", Map.of("name", "Board")).join();
 * FeedSubscription sub = store.watch("boards", "b1", listener);
 *
 * sub.cancel();
 * store.close();
 * </pre>
 *
 * @author DocGate Team
 * @since 1.0.0
 */
public class InMemoryDocumentStore implements DocumentStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    private final InMemoryStoreConfig config;

    /**
     * Stored documents.
     * Key: collection, Value: (docId → document)
     */
    private final ConcurrentHashMap<String, ConcurrentHashMap<String, Map<String, Object>>> collections;

    /**
     * Live feeds per document.
     */
    private final ConcurrentHashMap<DocKey, List<Feed>> feeds;

    /**
     * Pending listener invocations, guarded by the store monitor.
     */
    private final Queue<Runnable> deliveries = new ArrayDeque<>();

    private boolean draining;
    private volatile boolean closed;

    /**
     * Creates a new store with the default configuration.
     */
    public InMemoryDocumentStore() {
        this(new InMemoryStoreConfig());
    }

    /**
     * Creates a new store.
     *
     * @param config store configuration
     * @throws IllegalArgumentException if config is null
     */
    public InMemoryDocumentStore(InMemoryStoreConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.collections = new ConcurrentHashMap<>();
        this.feeds = new ConcurrentHashMap<>();
    }

    @Override
    public CompletableFuture<Map<String, Object>> read(String collection, String docId) {
        validate(collection, docId);
        ensureOpen();

        return delayed(() -> {
            Map<String, Object> document = documents(collection).get(docId);
            if (document == null) {
                throw new NoSuchElementException("Document not found: " + collection + "/" + docId);
            }
            return copyOut(document);
        });
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Replaces the whole document (no merge)</li>
     *   <li>Queues feed notifications for the document before the returned future completes</li>
     *   <li>With {@code throwOnSave}, completes exceptionally with {@link IllegalStateException}</li>
     * </ul>
     */
    @Override
    public CompletableFuture<Map<String, Object>> save(String collection, String docId, Map<String, Object> document) {
        validate(collection, docId);
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        ensureOpen();

        if (config.throwOnSave()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Simulated save error"));
        }

        return delayed(() -> {
            Map<String, Object> stored = config.deepCopies() ? deepCopy(document) : document;
            synchronized (this) {
                documents(collection).put(docId, stored);
                notifyFeeds(new DocKey(collection, docId), stored);
            }
            drainDeliveries();
            log.debug("Saved {}/{}", collection, docId);
            return copyOut(stored);
        });
    }

    @Override
    public CompletableFuture<Void> delete(String collection, String docId) {
        validate(collection, docId);
        ensureOpen();

        if (config.throwOnDelete()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Simulated delete error"));
        }

        return delayed(() -> {
            synchronized (this) {
                Map<String, Object> removed = documents(collection).remove(docId);
                if (removed != null) {
                    notifyFeeds(new DocKey(collection, docId), Map.of());
                }
            }
            drainDeliveries();
            log.debug("Deleted {}/{}", collection, docId);
            return null;
        });
    }

    @Override
    public FeedSubscription watch(String collection, String docId, DocumentFeedListener listener) {
        validate(collection, docId);
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        ensureOpen();

        DocKey key = new DocKey(collection, docId);
        Feed feed = new Feed(key, listener);
        synchronized (this) {
            feeds.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(feed);
            if (config.emitInitial()) {
                Map<String, Object> current = documents(collection).get(docId);
                Map<String, Object> initial = current == null ? Map.of() : current;
                deliveries.add(() -> feed.emit(initial));
            }
        }
        drainDeliveries();
        log.debug("Feed opened for {}/{}", collection, docId);
        return feed::cancel;
    }

    /**
     * Completes every feed and rejects later calls. Calling it again has no effect.
     */
    @Override
    public void close() {
        int completed = 0;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            for (List<Feed> list : feeds.values()) {
                for (Feed feed : list) {
                    deliveries.add(feed::complete);
                    completed++;
                }
            }
            feeds.clear();
            collections.clear();
        }
        drainDeliveries();
        log.info("InMemoryDocumentStore closed: {} feeds completed", completed);
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Returns whether a document exists.
     *
     * @param collection the collection name
     * @param docId the document id
     * @return true if stored
     */
    public boolean contains(String collection, String docId) {
        ConcurrentHashMap<String, Map<String, Object>> docs = collections.get(collection);
        return docs != null && docs.containsKey(docId);
    }

    /**
     * Returns the number of live feeds for one document.
     *
     * @param collection the collection name
     * @param docId the document id
     * @return live feed count
     */
    public int feedCount(String collection, String docId) {
        List<Feed> list = feeds.get(new DocKey(collection, docId));
        return list == null ? 0 : list.size();
    }

    /**
     * Removes all documents. Live feeds stay open and are not notified.
     */
    public void clear() {
        collections.clear();
    }

    private ConcurrentHashMap<String, Map<String, Object>> documents(String collection) {
        return collections.computeIfAbsent(collection, c -> new ConcurrentHashMap<>());
    }

    /**
     * Queues one notification per live feed. Called under the store monitor.
     */
    private void notifyFeeds(DocKey key, Map<String, Object> value) {
        List<Feed> list = feeds.get(key);
        if (list == null) {
            return;
        }
        for (Feed feed : list) {
            deliveries.add(() -> feed.emit(value));
        }
    }

    /**
     * Runs queued notifications outside the store monitor. Returns immediately when another
     * thread is already draining, since that thread delivers the new notifications in order.
     */
    private void drainDeliveries() {
        synchronized (this) {
            if (draining) {
                return;
            }
            draining = true;
        }
        boolean drained = false;
        try {
            while (true) {
                Runnable next;
                synchronized (this) {
                    next = deliveries.poll();
                    if (next == null) {
                        draining = false;
                        drained = true;
                        return;
                    }
                }
                next.run();
            }
        } finally {
            if (!drained) {
                synchronized (this) {
                    draining = false;
                }
            }
        }
    }

    private void removeFeed(Feed feed) {
        feeds.computeIfPresent(feed.key, (k, list) -> {
            list.remove(feed);
            return list.isEmpty() ? null : list;
        });
    }

    private <T> CompletableFuture<T> delayed(Supplier<T> operation) {
        if (config.latencyMs() == 0) {
            try {
                return CompletableFuture.completedFuture(operation.get());
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        return CompletableFuture.supplyAsync(
            operation,
            CompletableFuture.delayedExecutor(config.latencyMs(), TimeUnit.MILLISECONDS)
        );
    }

    private Map<String, Object> copyOut(Map<String, Object> document) {
        return config.deepCopies() ? deepCopy(document) : document;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("InMemoryDocumentStore has been closed");
        }
    }

    private static void validate(String collection, String docId) {
        if (collection == null || collection.isBlank()) {
            throw new IllegalArgumentException("collection cannot be null or blank");
        }
        if (docId == null || docId.isBlank()) {
            throw new IllegalArgumentException("docId cannot be null or blank");
        }
    }

    static Map<String, Object> deepCopy(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(k, deepCopyValue(v)));
        return copy;
    }

    private static Object deepCopyValue(Object value) {
        if (value instanceof Map<?, ?>) {
            Map<String, Object> copy = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> copy.put(String.valueOf(k), deepCopyValue(v)));
            return copy;
        }
        if (value instanceof List<?>) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<?>) value) {
                copy.add(deepCopyValue(item));
            }
            return copy;
        }
        return value;
    }

    private record DocKey(String collection, String docId) {
    }

    /**
     * One live feed. Emissions run on the draining thread, one at a time.
     */
    private final class Feed {

        private final DocKey key;
        private final DocumentFeedListener listener;
        private Map<String, Object> last;
        private volatile boolean cancelled;

        Feed(DocKey key, DocumentFeedListener listener) {
            this.key = key;
            this.listener = listener;
        }

        void emit(Map<String, Object> value) {
            if (cancelled) {
                return;
            }
            Map<String, Object> out = config.deepCopies() ? deepCopy(value) : value;
            if (config.dedupeByContent()) {
                if (last != null && last.equals(out)) {
                    return;
                }
                last = deepCopy(out);
            }
            try {
                listener.onDocument(out);
            } catch (RuntimeException e) {
                log.warn("Feed listener failed for {}/{}", key.collection(), key.docId(), e);
            }
        }

        void complete() {
            if (cancelled) {
                return;
            }
            cancelled = true;
            try {
                listener.onClosed();
            } catch (RuntimeException e) {
                log.warn("Feed listener failed on close for {}/{}", key.collection(), key.docId(), e);
            }
        }

        void cancel() {
            cancelled = true;
            removeFeed(this);
        }
    }
}
