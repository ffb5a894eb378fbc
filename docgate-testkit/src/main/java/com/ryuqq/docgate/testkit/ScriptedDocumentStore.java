package com.ryuqq.docgate.testkit;

import com.ryuqq.docgate.core.spi.DocumentFeedListener;
import com.ryuqq.docgate.core.spi.DocumentStore;
import com.ryuqq.docgate.core.spi.FeedSubscription;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.ToLongFunction;

/**
 * 테스트에서 동작을 직접 제어하는 {@link DocumentStore} fake.
 *
 * <p>실제 저장소와 달리 save가 feed 이벤트를 만들지 않습니다.
 * feed 이벤트는 {@link #emit}, {@link #emitError}, {@link #complete}로 직접 발생시킵니다.</p>
 *
 * <p><strong>제어 항목:</strong></p>
 * <ul>
 *   <li>read 응답: {@link #givenDocument} (없으면 빈 payload {@code {}})</li>
 *   <li>비동기 실패: {@link #failReadsWith}, {@link #failSavesWith}, {@link #failDeletesWith}</li>
 *   <li>동기 예외: {@link #throwOnCall}</li>
 *   <li>save 응답: {@link #acknowledgeSavesWith} (기본: 입력 복사본)</li>
 *   <li>save 지연: {@link #delaySaves} (payload별 지연 시간)</li>
 * </ul>
 *
 * <p><strong>기록 항목:</strong> 구독/취소 횟수, 호출 횟수, 완료 순서대로의 save 기록.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ScriptedDocumentStore store = new ScriptedDocumentStore();
 * store.givenDocument("doc1", Map.of("v", 1));
 *
 * // gateway.watch("doc1") ...
 * store.emit("doc1", Map.of("v", 2));
 * store.complete("doc1");
 *
 * assertThat(store.subscribeCount("doc1")).isEqualTo(1);
 * </pre>
 *
 * @author DocGate Team
 * @since 1.0.0
 */
public class ScriptedDocumentStore implements DocumentStore {

    private final Map<String, Map<String, Object>> documents = new ConcurrentHashMap<>();
    private final Map<String, List<ScriptedFeed>> feeds = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> subscribeCounts = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> cancelCounts = new ConcurrentHashMap<>();
    private final List<Map<String, Object>> savedInOrder = new CopyOnWriteArrayList<>();

    private final AtomicInteger readCount = new AtomicInteger();
    private final AtomicInteger saveCount = new AtomicInteger();
    private final AtomicInteger deleteCount = new AtomicInteger();

    private volatile Throwable readFailure;
    private volatile Throwable saveFailure;
    private volatile Throwable deleteFailure;
    private volatile RuntimeException callFailure;
    private volatile Function<Map<String, Object>, Map<String, Object>> acknowledgement = LinkedHashMap::new;
    private volatile ToLongFunction<Map<String, Object>> saveDelayMs = payload -> 0L;
    private volatile String lastCollection;

    // ---------------------------------------------------------------- scripting

    /**
     * read가 반환할 payload 지정.
     *
     * @param docId 문서 ID
     * @param payload 반환할 payload
     * @return this
     */
    public ScriptedDocumentStore givenDocument(String docId, Map<String, Object> payload) {
        documents.put(docId, payload);
        return this;
    }

    public ScriptedDocumentStore failReadsWith(Throwable error) {
        this.readFailure = error;
        return this;
    }

    public ScriptedDocumentStore failSavesWith(Throwable error) {
        this.saveFailure = error;
        return this;
    }

    public ScriptedDocumentStore failDeletesWith(Throwable error) {
        this.deleteFailure = error;
        return this;
    }

    /**
     * 모든 호출(read/save/delete/watch)이 future를 반환하기 전에 동기적으로 예외를 던지도록 설정.
     *
     * @param error 던질 예외 (null이면 해제)
     * @return this
     */
    public ScriptedDocumentStore throwOnCall(RuntimeException error) {
        this.callFailure = error;
        return this;
    }

    /**
     * save 응답 생성 함수 지정. null을 반환하는 함수도 허용합니다.
     *
     * @param acknowledgement 입력 payload → 응답
     * @return this
     */
    public ScriptedDocumentStore acknowledgeSavesWith(Function<Map<String, Object>, Map<String, Object>> acknowledgement) {
        this.acknowledgement = acknowledgement;
        return this;
    }

    /**
     * save 완료 지연 시간 지정.
     *
     * @param saveDelayMs payload → 지연(ms)
     * @return this
     */
    public ScriptedDocumentStore delaySaves(ToLongFunction<Map<String, Object>> saveDelayMs) {
        this.saveDelayMs = saveDelayMs;
        return this;
    }

    // ---------------------------------------------------------------- feed control

    /**
     * 문서의 모든 활성 feed에 payload 전달.
     *
     * @param docId 문서 ID
     * @param payload 전달할 payload
     */
    public void emit(String docId, Map<String, Object> payload) {
        for (ScriptedFeed feed : activeFeeds(docId)) {
            feed.listener.onDocument(payload);
        }
    }

    public void emitError(String docId, Throwable error) {
        for (ScriptedFeed feed : activeFeeds(docId)) {
            feed.listener.onError(error);
        }
    }

    /**
     * 문서의 모든 활성 feed 종료 (listener는 onClosed를 받음).
     *
     * @param docId 문서 ID
     */
    public void complete(String docId) {
        for (ScriptedFeed feed : activeFeeds(docId)) {
            feed.cancelled = true;
            feed.listener.onClosed();
        }
    }

    // ---------------------------------------------------------------- DocumentStore

    @Override
    public CompletableFuture<Map<String, Object>> read(String collection, String docId) {
        before(collection);
        readCount.incrementAndGet();
        if (readFailure != null) {
            return CompletableFuture.failedFuture(readFailure);
        }
        Map<String, Object> document = documents.get(docId);
        return CompletableFuture.completedFuture(document == null ? Map.of() : document);
    }

    @Override
    public CompletableFuture<Map<String, Object>> save(String collection, String docId, Map<String, Object> document) {
        before(collection);
        saveCount.incrementAndGet();
        if (saveFailure != null) {
            return CompletableFuture.failedFuture(saveFailure);
        }

        long delay = saveDelayMs.applyAsLong(document);
        if (delay <= 0) {
            return CompletableFuture.completedFuture(store(docId, document));
        }
        return CompletableFuture.supplyAsync(
            () -> store(docId, document),
            CompletableFuture.delayedExecutor(delay, TimeUnit.MILLISECONDS)
        );
    }

    @Override
    public CompletableFuture<Void> delete(String collection, String docId) {
        before(collection);
        deleteCount.incrementAndGet();
        if (deleteFailure != null) {
            return CompletableFuture.failedFuture(deleteFailure);
        }
        documents.remove(docId);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public FeedSubscription watch(String collection, String docId, DocumentFeedListener listener) {
        before(collection);
        subscribeCounts.computeIfAbsent(docId, k -> new AtomicInteger()).incrementAndGet();
        ScriptedFeed feed = new ScriptedFeed(listener);
        feeds.computeIfAbsent(docId, k -> new CopyOnWriteArrayList<>()).add(feed);
        return () -> {
            cancelCounts.computeIfAbsent(docId, k -> new AtomicInteger()).incrementAndGet();
            feed.cancelled = true;
        };
    }

    // ---------------------------------------------------------------- inspection

    public int subscribeCount(String docId) {
        AtomicInteger count = subscribeCounts.get(docId);
        return count == null ? 0 : count.get();
    }

    public int cancelCount(String docId) {
        AtomicInteger count = cancelCounts.get(docId);
        return count == null ? 0 : count.get();
    }

    public int activeFeedCount(String docId) {
        return activeFeeds(docId).size();
    }

    public int readCount() {
        return readCount.get();
    }

    public int saveCount() {
        return saveCount.get();
    }

    public int deleteCount() {
        return deleteCount.get();
    }

    /**
     * 완료된 순서대로의 save payload 목록.
     *
     * @return save 기록 (스냅샷)
     */
    public List<Map<String, Object>> savedInOrder() {
        return new ArrayList<>(savedInOrder);
    }

    public Map<String, Object> storedDocument(String docId) {
        return documents.get(docId);
    }

    public String lastCollection() {
        return lastCollection;
    }

    private Map<String, Object> store(String docId, Map<String, Object> document) {
        documents.put(docId, document);
        savedInOrder.add(document);
        return acknowledgement.apply(document);
    }

    private void before(String collection) {
        lastCollection = collection;
        RuntimeException failure = callFailure;
        if (failure != null) {
            throw failure;
        }
    }

    private List<ScriptedFeed> activeFeeds(String docId) {
        List<ScriptedFeed> list = feeds.get(docId);
        List<ScriptedFeed> active = new ArrayList<>();
        if (list != null) {
            for (ScriptedFeed feed : list) {
                if (!feed.cancelled) {
                    active.add(feed);
                }
            }
        }
        return active;
    }

    private static final class ScriptedFeed {

        private final DocumentFeedListener listener;
        private volatile boolean cancelled;

        ScriptedFeed(DocumentFeedListener listener) {
            this.listener = listener;
        }
    }
}
