package com.ryuqq.docgate.adapter.reactive;

import com.ryuqq.docgate.application.gateway.DocumentGateway;
import com.ryuqq.docgate.core.channel.ChannelRegistry;
import com.ryuqq.docgate.core.channel.WatchView;
import com.ryuqq.docgate.core.error.DatabaseErrors;
import com.ryuqq.docgate.core.error.DefaultErrorMapper;
import com.ryuqq.docgate.core.error.ErrorMapper;
import com.ryuqq.docgate.core.error.StructuredError;
import com.ryuqq.docgate.core.result.Result;
import com.ryuqq.docgate.core.result.Unit;
import com.ryuqq.docgate.core.spi.DocumentFeedListener;
import com.ryuqq.docgate.core.spi.DocumentStore;
import com.ryuqq.docgate.core.spi.FeedSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link DocumentStore} 기반 {@link DocumentGateway} 구현체.
 *
 * <p>백엔드 호출의 모든 결과(성공, 비즈니스 오류 payload, 예외, 실패한 future)를
 * {@link Result}로 변환합니다. 반환되는 future는 예외로 완료되지 않습니다.</p>
 *
 * <p><strong>변환 규칙:</strong></p>
 * <ol>
 *   <li>예외 / 실패한 future → {@link ErrorMapper#fromException}</li>
 *   <li>오류를 담은 payload → {@link ErrorMapper#fromPayload}</li>
 *   <li>{@code {}} + treatEmptyAsMissing → {@link DatabaseErrors#NOT_FOUND}</li>
 *   <li>그 외 → idKey로 docId 주입 (백엔드가 이미 준 값은 유지)</li>
 * </ol>
 *
 * <p><strong>실시간 구독:</strong> 문서별 공유 채널은 {@link ChannelRegistry}가 관리합니다.
 * 같은 docId를 몇 번 watch하든 백엔드 feed는 한 번만 열리고, 마지막 detachWatch에서 닫힙니다.
 * feed 종료는 {@link DatabaseErrors#STREAM_CLOSED} Failure로 전달됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * DocumentGateway gateway = new ReactiveDocumentGateway(
 *     store,
 *     new DefaultErrorMapper(),
 *     new GatewayConfig("boards").withTreatEmptyAsMissing(true)
 * );
 *
 * gateway.read("b1").thenAccept(result -&gt; ...);
 * </pre>
 *
 * @author DocGate Team
 * @since 1.0.0
 */
public class ReactiveDocumentGateway implements DocumentGateway {

    private static final Logger log = LoggerFactory.getLogger(ReactiveDocumentGateway.class);

    static final String READ_LOCATION = "ReactiveDocumentGateway.read";
    static final String WRITE_LOCATION = "ReactiveDocumentGateway.write";
    static final String DELETE_LOCATION = "ReactiveDocumentGateway.delete";
    static final String WATCH_LOCATION = "ReactiveDocumentGateway.watch";
    static final String WATCH_ERROR_LOCATION = "ReactiveDocumentGateway.watch:onError";

    private static final Result<Map<String, Object>> BOOTSTRAP = Result.success(Map.of());

    private final DocumentStore store;
    private final ErrorMapper mapper;
    private final GatewayConfig config;
    private final ChannelRegistry<String, Map<String, Object>> channels;
    private volatile boolean disposed;

    /**
     * 기본 오류 변환기와 기본 설정으로 생성.
     *
     * @param store 백엔드 저장소
     */
    public ReactiveDocumentGateway(DocumentStore store) {
        this(store, new DefaultErrorMapper(), new GatewayConfig());
    }

    /**
     * 생성자.
     *
     * @param store 백엔드 저장소
     * @param mapper 오류 변환기
     * @param config 게이트웨이 설정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ReactiveDocumentGateway(DocumentStore store, ErrorMapper mapper, GatewayConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.mapper = mapper;
        this.config = config;
        this.channels = new ChannelRegistry<>(this::openFeed, BOOTSTRAP, config.replayLastValue());
    }

    @Override
    public CompletableFuture<Result<Map<String, Object>>> read(String docId) {
        requireDocId(docId);
        assertNotDisposed();

        return call(READ_LOCATION,
            () -> store.read(config.collection(), docId),
            payload -> toDocument(docId, payload, READ_LOCATION));
    }

    /**
     * {@inheritDoc}
     *
     * <p>readAfterWrite가 켜져 있으면 백엔드 저장 응답을 읽기와 같은 규칙으로 변환합니다.
     * 응답이 null이면 입력 payload를 사용합니다.</p>
     */
    @Override
    public CompletableFuture<Result<Map<String, Object>>> write(String docId, Map<String, Object> payload) {
        requireDocId(docId);
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        assertNotDisposed();

        return call(WRITE_LOCATION,
            () -> store.save(config.collection(), docId, payload),
            ack -> {
                if (config.readAfterWrite() && ack != null) {
                    return toDocument(docId, ack, WRITE_LOCATION);
                }
                return Result.success(withId(docId, payload));
            });
    }

    @Override
    public CompletableFuture<Result<Unit>> delete(String docId) {
        requireDocId(docId);
        assertNotDisposed();

        return call(DELETE_LOCATION,
            () -> store.delete(config.collection(), docId),
            ignored -> Result.success(Unit.VALUE));
    }

    @Override
    public WatchView<Map<String, Object>> watch(String docId) {
        requireDocId(docId);
        assertNotDisposed();

        WatchView<Map<String, Object>> view = channels.acquire(docId);
        log.debug("watch {} (refCount={})", docId, channels.refCount(docId));
        return view;
    }

    @Override
    public void detachWatch(String docId) {
        if (disposed || docId == null) {
            return;
        }
        channels.release(docId);
    }

    @Override
    public void releaseDoc(String docId) {
        if (disposed || docId == null) {
            return;
        }
        channels.forceRelease(docId);
    }

    @Override
    public void dispose() {
        if (disposed) {
            return;
        }
        disposed = true;
        channels.disposeAll();
        log.info("ReactiveDocumentGateway disposed (collection={})", config.collection());
    }

    public boolean isDisposed() {
        return disposed;
    }

    /**
     * docId의 현재 watch 참조 카운트.
     *
     * @param docId 문서 ID
     * @return 참조 카운트 (채널이 없으면 0)
     */
    public int watchCount(String docId) {
        return channels.refCount(docId);
    }

    public int activeChannelCount() {
        return channels.activeKeyCount();
    }

    public GatewayConfig config() {
        return config;
    }

    private FeedSubscription openFeed(String docId, Consumer<Result<Map<String, Object>>> sink) {
        try {
            return store.watch(config.collection(), docId, new DocumentFeedListener() {
                @Override
                public void onDocument(Map<String, Object> document) {
                    sink.accept(toDocument(docId, document, WATCH_LOCATION));
                }

                @Override
                public void onError(Throwable error) {
                    log.warn("Feed error for {}/{}: {}", config.collection(), docId, error.toString());
                    sink.accept(Result.failure(mapper.fromException(error, WATCH_ERROR_LOCATION)));
                }

                @Override
                public void onClosed() {
                    log.info("Feed closed for {}/{}", config.collection(), docId);
                    sink.accept(Result.failure(DatabaseErrors.STREAM_CLOSED.withMetadata("docId", docId)));
                }
            });
        } catch (RuntimeException e) {
            log.warn("Failed to open feed for {}/{}", config.collection(), docId, e);
            sink.accept(Result.failure(mapper.fromException(e, WATCH_LOCATION)));
            return null;
        }
    }

    /**
     * 백엔드 호출 결과를 Result로 변환. 동기 예외와 실패한 future 모두 Failure가 됩니다.
     */
    private <T, U> CompletableFuture<Result<U>> call(
            String location,
            Supplier<? extends CompletionStage<T>> operation,
            Function<? super T, Result<U>> onValue) {

        CompletionStage<T> stage;
        try {
            stage = operation.get();
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(failure(e, location));
        }
        if (stage == null) {
            return CompletableFuture.completedFuture(
                failure(new IllegalStateException("store returned no result"), location));
        }

        return stage.handle((value, error) -> {
            if (error != null) {
                return this.<U>failure(error, location);
            }
            try {
                return onValue.apply(value);
            } catch (RuntimeException e) {
                return this.<U>failure(e, location);
            }
        }).toCompletableFuture();
    }

    private <U> Result<U> failure(Throwable error, String location) {
        StructuredError mapped = mapper.fromException(error, location);
        log.debug("{} failed: {}", location, mapped.code());
        return Result.failure(mapped);
    }

    private Result<Map<String, Object>> toDocument(String docId, Map<String, Object> payload, String location) {
        Map<String, Object> json = payload == null ? Map.of() : payload;

        Optional<StructuredError> businessError = mapper.fromPayload(json, location);
        if (businessError.isPresent()) {
            return Result.failure(businessError.get());
        }
        if (config.treatEmptyAsMissing() && json.isEmpty()) {
            return Result.failure(DatabaseErrors.NOT_FOUND.withMetadata("docId", docId));
        }
        return Result.success(withId(docId, json));
    }

    private Map<String, Object> withId(String docId, Map<String, Object> json) {
        if (json.containsKey(config.idKey())) {
            return json;
        }
        Map<String, Object> copy = new LinkedHashMap<>(json);
        copy.put(config.idKey(), docId);
        return Collections.unmodifiableMap(copy);
    }

    private static void requireDocId(String docId) {
        if (docId == null || docId.isBlank()) {
            throw new IllegalArgumentException("docId cannot be null or blank");
        }
    }

    private void assertNotDisposed() {
        if (disposed) {
            throw new IllegalStateException("ReactiveDocumentGateway is disposed");
        }
    }
}
