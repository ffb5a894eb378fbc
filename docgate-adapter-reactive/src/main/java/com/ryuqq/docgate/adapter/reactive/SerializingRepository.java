package com.ryuqq.docgate.adapter.reactive;

import com.ryuqq.docgate.application.gateway.DocumentGateway;
import com.ryuqq.docgate.application.repository.DocumentRepository;
import com.ryuqq.docgate.application.repository.EntityCodec;
import com.ryuqq.docgate.core.channel.WatchView;
import com.ryuqq.docgate.core.error.DatabaseErrors;
import com.ryuqq.docgate.core.error.DefaultErrorMapper;
import com.ryuqq.docgate.core.error.ErrorMapper;
import com.ryuqq.docgate.core.error.StructuredError;
import com.ryuqq.docgate.core.executor.KeyedFifoExecutor;
import com.ryuqq.docgate.core.result.Result;
import com.ryuqq.docgate.core.result.Unit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * {@link DocumentGateway} 위의 타입 엔티티 저장소.
 *
 * <p>payload ↔ 엔티티 변환은 {@link EntityCodec}이 담당하고, 변환 실패는
 * {@link ErrorMapper#fromException}으로 Failure가 됩니다.</p>
 *
 * <p><strong>쓰기 직렬화:</strong> serializeWrites가 true(기본)이면 같은 docId에 대한
 * write/delete/mutate/patch/ensure는 {@link KeyedFifoExecutor}를 통해 제출 순서대로 하나씩 실행됩니다.
 * mutate/patch/ensure는 읽기부터 저장까지 한 작업으로 실행되므로 동시 갱신이 유실되지 않습니다.
 * read와 watch는 직렬화하지 않습니다.</p>
 *
 * <p><strong>일괄 작업:</strong> readMany/writeMany/deleteMany는 입력 순서대로 하나씩 실행하고
 * 문서별 결과를 모아 반환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * DocumentRepository&lt;Board&gt; boards = new SerializingRepository&lt;&gt;(
 *     gateway, new JacksonEntityCodec&lt;&gt;(Board.class));
 *
 * boards.write("b1", new Board("b1", "Kanban"));
 * boards.write("b1", new Board("b1", "Scrum"));   // 앞의 write가 끝난 뒤 실행
 * </pre>
 *
 * @param <T> 엔티티 타입
 * @author DocGate Team
 * @since 1.0.0
 */
public class SerializingRepository<T> implements DocumentRepository<T> {

    private static final Logger log = LoggerFactory.getLogger(SerializingRepository.class);

    static final String DECODE_LOCATION = "SerializingRepository.decode";
    static final String ENCODE_LOCATION = "SerializingRepository.encode";
    static final String WRITE_LOCATION = "SerializingRepository.write";
    static final String DELETE_LOCATION = "SerializingRepository.delete";
    static final String EXISTS_LOCATION = "SerializingRepository.exists";
    static final String MUTATE_LOCATION = "SerializingRepository.mutate";
    static final String PATCH_LOCATION = "SerializingRepository.patch";
    static final String ENSURE_LOCATION = "SerializingRepository.ensure";
    static final String READ_MANY_LOCATION = "SerializingRepository.readMany";
    static final String WRITE_MANY_LOCATION = "SerializingRepository.writeMany";
    static final String DELETE_MANY_LOCATION = "SerializingRepository.deleteMany";

    private final DocumentGateway gateway;
    private final EntityCodec<T> codec;
    private final ErrorMapper mapper;
    private final boolean serializeWrites;
    private final KeyedFifoExecutor<String> executor = new KeyedFifoExecutor<>();
    private volatile boolean disposed;

    /**
     * 기본 오류 변환기, 쓰기 직렬화 사용으로 생성.
     *
     * @param gateway 문서 게이트웨이
     * @param codec 엔티티 변환기
     */
    public SerializingRepository(DocumentGateway gateway, EntityCodec<T> codec) {
        this(gateway, codec, new DefaultErrorMapper(), true);
    }

    /**
     * 생성자.
     *
     * @param gateway 문서 게이트웨이
     * @param codec 엔티티 변환기
     * @param mapper 변환 실패용 오류 변환기
     * @param serializeWrites 같은 docId의 write/delete 직렬화 여부
     * @throws IllegalArgumentException gateway, codec, mapper가 null인 경우
     */
    public SerializingRepository(DocumentGateway gateway, EntityCodec<T> codec,
                                 ErrorMapper mapper, boolean serializeWrites) {
        if (gateway == null) {
            throw new IllegalArgumentException("gateway cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.gateway = gateway;
        this.codec = codec;
        this.mapper = mapper;
        this.serializeWrites = serializeWrites;
    }

    @Override
    public CompletableFuture<Result<T>> read(String docId) {
        assertNotDisposed();
        return gateway.read(docId).thenApply(this::decode);
    }

    @Override
    public CompletableFuture<Result<T>> write(String docId, T entity) {
        requireDocId(docId);
        if (entity == null) {
            throw new IllegalArgumentException("entity cannot be null");
        }
        assertNotDisposed();

        return enqueue(docId, WRITE_LOCATION, () -> store(docId, entity));
    }

    @Override
    public CompletableFuture<Result<Unit>> delete(String docId) {
        requireDocId(docId);
        assertNotDisposed();

        return enqueue(docId, DELETE_LOCATION, () -> gateway.delete(docId));
    }

    @Override
    public CompletableFuture<Result<Boolean>> exists(String docId) {
        requireDocId(docId);
        assertNotDisposed();

        return load(docId)
            .thenApply(result -> result.<Result<Boolean>>fold(
                error -> isNotFound(error) ? Result.success(false) : Result.failure(error),
                entity -> Result.success(true)))
            .exceptionally(error -> Result.failure(mapper.fromException(error, EXISTS_LOCATION)));
    }

    @Override
    public CompletableFuture<Result<T>> mutate(String docId, UnaryOperator<T> transform) {
        requireDocId(docId);
        if (transform == null) {
            throw new IllegalArgumentException("transform cannot be null");
        }
        assertNotDisposed();

        return enqueue(docId, MUTATE_LOCATION, () -> load(docId).thenCompose(current -> current.<CompletableFuture<Result<T>>>fold(
            SerializingRepository::failed,
            entity -> store(docId, transform.apply(entity)))));
    }

    @Override
    public CompletableFuture<Result<T>> patch(String docId, Map<String, Object> fields) {
        requireDocId(docId);
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        assertNotDisposed();

        Map<String, Object> changes = new LinkedHashMap<>(fields);
        return enqueue(docId, PATCH_LOCATION, () -> load(docId).thenCompose(current -> current.<CompletableFuture<Result<T>>>fold(
            SerializingRepository::failed,
            entity -> {
                Map<String, Object> merged = new LinkedHashMap<>(codec.toPayload(entity));
                merged.putAll(changes);
                return store(docId, codec.fromPayload(merged));
            })));
    }

    @Override
    public CompletableFuture<Result<T>> ensure(String docId, Supplier<T> create, UnaryOperator<T> updateIfExists) {
        requireDocId(docId);
        if (create == null) {
            throw new IllegalArgumentException("create cannot be null");
        }
        assertNotDisposed();

        return enqueue(docId, ENSURE_LOCATION, () -> load(docId).thenCompose(current -> current.<CompletableFuture<Result<T>>>fold(
            error -> isNotFound(error) ? store(docId, create.get()) : failed(error),
            entity -> updateIfExists == null
                ? CompletableFuture.completedFuture(Result.success(entity))
                : store(docId, updateIfExists.apply(entity)))));
    }

    @Override
    public CompletableFuture<Result<Map<String, Result<T>>>> readMany(List<String> docIds) {
        if (docIds == null) {
            throw new IllegalArgumentException("docIds cannot be null");
        }
        assertNotDisposed();
        return sequence(docIds, this::read, READ_MANY_LOCATION);
    }

    @Override
    public CompletableFuture<Result<Map<String, Result<T>>>> writeMany(Map<String, T> entities) {
        if (entities == null) {
            throw new IllegalArgumentException("entities cannot be null");
        }
        assertNotDisposed();
        Map<String, T> snapshot = new LinkedHashMap<>(entities);
        return sequence(snapshot.keySet(), docId -> write(docId, snapshot.get(docId)), WRITE_MANY_LOCATION);
    }

    @Override
    public CompletableFuture<Result<Map<String, Result<Unit>>>> deleteMany(List<String> docIds) {
        if (docIds == null) {
            throw new IllegalArgumentException("docIds cannot be null");
        }
        assertNotDisposed();
        return sequence(docIds, this::delete, DELETE_MANY_LOCATION);
    }

    @Override
    public WatchView<T> watch(String docId) {
        assertNotDisposed();
        return gateway.watch(docId).map(this::decode);
    }

    @Override
    public void detachWatch(String docId) {
        gateway.detachWatch(docId);
    }

    @Override
    public void releaseDoc(String docId) {
        gateway.releaseDoc(docId);
    }

    @Override
    public void dispose() {
        if (disposed) {
            return;
        }
        disposed = true;
        executor.dispose();
        gateway.dispose();
        log.info("SerializingRepository disposed");
    }

    public boolean isDisposed() {
        return disposed;
    }

    private CompletableFuture<Result<T>> load(String docId) {
        return gateway.read(docId).thenApply(this::decode);
    }

    /**
     * 엔티티를 인코딩해 게이트웨이로 저장합니다. 호출자가 이미 docId 작업 안에 있어야 합니다.
     */
    private CompletableFuture<Result<T>> store(String docId, T entity) {
        if (entity == null) {
            throw new IllegalStateException("entity to store cannot be null");
        }
        Map<String, Object> payload;
        try {
            payload = codec.toPayload(entity);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(Result.failure(mapper.fromException(e, ENCODE_LOCATION)));
        }
        return gateway.write(docId, payload).thenApply(this::decode);
    }

    // 앞 항목이 끝난 뒤 다음 항목을 시작, 결과는 입력 순서로 보관
    private <R> CompletableFuture<Result<Map<String, Result<R>>>> sequence(
            Collection<String> docIds, Function<String, CompletableFuture<Result<R>>> operation, String location) {

        Map<String, Result<R>> results = new LinkedHashMap<>();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (String docId : docIds) {
            chain = chain
                .thenCompose(ignored -> operation.apply(docId))
                .thenAccept(result -> results.put(docId, result));
        }
        return chain
            .thenApply(ignored -> Result.success(Collections.unmodifiableMap(results)))
            .exceptionally(error -> {
                log.debug("{} aborted: {}", location, error.toString());
                return Result.failure(mapper.fromException(error, location));
            });
    }

    private static <R> CompletableFuture<Result<R>> failed(StructuredError error) {
        return CompletableFuture.completedFuture(Result.failure(error));
    }

    private static boolean isNotFound(StructuredError error) {
        return DatabaseErrors.NOT_FOUND.code().equals(error.code());
    }

    private <R> CompletableFuture<Result<R>> enqueue(
            String docId, String location, Supplier<CompletableFuture<Result<R>>> task) {

        CompletableFuture<Result<R>> future = serializeWrites
            ? executor.withLock(docId, task)
            : invoke(task);
        return future.exceptionally(error -> Result.failure(mapper.fromException(error, location)));
    }

    private static <R> CompletableFuture<Result<R>> invoke(Supplier<CompletableFuture<Result<R>>> task) {
        try {
            CompletableFuture<Result<R>> future = task.get();
            return future != null
                ? future
                : CompletableFuture.failedFuture(new IllegalStateException("task returned no result"));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private Result<T> decode(Result<Map<String, Object>> result) {
        return result.flatMap(payload -> {
            try {
                return Result.success(codec.fromPayload(payload));
            } catch (RuntimeException e) {
                log.debug("Failed to decode payload: {}", e.toString());
                return Result.failure(mapper.fromException(e, DECODE_LOCATION));
            }
        });
    }

    private static void requireDocId(String docId) {
        if (docId == null || docId.isBlank()) {
            throw new IllegalArgumentException("docId cannot be null or blank");
        }
    }

    private void assertNotDisposed() {
        if (disposed) {
            throw new IllegalStateException("SerializingRepository is disposed");
        }
    }
}
