package com.ryuqq.docgate.application.repository;

import com.ryuqq.docgate.core.channel.WatchView;
import com.ryuqq.docgate.core.result.Result;
import com.ryuqq.docgate.core.result.Unit;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * 타입이 있는 엔티티 저장소.
 *
 * <p>{@link com.ryuqq.docgate.application.gateway.DocumentGateway} 위에서
 * payload를 엔티티로 변환합니다. 라이프사이클 규칙(watch/detachWatch)은 게이트웨이와 같습니다.</p>
 *
 * @param <T> 엔티티 타입
 * @author DocGate Team
 * @since 1.0.0
 */
public interface DocumentRepository<T> {

    CompletableFuture<Result<T>> read(String docId);

    /**
     * 엔티티 저장. 같은 docId에 대한 write/delete는 제출 순서대로 실행될 수 있습니다.
     *
     * @param docId 문서 ID
     * @param entity 저장할 엔티티
     * @return 저장 결과를 디코딩한 엔티티
     */
    CompletableFuture<Result<T>> write(String docId, T entity);

    CompletableFuture<Result<Unit>> delete(String docId);

    /**
     * 문서 존재 여부. NOT_FOUND는 false로, 그 밖의 오류는 Failure로 반환합니다.
     *
     * @param docId 문서 ID
     * @return 존재 여부
     */
    CompletableFuture<Result<Boolean>> exists(String docId);

    /**
     * 현재 엔티티를 읽어 변환한 뒤 저장 (read-modify-write).
     *
     * <p>같은 docId의 write/delete/mutate/patch/ensure와 함께 직렬화되므로
     * 동시에 호출해도 갱신이 유실되지 않습니다. 읽기 실패는 그대로 반환합니다.</p>
     *
     * @param docId 문서 ID
     * @param transform 현재 엔티티 → 새 엔티티
     * @return 저장 결과
     */
    CompletableFuture<Result<T>> mutate(String docId, UnaryOperator<T> transform);

    /**
     * 현재 payload에 필드를 덮어쓴 뒤 저장. 직렬화 규칙은 {@link #mutate}와 같습니다.
     *
     * @param docId 문서 ID
     * @param fields 덮어쓸 필드
     * @return 저장 결과
     */
    CompletableFuture<Result<T>> patch(String docId, Map<String, Object> fields);

    /**
     * 문서가 없으면 create로 만들어 저장하고, 있으면 현재 엔티티를 반환.
     *
     * @param docId 문서 ID
     * @param create 새 엔티티 생성 함수
     * @return 저장되었거나 이미 있던 엔티티
     */
    default CompletableFuture<Result<T>> ensure(String docId, Supplier<T> create) {
        return ensure(docId, create, null);
    }

    /**
     * 문서가 없으면 create로 만들고, 있으면 updateIfExists(있을 때)로 갱신해 저장.
     *
     * @param docId 문서 ID
     * @param create 새 엔티티 생성 함수
     * @param updateIfExists 기존 엔티티 갱신 함수 (null이면 기존 엔티티를 그대로 반환)
     * @return 저장되었거나 이미 있던 엔티티
     */
    CompletableFuture<Result<T>> ensure(String docId, Supplier<T> create, UnaryOperator<T> updateIfExists);

    /**
     * 여러 문서를 순서대로 읽습니다. 문서별 결과는 입력 순서의 맵으로 반환하고,
     * 호출 자체가 실패한 경우에만 전체가 Failure가 됩니다.
     *
     * @param docIds 문서 ID 목록
     * @return docId → 결과
     */
    CompletableFuture<Result<Map<String, Result<T>>>> readMany(List<String> docIds);

    CompletableFuture<Result<Map<String, Result<T>>>> writeMany(Map<String, T> entities);

    CompletableFuture<Result<Map<String, Result<Unit>>>> deleteMany(List<String> docIds);

    WatchView<T> watch(String docId);

    void detachWatch(String docId);

    void releaseDoc(String docId);

    void dispose();
}
