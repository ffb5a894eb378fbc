package com.ryuqq.docgate.application.gateway;

import com.ryuqq.docgate.core.channel.WatchView;
import com.ryuqq.docgate.core.result.Result;
import com.ryuqq.docgate.core.result.Unit;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 키 기반 문서 접근 게이트웨이.
 *
 * <p>문서 읽기/쓰기/삭제/실시간 구독을 {@link Result}로 통일합니다.
 * 반환되는 future는 절대 예외로 완료되지 않으며, 모든 실패는
 * {@link com.ryuqq.docgate.core.result.Failure}로 전달됩니다.</p>
 *
 * <p><strong>ID 주입:</strong> 성공 payload에는 설정된 id 키(기본 {@code "id"})로
 * docId가 포함됩니다. 백엔드가 이미 해당 필드를 제공한 경우 백엔드 값이 우선합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * gateway.write("c1", Map.of("name", "Board"))
 *     .thenAccept(result -&gt; result.fold(
 *         error -&gt; log.warn("write failed: {}", error.code()),
 *         json  -&gt; log.info("saved: {}", json)));   // {"name":"Board","id":"c1"}
 *
 * WatchView&lt;Map&lt;String, Object&gt;&gt; view = gateway.watch("c1");
 * view.subscribe(event -&gt; render(event));
 *
 * // 구독 종료 시
 * view.cancel();
 * gateway.detachWatch("c1");   // 반드시 호출: 참조 카운트 감소
 * </pre>
 *
 * @author DocGate Team
 * @since 1.0.0
 */
public interface DocumentGateway {

    /**
     * 문서 조회 (백엔드 왕복 1회).
     *
     * @param docId 문서 ID
     * @return 성공 시 id가 주입된 payload, 실패 시 구조화된 오류
     * @throws IllegalArgumentException docId가 null이거나 빈 문자열인 경우
     * @throws IllegalStateException dispose된 경우
     */
    CompletableFuture<Result<Map<String, Object>>> read(String docId);

    /**
     * 문서 생성/갱신 (백엔드 왕복 1회).
     *
     * @param docId 문서 ID
     * @param payload 저장할 payload
     * @return 입력 payload 또는 (read-after-write 설정 시) 백엔드 저장 응답, id 주입됨
     * @throws IllegalArgumentException docId 또는 payload가 null인 경우
     * @throws IllegalStateException dispose된 경우
     */
    CompletableFuture<Result<Map<String, Object>>> write(String docId, Map<String, Object> payload);

    /**
     * 문서 삭제 (백엔드 왕복 1회). 존재하지 않는 문서 삭제도 성공입니다.
     *
     * @param docId 문서 ID
     * @return 성공 시 {@link Unit#VALUE}
     * @throws IllegalArgumentException docId가 null이거나 빈 문자열인 경우
     * @throws IllegalStateException dispose된 경우
     */
    CompletableFuture<Result<Unit>> delete(String docId);

    /**
     * 문서 실시간 구독. 참조 카운트를 1 증가시킵니다.
     *
     * <p>키당 백엔드 구독은 한 번만 생성되고 모든 watcher가 공유합니다.
     * 첫 이벤트는 bootstrap 값(빈 Success)이며, 백엔드 스트림이 끝나면
     * {@code DB_STREAM_CLOSED} Failure가 전달됩니다.</p>
     *
     * @param docId 문서 ID
     * @return 이 watcher의 독립적인 뷰
     * @throws IllegalArgumentException docId가 null이거나 빈 문자열인 경우
     * @throws IllegalStateException dispose된 경우
     */
    WatchView<Map<String, Object>> watch(String docId);

    /**
     * 참조 카운트 1 감소. 0이 되면 공유 구독을 해제합니다.
     *
     * <p>완료된 {@link #watch} 호출마다 정확히 한 번 호출해야 합니다.
     * 뷰 취소만으로는 카운트가 줄지 않습니다.</p>
     *
     * @param docId 문서 ID (채널이 없으면 no-op)
     */
    void detachWatch(String docId);

    /**
     * 참조 카운트와 무관하게 문서 채널을 즉시 정리 (로그아웃, 테스트 정리 등).
     *
     * @param docId 문서 ID (채널이 없으면 no-op)
     */
    void releaseDoc(String docId);

    /**
     * 전체 정리. 이후 read/write/delete/watch 호출은 {@link IllegalStateException}.
     */
    void dispose();
}
