package com.ryuqq.docgate.core.channel;

import com.ryuqq.docgate.core.result.Result;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 공유 채널에 대한 watcher 한 명의 독립적인 fan-out 뷰.
 *
 * <p><strong>첫 이벤트:</strong> {@link #subscribe}한 listener는 즉시 bootstrap 값
 * (빈 Success)을 받고, 이후 백엔드에서 오는 변경을 순서대로 받습니다.
 * 뷰가 생성된 뒤 첫 subscribe 전까지 도착한 이벤트는 보관되었다가 bootstrap 직후 전달됩니다.</p>
 *
 * <p><strong>주의:</strong> {@link #cancel()}은 이 뷰의 전달만 멈춥니다.
 * 공유 구독과 참조 카운트에는 영향이 없으므로, watch 한 번마다
 * detachWatch를 정확히 한 번 호출해야 합니다.</p>
 *
 * @param <V> 값 타입
 * @author DocGate Team
 * @since 1.0.0
 */
public interface WatchView<V> {

    /**
     * listener 등록. 등록 즉시 첫 이벤트가 동기적으로 전달됩니다.
     *
     * <p>취소되었거나 채널이 이미 정리된 뷰에서는 아무 이벤트도 전달되지 않습니다.</p>
     *
     * @param listener 이벤트 수신자
     * @throws IllegalArgumentException listener가 null인 경우
     */
    void subscribe(Consumer<? super Result<V>> listener);

    /**
     * 이 뷰의 전달 중단 (참조 카운트는 변경하지 않음).
     */
    void cancel();

    /**
     * 취소 여부 확인 (채널 정리로 닫힌 경우 포함).
     *
     * @return 더 이상 이벤트를 전달하지 않으면 true
     */
    boolean isCancelled();

    /**
     * 모든 이벤트를 변환하는 파생 뷰 생성. 파생 뷰와 원본은 취소 상태를 공유합니다.
     *
     * @param mapper 이벤트 변환 함수
     * @param <U> 변환 후 값 타입
     * @return 파생 뷰
     */
    default <U> WatchView<U> map(Function<? super Result<V>, Result<U>> mapper) {
        return new MappedWatchView<>(this, mapper);
    }
}
