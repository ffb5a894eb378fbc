package com.ryuqq.docgate.core.channel;

import com.ryuqq.docgate.core.result.Result;
import com.ryuqq.docgate.core.spi.FeedSubscription;

import java.util.function.Consumer;

/**
 * 키에 대한 백엔드 feed를 한 번 구독하고, 모든 이벤트를 {@link Result}로 변환해 sink에 전달합니다.
 *
 * <p>{@link ChannelRegistry}는 채널을 만들 때 정확히 한 번 호출합니다.
 * 구현체는 백엔드 오류와 종료도 Failure로 변환해야 하며 예외를 던지지 않아야 합니다.</p>
 *
 * @param <K> 키 타입
 * @param <V> 값 타입
 * @author DocGate Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FeedOpener<K, V> {

    /**
     * 백엔드 feed 구독.
     *
     * @param key 구독할 키
     * @param sink 변환된 이벤트를 받을 채널 입력
     * @return 구독 핸들 (구독에 실패했으면 null 허용)
     */
    FeedSubscription open(K key, Consumer<Result<V>> sink);
}
