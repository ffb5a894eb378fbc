package com.ryuqq.docgate.application.repository;

import java.util.Map;

/**
 * 엔티티 ↔ payload 변환기.
 *
 * <p>변환 실패는 예외로 던지면 되고, 저장소가 이를 Failure로 변환합니다.</p>
 *
 * @param <T> 엔티티 타입
 * @author DocGate Team
 * @since 1.0.0
 */
public interface EntityCodec<T> {

    /**
     * 엔티티를 payload로 변환.
     *
     * @param entity 엔티티
     * @return payload
     */
    Map<String, Object> toPayload(T entity);

    /**
     * payload를 엔티티로 변환.
     *
     * @param payload payload
     * @return 엔티티
     * @throws RuntimeException 변환할 수 없는 경우
     */
    T fromPayload(Map<String, Object> payload);
}
