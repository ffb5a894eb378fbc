package com.ryuqq.docgate.core.error;

import java.util.Map;
import java.util.Optional;

/**
 * 원시 실패를 {@link StructuredError}로 변환하는 순수 함수 집합.
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>구현체는 절대 예외를 던지지 않아야 합니다.</li>
 *   <li>구현체는 상태가 없어야 하며 여러 스레드에서 동시 호출 가능해야 합니다.</li>
 * </ul>
 *
 * @author DocGate Team
 * @since 1.0.0
 */
public interface ErrorMapper {

    /**
     * 예외를 구조화된 오류로 변환.
     *
     * @param error 발생한 예외
     * @param location 발생 위치 (예: "ReactiveDocumentGateway.read")
     * @return 구조화된 오류 (non-null)
     */
    StructuredError fromException(Throwable error, String location);

    /**
     * 정상 응답 payload가 비즈니스 오류를 담고 있는지 검사.
     *
     * @param payload 백엔드 payload
     * @param location 발생 위치
     * @return 오류를 담고 있으면 해당 오류, 아니면 empty
     */
    Optional<StructuredError> fromPayload(Map<String, Object> payload, String location);
}
