package com.ryuqq.docgate.core.result;

import com.ryuqq.docgate.core.error.StructuredError;

import java.util.function.Function;

/**
 * 실패 결과.
 *
 * <p>원격 호출 예외, 비즈니스 오류 payload, NotFound, 스트림 종료 등
 * 모든 실패는 {@link StructuredError}로 변환되어 이 타입으로 전달됩니다.</p>
 *
 * @param error 구조화된 오류 (non-null)
 * @param <T> 성공 시의 값 타입
 *
 * @author DocGate Team
 * @since 1.0.0
 */
public record Failure<T>(StructuredError error) implements Result<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException error가 null인 경우
     */
    public Failure {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }

    @Override
    public <U> U fold(Function<? super StructuredError, ? extends U> onFailure,
                      Function<? super T, ? extends U> onSuccess) {
        return onFailure.apply(error);
    }
}
