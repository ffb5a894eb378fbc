package com.ryuqq.docgate.core.result;

import com.ryuqq.docgate.core.error.StructuredError;

import java.util.function.Function;

/**
 * 성공 결과.
 *
 * @param value 성공 값 (non-null)
 * @param <T> 값 타입
 *
 * @author DocGate Team
 * @since 1.0.0
 */
public record Success<T>(T value) implements Result<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 null인 경우
     */
    public Success {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    @Override
    public <U> U fold(Function<? super StructuredError, ? extends U> onFailure,
                      Function<? super T, ? extends U> onSuccess) {
        return onSuccess.apply(value);
    }
}
