package com.ryuqq.docgate.core.result;

import com.ryuqq.docgate.core.error.StructuredError;

import java.util.function.Function;

/**
 * Gateway 경계를 넘는 모든 작업의 결과.
 *
 * <p>Result는 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Success}: 값과 함께 성공적으로 완료됨</li>
 *   <li>{@link Failure}: {@link StructuredError}로 표현된 실패</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.
 * 실패는 예외로 던져지지 않고 항상 값으로 전달됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * String text = result.fold(
 *     error -&gt; "Failed: " + error.code(),
 *     value -&gt; "Loaded: " + value
 * );
 * </pre>
 *
 * @param <T> 성공 값 타입
 * @author DocGate Team
 * @since 1.0.0
 */
public sealed interface Result<T> permits Success, Failure {

    /**
     * 성공 결과 생성.
     *
     * @param value 성공 값
     * @param <T> 값 타입
     * @return Success 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    /**
     * 실패 결과 생성.
     *
     * @param error 구조화된 오류
     * @param <T> 값 타입
     * @return Failure 인스턴스
     * @throws IllegalArgumentException error가 null인 경우
     */
    static <T> Result<T> failure(StructuredError error) {
        return new Failure<>(error);
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFailure() {
        return this instanceof Failure;
    }

    /**
     * 두 케이스를 하나의 값으로 접습니다.
     *
     * @param onFailure 실패 시 적용할 함수
     * @param onSuccess 성공 시 적용할 함수
     * @param <U> 결과 타입
     * @return 적용된 함수의 반환값
     */
    <U> U fold(Function<? super StructuredError, ? extends U> onFailure,
               Function<? super T, ? extends U> onSuccess);

    /**
     * 성공 값을 변환합니다. 실패는 그대로 전달됩니다.
     *
     * @param mapper 변환 함수
     * @param <U> 변환 후 타입
     * @return 변환된 Result
     */
    default <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        return fold(Result::<U>failure, value -> Result.<U>success(mapper.apply(value)));
    }

    /**
     * 성공 값을 다른 Result로 연결합니다. 실패는 그대로 전달됩니다.
     *
     * @param mapper 다음 Result를 만드는 함수
     * @param <U> 변환 후 타입
     * @return 연결된 Result
     */
    default <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        return fold(Result::<U>failure, mapper);
    }
}
