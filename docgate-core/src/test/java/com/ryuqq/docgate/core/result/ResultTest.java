package com.ryuqq.docgate.core.result;

import com.ryuqq.docgate.core.error.ErrorSeverity;
import com.ryuqq.docgate.core.error.StructuredError;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Result 테스트.
 *
 * @author DocGate Team
 * @since 1.0.0
 */
class ResultTest {

    private static final StructuredError ERROR =
        StructuredError.of("Failed", "ERR_TEST", "test failure", ErrorSeverity.WARNING);

    @Test
    void success_값을_보관() {
        Result<String> result = Result.success("value");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isFailure()).isFalse();
        assertThat(result).isEqualTo(new Success<>("value"));
    }

    @Test
    void success_null_값은_거부() {
        assertThatThrownBy(() -> Result.success(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("value");
    }

    @Test
    void failure_null_오류는_거부() {
        assertThatThrownBy(() -> Result.failure(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("error");
    }

    @Test
    void fold_케이스별_함수를_적용() {
        String ok = Result.success(3).fold(StructuredError::code, value -> "v" + value);
        String failed = Result.<Integer>failure(ERROR).fold(StructuredError::code, value -> "v" + value);

        assertThat(ok).isEqualTo("v3");
        assertThat(failed).isEqualTo("ERR_TEST");
    }

    @Test
    void map_성공만_변환하고_실패는_그대로() {
        assertThat(Result.success(2).map(value -> value * 10)).isEqualTo(Result.success(20));
        assertThat(Result.<Integer>failure(ERROR).map(value -> value * 10)).isEqualTo(Result.failure(ERROR));
    }

    @Test
    void flatMap_다음_Result로_연결() {
        Result<Integer> chained = Result.success(2).flatMap(value -> Result.success(value + 1));
        Result<Integer> stopped = Result.success(2).flatMap(value -> Result.failure(ERROR));

        assertThat(chained).isEqualTo(Result.success(3));
        assertThat(stopped.isFailure()).isTrue();
        assertThat(((Failure<Integer>) stopped).error()).isEqualTo(ERROR);
    }
}
