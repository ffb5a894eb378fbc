package com.ryuqq.docgate.core.error;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 기본 {@link ErrorMapper} 구현체.
 *
 * <p><strong>Payload 오류 판별 규칙 (순서대로):</strong></p>
 * <ol>
 *   <li>중첩 객체: {@code {"error": {...}}}</li>
 *   <li>최상위 {@code code} + ({@code message} 또는 {@code description})</li>
 *   <li>플래그: {@code ok:false} 또는 {@code success:false}</li>
 * </ol>
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>title 없음 → "Operation failed"</li>
 *   <li>code 없음 → {@code ERR_PAYLOAD}</li>
 *   <li>description → description, message 순, 둘 다 없으면 "Unknown error"</li>
 *   <li>metadata → {@code meta} 객체 + location</li>
 *   <li>severity → {@code errorLevel} 파싱 (알 수 없으면 SYSTEM_INFO)</li>
 * </ul>
 *
 * <p>예외는 {@code ERR_UNEXPECTED} / SEVERE로 변환되며, {@link CompletionException}과
 * {@link ExecutionException} 래퍼는 먼저 벗겨냅니다.</p>
 *
 * @author DocGate Team
 * @since 1.0.0
 */
public final class DefaultErrorMapper implements ErrorMapper {

    public static final String UNEXPECTED_CODE = "ERR_UNEXPECTED";
    public static final String PAYLOAD_CODE = "ERR_PAYLOAD";

    private static final String ERROR_KEY = "error";
    private static final String CODE_KEY = "code";
    private static final String TITLE_KEY = "title";
    private static final String DESCRIPTION_KEY = "description";
    private static final String MESSAGE_KEY = "message";
    private static final String META_KEY = "meta";
    private static final String ERROR_LEVEL_KEY = "errorLevel";
    private static final String OK_KEY = "ok";
    private static final String SUCCESS_KEY = "success";

    @Override
    public StructuredError fromException(Throwable error, String location) {
        Throwable cause = unwrap(error);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("location", location == null ? "unknown" : location);
        metadata.put("type", cause == null ? "null" : cause.getClass().getSimpleName());
        return new StructuredError(
            "Unexpected error",
            UNEXPECTED_CODE,
            String.valueOf(cause),
            ErrorSeverity.SEVERE,
            metadata
        );
    }

    @Override
    public Optional<StructuredError> fromPayload(Map<String, Object> payload, String location) {
        if (payload == null || payload.isEmpty()) {
            return Optional.empty();
        }

        Map<String, Object> errorJson = null;

        Object nested = payload.get(ERROR_KEY);
        if (nested instanceof Map<?, ?>) {
            errorJson = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) nested).entrySet()) {
                errorJson.put(String.valueOf(entry.getKey()), entry.getValue());
            }
        }

        if (errorJson == null
            && payload.containsKey(CODE_KEY)
            && (payload.containsKey(MESSAGE_KEY) || payload.containsKey(DESCRIPTION_KEY))) {
            errorJson = payload;
        }

        if (errorJson == null
            && (Boolean.FALSE.equals(payload.get(OK_KEY)) || Boolean.FALSE.equals(payload.get(SUCCESS_KEY)))) {
            errorJson = payload;
        }

        if (errorJson == null) {
            return Optional.empty();
        }

        String title = textOrDefault(errorJson.get(TITLE_KEY), "Operation failed");
        String code = textOrDefault(errorJson.get(CODE_KEY), PAYLOAD_CODE);
        Object rawDescription = errorJson.get(DESCRIPTION_KEY) != null
            ? errorJson.get(DESCRIPTION_KEY)
            : errorJson.get(MESSAGE_KEY);
        String description = textOrDefault(rawDescription, "Unknown error");

        Map<String, Object> metadata = new LinkedHashMap<>();
        Object meta = errorJson.get(META_KEY);
        if (meta instanceof Map) {
            ((Map<?, ?>) meta).forEach((k, v) -> metadata.put(String.valueOf(k), v));
        }
        metadata.put("location", location == null ? "unknown" : location);

        Object level = errorJson.get(ERROR_LEVEL_KEY);
        ErrorSeverity severity = ErrorSeverity.fromString(level == null ? null : level.toString());

        return Optional.of(new StructuredError(title, code, description, severity, metadata));
    }

    /**
     * 비동기 래퍼 예외를 벗겨 실제 원인을 반환.
     *
     * @param error 예외 (null 허용)
     * @return 실제 원인
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String textOrDefault(Object value, String fallback) {
        if (value == null) {
            return fallback;
        }
        String text = value.toString();
        return text.isBlank() ? fallback : text;
    }
}
