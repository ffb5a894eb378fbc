package com.ryuqq.docgate.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 예외 대신 반환되는 구조화된 오류.
 *
 * <p>모든 실패는 이 형태로 변환되어 {@link com.ryuqq.docgate.core.result.Failure}에 담깁니다.</p>
 *
 * @param title 짧은 제목 (예: "Record Not Found")
 * @param code 안정적인 오류 코드 (예: DB_NOT_FOUND)
 * @param description 사람이 읽을 수 있는 설명
 * @param severity 심각도
 * @param metadata 진단용 부가 정보 (불변, 빈 맵 허용)
 *
 * @author DocGate Team
 * @since 1.0.0
 */
public record StructuredError(
    String title,
    String code,
    String description,
    ErrorSeverity severity,
    Map<String, Object> metadata
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException title, code가 null/blank이거나 severity가 null인 경우
     */
    public StructuredError {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title cannot be null or blank");
        }
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code cannot be null or blank");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        description = description == null ? "" : description;
        // null 값 허용, 삽입 순서 유지
        metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * metadata 없이 생성.
     *
     * @param title 제목
     * @param code 코드
     * @param description 설명
     * @param severity 심각도
     * @return StructuredError 인스턴스
     */
    public static StructuredError of(String title, String code, String description, ErrorSeverity severity) {
        return new StructuredError(title, code, description, severity, Map.of());
    }

    /**
     * metadata 항목을 하나 추가한 새 인스턴스 생성.
     *
     * @param key metadata 키
     * @param value metadata 값
     * @return 새 StructuredError 인스턴스
     */
    public StructuredError withMetadata(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.put(key, value);
        return new StructuredError(title, code, description, severity, merged);
    }
}
