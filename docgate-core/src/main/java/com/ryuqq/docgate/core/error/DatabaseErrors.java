package com.ryuqq.docgate.core.error;

import java.util.Map;

/**
 * 문서 저장소 관련 표준 오류 카탈로그.
 *
 * <p>모든 항목은 metadata에 {@code source=Database}를 포함합니다.</p>
 *
 * @author DocGate Team
 * @since 1.0.0
 */
public final class DatabaseErrors {

    public static final String SOURCE_KEY = "source";
    public static final String SOURCE_VALUE = "Database";

    public static final StructuredError CONNECTION_FAILED = of(
        "Database Connection Failed", "DB_CONN_FAILED",
        "Unable to establish a connection with the database.", ErrorSeverity.DANGER);

    public static final StructuredError UNAVAILABLE = of(
        "Database Unavailable", "DB_UNAVAILABLE",
        "The database service is temporarily unavailable.", ErrorSeverity.SEVERE);

    public static final StructuredError NOT_FOUND = of(
        "Record Not Found", "DB_NOT_FOUND",
        "The requested record does not exist in the database.", ErrorSeverity.WARNING);

    public static final StructuredError CONFLICT = of(
        "Concurrency Conflict", "DB_CONFLICT",
        "The record was modified concurrently by another process.", ErrorSeverity.WARNING);

    public static final StructuredError SERIALIZATION_ERROR = of(
        "Serialization Error", "DB_SERIALIZATION_ERROR",
        "Failed to serialize or deserialize the data.", ErrorSeverity.SEVERE);

    public static final StructuredError TIMEOUT = of(
        "Database Timeout", "DB_TIMEOUT",
        "The database operation timed out.", ErrorSeverity.WARNING);

    public static final StructuredError STREAM_CLOSED = of(
        "Stream Closed", "DB_STREAM_CLOSED",
        "The database stream was closed unexpectedly.", ErrorSeverity.WARNING);

    private DatabaseErrors() {
    }

    /**
     * 알 수 없는 저장소 오류 생성.
     *
     * @param reason 상세 사유 (null이면 기본 설명)
     * @return DB_UNKNOWN 오류
     */
    public static StructuredError unknown(String reason) {
        return of("Unknown Database Error", "DB_UNKNOWN",
            reason == null ? "An unknown database error has occurred." : reason,
            ErrorSeverity.SYSTEM_INFO);
    }

    /**
     * 코드로 카탈로그 항목 조회.
     *
     * @param code 오류 코드
     * @return 해당 항목, 알 수 없는 코드는 {@link #unknown(String)}
     */
    public static StructuredError fromCode(String code) {
        if (code == null) {
            return unknown("Unrecognized Database code: null");
        }
        switch (code) {
            case "DB_CONN_FAILED":
                return CONNECTION_FAILED;
            case "DB_UNAVAILABLE":
                return UNAVAILABLE;
            case "DB_NOT_FOUND":
                return NOT_FOUND;
            case "DB_CONFLICT":
                return CONFLICT;
            case "DB_SERIALIZATION_ERROR":
                return SERIALIZATION_ERROR;
            case "DB_TIMEOUT":
                return TIMEOUT;
            case "DB_STREAM_CLOSED":
                return STREAM_CLOSED;
            default:
                return unknown("Unrecognized Database code: " + code);
        }
    }

    private static StructuredError of(String title, String code, String description, ErrorSeverity severity) {
        return new StructuredError(title, code, description, severity, Map.of(SOURCE_KEY, SOURCE_VALUE));
    }
}
