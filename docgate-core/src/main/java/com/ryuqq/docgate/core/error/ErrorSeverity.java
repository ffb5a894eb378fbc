package com.ryuqq.docgate.core.error;

import java.util.Locale;

/**
 * 오류 심각도.
 *
 * <p>호출자가 재시도, 로깅, 사용자 노출 중 무엇을 할지 결정하는 데 사용합니다.</p>
 *
 * @author DocGate Team
 * @since 1.0.0
 */
public enum ErrorSeverity {

    /** 내부 로그 전용. */
    SYSTEM_INFO("systemInfo"),

    /** 비차단 경고. */
    WARNING("warning"),

    /** 차단되지만 복구 가능한 오류. */
    SEVERE("severe"),

    /** 복구 불가능한 치명적 오류. */
    DANGER("danger");

    private final String wireName;

    ErrorSeverity(String wireName) {
        this.wireName = wireName;
    }

    /**
     * payload에서 사용하는 이름 조회 (예: "systemInfo").
     *
     * @return wire 이름
     */
    public String wireName() {
        return wireName;
    }

    /**
     * 문자열에서 심각도 파싱.
     *
     * <p>wire 이름("severe")과 enum 이름("SEVERE") 모두 허용합니다.
     * null이거나 알 수 없는 값은 {@link #SYSTEM_INFO}로 처리됩니다.</p>
     *
     * @param value 파싱할 문자열 (null 허용)
     * @return 해당 심각도
     */
    public static ErrorSeverity fromString(String value) {
        if (value == null || value.isBlank()) {
            return SYSTEM_INFO;
        }
        String trimmed = value.trim();
        for (ErrorSeverity severity : values()) {
            if (severity.wireName.equals(trimmed) || severity.name().equals(trimmed.toUpperCase(Locale.ROOT))) {
                return severity;
            }
        }
        return SYSTEM_INFO;
    }
}
