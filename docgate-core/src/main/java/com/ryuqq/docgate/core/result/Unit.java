package com.ryuqq.docgate.core.result;

/**
 * 값이 없는 성공을 나타내는 단일 인스턴스 (예: delete 성공).
 *
 * @author DocGate Team
 * @since 1.0.0
 */
public enum Unit {
    VALUE
}
