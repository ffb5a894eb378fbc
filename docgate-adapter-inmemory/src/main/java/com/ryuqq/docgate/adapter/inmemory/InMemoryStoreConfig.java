package com.ryuqq.docgate.adapter.inmemory;

/**
 * InMemoryDocumentStore 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>latencyMs: read/save/delete 응답 지연 (기본 0ms, 0이면 동기 완료)</li>
 *   <li>throwOnSave: save 호출을 항상 실패시킴 (기본 false)</li>
 *   <li>throwOnDelete: delete 호출을 항상 실패시킴 (기본 false)</li>
 *   <li>emitInitial: feed 구독 즉시 현재 문서(없으면 {@code {}}) 전달 (기본 true)</li>
 *   <li>deepCopies: 저장/조회/전달 시 깊은 복사 (기본 true)</li>
 *   <li>dedupeByContent: 직전과 내용이 같은 feed 이벤트 생략 (기본 false)</li>
 * </ul>
 *
 * @author DocGate Team
 * @since 1.0.0
 * @param latencyMs 응답 지연 (밀리초, 0 이상)
 * @param throwOnSave save 실패 시뮬레이션 여부
 * @param throwOnDelete delete 실패 시뮬레이션 여부
 * @param emitInitial 구독 시 초기값 전달 여부
 * @param deepCopies 깊은 복사 여부
 * @param dedupeByContent 내용 기반 중복 제거 여부
 */
public record InMemoryStoreConfig(
    long latencyMs,
    boolean throwOnSave,
    boolean throwOnDelete,
    boolean emitInitial,
    boolean deepCopies,
    boolean dedupeByContent
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: latencyMs=0, throwOnSave=false, throwOnDelete=false,
     * emitInitial=true, deepCopies=true, dedupeByContent=false</p>
     */
    public InMemoryStoreConfig() {
        this(0, false, false, true, true, false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException latencyMs가 음수인 경우
     */
    public InMemoryStoreConfig {
        if (latencyMs < 0) {
            throw new IllegalArgumentException(
                "latencyMs must not be negative (current: " + latencyMs + ")"
            );
        }
    }

    public InMemoryStoreConfig withLatencyMs(long latencyMs) {
        return new InMemoryStoreConfig(latencyMs, throwOnSave, throwOnDelete, emitInitial, deepCopies, dedupeByContent);
    }

    public InMemoryStoreConfig withThrowOnSave(boolean throwOnSave) {
        return new InMemoryStoreConfig(latencyMs, throwOnSave, throwOnDelete, emitInitial, deepCopies, dedupeByContent);
    }

    public InMemoryStoreConfig withThrowOnDelete(boolean throwOnDelete) {
        return new InMemoryStoreConfig(latencyMs, throwOnSave, throwOnDelete, emitInitial, deepCopies, dedupeByContent);
    }

    public InMemoryStoreConfig withEmitInitial(boolean emitInitial) {
        return new InMemoryStoreConfig(latencyMs, throwOnSave, throwOnDelete, emitInitial, deepCopies, dedupeByContent);
    }

    public InMemoryStoreConfig withDeepCopies(boolean deepCopies) {
        return new InMemoryStoreConfig(latencyMs, throwOnSave, throwOnDelete, emitInitial, deepCopies, dedupeByContent);
    }

    public InMemoryStoreConfig withDedupeByContent(boolean dedupeByContent) {
        return new InMemoryStoreConfig(latencyMs, throwOnSave, throwOnDelete, emitInitial, deepCopies, dedupeByContent);
    }
}
