package com.ryuqq.docgate.adapter.reactive;

/**
 * ReactiveDocumentGateway 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>collection: 대상 컬렉션 이름 (기본 "documents")</li>
 *   <li>idKey: docId를 주입할 필드 이름 (기본 "id")</li>
 *   <li>readAfterWrite: write 결과로 입력 대신 백엔드 저장 응답을 반환 (기본 false)</li>
 *   <li>treatEmptyAsMissing: {@code {}} payload를 DB_NOT_FOUND로 처리 (기본 false)</li>
 *   <li>replayLastValue: 동작 중인 채널에 붙는 뷰가 bootstrap 대신 마지막 값으로 시작 (기본 false)</li>
 * </ul>
 *
 * @author DocGate Team
 * @since 1.0.0
 * @param collection 컬렉션 이름 (빈 문자열 불가)
 * @param idKey id 필드 이름 (빈 문자열 불가)
 * @param readAfterWrite 저장 응답 반환 여부
 * @param treatEmptyAsMissing 빈 payload를 없는 문서로 볼지 여부
 * @param replayLastValue 마지막 값 재전달 여부
 */
public record GatewayConfig(
    String collection,
    String idKey,
    boolean readAfterWrite,
    boolean treatEmptyAsMissing,
    boolean replayLastValue
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: collection="documents", idKey="id", readAfterWrite=false,
     * treatEmptyAsMissing=false, replayLastValue=false</p>
     */
    public GatewayConfig() {
        this("documents", "id", false, false, false);
    }

    /**
     * 컬렉션만 지정하는 생성자 (나머지는 기본값).
     *
     * @param collection 컬렉션 이름
     */
    public GatewayConfig(String collection) {
        this(collection, "id", false, false, false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException collection 또는 idKey가 null이거나 빈 문자열인 경우
     */
    public GatewayConfig {
        if (collection == null || collection.isBlank()) {
            throw new IllegalArgumentException("collection cannot be null or blank");
        }
        if (idKey == null || idKey.isBlank()) {
            throw new IllegalArgumentException("idKey cannot be null or blank");
        }
    }

    public GatewayConfig withCollection(String collection) {
        return new GatewayConfig(collection, idKey, readAfterWrite, treatEmptyAsMissing, replayLastValue);
    }

    public GatewayConfig withIdKey(String idKey) {
        return new GatewayConfig(collection, idKey, readAfterWrite, treatEmptyAsMissing, replayLastValue);
    }

    public GatewayConfig withReadAfterWrite(boolean readAfterWrite) {
        return new GatewayConfig(collection, idKey, readAfterWrite, treatEmptyAsMissing, replayLastValue);
    }

    public GatewayConfig withTreatEmptyAsMissing(boolean treatEmptyAsMissing) {
        return new GatewayConfig(collection, idKey, readAfterWrite, treatEmptyAsMissing, replayLastValue);
    }

    public GatewayConfig withReplayLastValue(boolean replayLastValue) {
        return new GatewayConfig(collection, idKey, readAfterWrite, treatEmptyAsMissing, replayLastValue);
    }
}
