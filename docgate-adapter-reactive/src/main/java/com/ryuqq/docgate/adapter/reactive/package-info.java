/**
 * DocGate Adapter - DocumentStore 기반 게이트웨이와 저장소 구현체.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.docgate.adapter.reactive.ReactiveDocumentGateway} - Result 기반 문서 게이트웨이, 문서별 공유 구독</li>
 *   <li>{@link com.ryuqq.docgate.adapter.reactive.SerializingRepository} - 엔티티 저장소, docId별 쓰기 직렬화</li>
 *   <li>{@link com.ryuqq.docgate.adapter.reactive.JacksonEntityCodec} - Jackson 기반 엔티티 변환기</li>
 *   <li>{@link com.ryuqq.docgate.adapter.reactive.GatewayConfig} - 게이트웨이 설정</li>
 * </ul>
 *
 * @author DocGate Team
 * @since 1.0.0
 */
package com.ryuqq.docgate.adapter.reactive;
