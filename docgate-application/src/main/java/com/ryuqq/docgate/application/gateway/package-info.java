/**
 * DocGate Application Layer - 문서 게이트웨이 포트.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.docgate.application.gateway.DocumentGateway} - JSON 문서 read/write/delete/watch</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-reactive 모듈에 위치</li>
 *   <li><strong>예외 없는 경계:</strong> 모든 결과는 Result로 반환</li>
 * </ul>
 *
 * @author DocGate Team
 * @since 1.0.0
 */
package com.ryuqq.docgate.application.gateway;
