/**
 * DocGate Application Layer - 타입 엔티티 저장소 포트.
 *
 * <ul>
 *   <li>{@link com.ryuqq.docgate.application.repository.DocumentRepository} - 엔티티 read/write/delete/watch</li>
 *   <li>{@link com.ryuqq.docgate.application.repository.EntityCodec} - 엔티티 ↔ payload 변환</li>
 * </ul>
 *
 * @author DocGate Team
 * @since 1.0.0
 */
package com.ryuqq.docgate.application.repository;
