/**
 * DocGate Testkit - 저장소 계약 테스트와 테스트용 fake.
 *
 * <ul>
 *   <li>{@link com.ryuqq.docgate.testkit.AbstractDocumentStoreContractTest} - 어댑터별 계약 테스트 기반 클래스</li>
 *   <li>{@link com.ryuqq.docgate.testkit.ScriptedDocumentStore} - 응답과 feed를 직접 제어하는 fake 저장소</li>
 *   <li>{@link com.ryuqq.docgate.testkit.RecordingFeedListener} - feed 이벤트 기록기</li>
 * </ul>
 *
 * @author DocGate Team
 * @since 1.0.0
 */
package com.ryuqq.docgate.testkit;
