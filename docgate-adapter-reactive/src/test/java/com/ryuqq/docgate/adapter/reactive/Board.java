package com.ryuqq.docgate.adapter.reactive;

/**
 * 테스트용 엔티티.
 */
public record Board(String id, String name, int order) {
}
