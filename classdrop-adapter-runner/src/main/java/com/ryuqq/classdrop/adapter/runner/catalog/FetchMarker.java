package com.ryuqq.classdrop.adapter.runner.catalog;

/**
 * 진행 중인 카탈로그 조회 표시.
 *
 * @param collectionId 조회 중인 컬렉션
 * @param startTime 시작 시각 (epoch millis)
 * @author ClassDrop Team
 * @since 1.0.0
 */
public record FetchMarker(String collectionId, long startTime) {
}
