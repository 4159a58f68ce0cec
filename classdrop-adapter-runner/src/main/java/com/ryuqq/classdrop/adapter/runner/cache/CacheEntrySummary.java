package com.ryuqq.classdrop.adapter.runner.cache;

/**
 * 캐시 메타데이터의 항목 요약.
 *
 * <p>페이로드 자체는 별도 키에 저장되며, 이 요약만으로 LRU 선택과 용량 계산을 합니다.</p>
 *
 * @param collectionId 컬렉션 ID
 * @param collectionName 컬렉션 이름
 * @param sizeBytes 기록 시점의 직렬화 크기 (UTF-8 바이트)
 * @param lastAccessTime 마지막 사용 시각 (epoch millis, 단조 증가)
 * @param accessCount 사용 횟수
 * @param createdAt 페이로드 기록 시각 (수명 판정 기준)
 * @param insertionOrder 삽입 순번 (lastAccessTime 동률 시 순서 결정)
 * @author ClassDrop Team
 * @since 1.0.0
 */
public record CacheEntrySummary(
    String collectionId,
    String collectionName,
    long sizeBytes,
    long lastAccessTime,
    long accessCount,
    long createdAt,
    long insertionOrder
) {

    public CacheEntrySummary {
        if (collectionId == null || collectionId.isBlank()) {
            throw new IllegalArgumentException("collectionId cannot be null or blank");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes must be non-negative (current: " + sizeBytes + ")");
        }
    }

    /**
     * 사용 기록 갱신. lastAccessTime은 뒤로 가지 않습니다.
     *
     * @param now 현재 시각
     * @return 갱신된 요약
     */
    public CacheEntrySummary touched(long now) {
        return new CacheEntrySummary(
            collectionId, collectionName, sizeBytes,
            Math.max(lastAccessTime, now), accessCount + 1, createdAt, insertionOrder
        );
    }
}
