package com.ryuqq.classdrop.adapter.runner.cache;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 캐시 메타데이터 (불변).
 *
 * <p>{@code totalSizeBytes}는 항상 항목 크기의 합으로 다시 계산되며,
 * 직접 수정할 수 없습니다.</p>
 *
 * @param entries 컬렉션 ID별 항목 요약
 * @param totalSizeBytes 전체 크기
 * @param version 형식 버전
 * @author ClassDrop Team
 * @since 1.0.0
 */
public record CacheMetadata(
    Map<String, CacheEntrySummary> entries,
    long totalSizeBytes,
    int version
) {

    public static final int CURRENT_VERSION = 2;

    public CacheMetadata {
        entries = entries == null ? Map.of() : Map.copyOf(entries);
        totalSizeBytes = entries.values().stream().mapToLong(CacheEntrySummary::sizeBytes).sum();
    }

    public static CacheMetadata empty() {
        return new CacheMetadata(Map.of(), 0, CURRENT_VERSION);
    }

    public CacheMetadata with(CacheEntrySummary summary) {
        Map<String, CacheEntrySummary> next = new LinkedHashMap<>(entries);
        next.put(summary.collectionId(), summary);
        return new CacheMetadata(next, 0, CURRENT_VERSION);
    }

    public CacheMetadata without(String collectionId) {
        Map<String, CacheEntrySummary> next = new LinkedHashMap<>(entries);
        next.remove(collectionId);
        return new CacheMetadata(next, 0, CURRENT_VERSION);
    }

    public Optional<CacheEntrySummary> find(String collectionId) {
        return Optional.ofNullable(entries.get(collectionId));
    }

    public int entryCount() {
        return entries.size();
    }

    /**
     * 가장 오래 사용되지 않은 항목.
     *
     * @return lastAccessTime이 가장 작은 항목 (동률이면 먼저 삽입된 항목)
     */
    public Optional<CacheEntrySummary> leastRecentlyUsed() {
        return entries.values().stream()
            .min(Comparator.comparingLong(CacheEntrySummary::lastAccessTime)
                .thenComparingLong(CacheEntrySummary::insertionOrder));
    }

    public long nextInsertionOrder() {
        return entries.values().stream().mapToLong(CacheEntrySummary::insertionOrder).max().orElse(0) + 1;
    }
}
