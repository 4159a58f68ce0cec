package com.ryuqq.classdrop.adapter.runner.cache;

import java.util.List;

/**
 * 캐시 진단 스냅샷.
 *
 * @param entryCount 항목 수
 * @param totalSizeBytes 전체 크기
 * @param maxEntries 최대 항목 수
 * @param maxBytes 최대 바이트
 * @param usagePercent 바이트 사용률 (0-100)
 * @param entries 최근 사용 순 항목 요약
 * @author ClassDrop Team
 * @since 1.0.0
 */
public record CacheStats(
    int entryCount,
    long totalSizeBytes,
    int maxEntries,
    long maxBytes,
    double usagePercent,
    List<CacheEntrySummary> entries
) {

    public CacheStats {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
