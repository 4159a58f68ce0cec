package com.ryuqq.classdrop.adapter.runner.cache;

/**
 * RecordCache 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxEntries: 최대 컬렉션 수 (기본 5)</li>
 *   <li>maxBytes: 전체 직렬화 크기 상한 (기본 4.5 MiB)</li>
 *   <li>maxAgeMs: 항목 최대 수명 (기본 30일)</li>
 * </ul>
 *
 * <p>직렬화 크기가 {@code maxBytes}의 90%를 넘는 페이로드는 저장 전에 축소됩니다.</p>
 *
 * @param maxEntries 최대 항목 수 (1 이상)
 * @param maxBytes 최대 바이트 (양수)
 * @param maxAgeMs 최대 수명 (밀리초, 양수)
 * @author ClassDrop Team
 * @since 1.0.0
 */
public record RecordCacheConfig(
    int maxEntries,
    long maxBytes,
    long maxAgeMs
) {

    private static final long DEFAULT_MAX_BYTES = (long) (4.5 * 1024 * 1024);
    private static final long DEFAULT_MAX_AGE_MS = 30L * 24 * 60 * 60 * 1000;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxEntries=5, maxBytes=4.5 MiB, maxAgeMs=30일</p>
     */
    public RecordCacheConfig() {
        this(5, DEFAULT_MAX_BYTES, DEFAULT_MAX_AGE_MS);
    }

    public RecordCacheConfig {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive (current: " + maxEntries + ")");
        }
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive (current: " + maxBytes + ")");
        }
        if (maxAgeMs <= 0) {
            throw new IllegalArgumentException("maxAgeMs must be positive (current: " + maxAgeMs + ")");
        }
    }

    /**
     * 축소 기준 크기 (maxBytes의 90%).
     *
     * @return 바이트
     */
    public long truncationThreshold() {
        return (long) (maxBytes * 0.9);
    }

    public RecordCacheConfig withMaxEntries(int maxEntries) {
        return new RecordCacheConfig(maxEntries, maxBytes, maxAgeMs);
    }

    public RecordCacheConfig withMaxBytes(long maxBytes) {
        return new RecordCacheConfig(maxEntries, maxBytes, maxAgeMs);
    }

    public RecordCacheConfig withMaxAgeMs(long maxAgeMs) {
        return new RecordCacheConfig(maxEntries, maxBytes, maxAgeMs);
    }
}
