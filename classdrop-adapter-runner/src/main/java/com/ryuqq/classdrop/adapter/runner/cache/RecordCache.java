package com.ryuqq.classdrop.adapter.runner.cache;

import com.ryuqq.classdrop.adapter.runner.support.JsonCodec;
import com.ryuqq.classdrop.core.error.StorageException;
import com.ryuqq.classdrop.core.model.CatalogSnapshot;
import com.ryuqq.classdrop.core.spi.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 개수와 바이트 크기 두 한도를 가진 LRU 카탈로그 캐시.
 *
 * <p>페이로드는 {@code gcr_course_data_<collectionId>}에, LRU 메타데이터는
 * {@value #METADATA_KEY}에 저장되어 프로세스 재시작 후에도 유지됩니다.</p>
 *
 * <p><strong>불변식 (모든 set 이후):</strong></p>
 * <ul>
 *   <li>{@code totalSizeBytes == sum(entries.sizeBytes)}</li>
 *   <li>{@code count(entries) <= maxEntries}</li>
 *   <li>{@code totalSizeBytes <= maxBytes} (빈 캐시에 단일 초과 항목을 저장하는 경우 제외)</li>
 * </ul>
 *
 * <p><strong>최근 사용 정책:</strong> 성공한 {@link #get(String)}은 항상 항목을 touch합니다.</p>
 *
 * <p><strong>자가 복구:</strong> 메타데이터를 읽을 때 페이로드 키가 사라진 항목은 버리고
 * 전체 크기를 다시 계산합니다. 페이로드 기록과 메타데이터 기록 사이에 중단되어도
 * 다음 접근에서 정리됩니다.</p>
 *
 * <p><strong>동시성:</strong> 모든 변경은 이 인스턴스 모니터로 직렬화됩니다.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public class RecordCache {

    private static final Logger log = LoggerFactory.getLogger(RecordCache.class);

    public static final String METADATA_KEY = "gcr_cache_metadata";
    public static final String DATA_KEY_PREFIX = "gcr_course_data_";
    public static final String LAST_COLLECTION_ID_KEY = "gcr_last_course_id";
    public static final String LAST_COLLECTION_NAME_KEY = "gcr_last_course_name";

    private final KeyValueStore store;
    private final JsonCodec codec;
    private final RecordCacheConfig config;
    private final Clock clock;
    private final PayloadTruncator truncator;

    /**
     * 생성자.
     *
     * @param store 영속 KV 저장소
     * @param codec JSON 직렬화기
     * @param config 캐시 설정
     * @param clock 시간 소스
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public RecordCache(KeyValueStore store, JsonCodec codec, RecordCacheConfig config, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.codec = codec;
        this.config = config;
        this.clock = clock;
        this.truncator = new PayloadTruncator(codec);
    }

    /**
     * 캐시 조회.
     *
     * <p>항목이 있고 수명 이내면 페이로드를 반환하며 touch합니다.
     * 수명이 지났거나 페이로드가 깨진 항목은 삭제하고 빈 값을 반환합니다.</p>
     *
     * @param collectionId 컬렉션 ID
     * @return 캐시된 카탈로그
     */
    public synchronized Optional<CatalogSnapshot> get(String collectionId) {
        Optional<CatalogSnapshot> snapshot = read(collectionId);
        snapshot.ifPresent(s -> touch(collectionId));
        return snapshot;
    }

    /**
     * 사용 기록 갱신 (항목이 없으면 아무것도 하지 않음).
     *
     * @param collectionId 컬렉션 ID
     */
    public synchronized void touch(String collectionId) {
        requireId(collectionId);
        CacheMetadata metadata = loadMetadata();
        Optional<CacheEntrySummary> summary = metadata.find(collectionId);
        if (summary.isEmpty()) {
            return;
        }
        saveMetadata(metadata.with(summary.get().touched(clock.millis())));
    }

    /**
     * 캐시 기록.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>직렬화 크기가 한도의 90%를 넘으면 축소</li>
     *   <li>바이트 한도 또는 (새 키인 경우) 개수 한도를 넘는 동안 LRU 항목을 하나씩 제거</li>
     *   <li>페이로드 기록 후 메타데이터 기록</li>
     *   <li>두 기록 중 어느 쪽이든 저장소 쿼터를 넘으면 항목을 하나만 남기고 모두 제거한 뒤 두 기록을 한 번 재시도</li>
     * </ol>
     *
     * @param collectionId 컬렉션 ID
     * @param snapshot 저장할 카탈로그
     * @throws StorageException 재시도 후에도 저장소가 거부한 경우, 또는 쿼터 이외의 저장 실패
     */
    public synchronized void set(String collectionId, CatalogSnapshot snapshot) {
        requireId(collectionId);
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }

        String json = codec.write(snapshot);
        long size = JsonCodec.byteSize(json);
        if (size > config.truncationThreshold()) {
            long originalSize = size;
            snapshot = truncator.truncate(snapshot, config.truncationThreshold());
            json = codec.write(snapshot);
            size = JsonCodec.byteSize(json);
            log.warn("Payload too large for cache, truncated: collectionId={}, {} -> {} bytes",
                collectionId, originalSize, size);
        }

        CacheMetadata metadata = loadMetadata();
        while (metadata.entryCount() > 0 && needsEviction(metadata, collectionId, size)) {
            metadata = evictOldest(metadata);
        }

        CacheMetadata updated;
        try {
            updated = writeEntry(metadata, collectionId, snapshot, json, size);
        } catch (StorageException e) {
            if (!e.isQuotaExceeded()) {
                throw e;
            }
            log.warn("Storage quota exceeded while caching {}, evicting down to one entry and retrying",
                collectionId);
            while (metadata.entryCount() > 1) {
                metadata = evictOldest(metadata);
            }
            updated = writeEntry(metadata, collectionId, snapshot, json, size);
        }

        log.info("Catalog cached: collectionId={}, {} bytes, {}/{} entries",
            collectionId, size, updated.entryCount(), config.maxEntries());
    }

    /**
     * 가장 오래 사용되지 않은 항목 하나를 제거.
     *
     * @return 제거했으면 true, 빈 캐시면 false
     */
    public synchronized boolean evictLRU() {
        CacheMetadata metadata = loadMetadata();
        if (metadata.entryCount() == 0) {
            return false;
        }
        evictOldest(metadata);
        return true;
    }

    public synchronized void clear(String collectionId) {
        requireId(collectionId);
        store.remove(dataKey(collectionId));
        CacheMetadata metadata = loadMetadata();
        if (metadata.find(collectionId).isPresent()) {
            saveMetadata(metadata.without(collectionId));
        }
        log.info("Cache entry cleared: collectionId={}", collectionId);
    }

    /**
     * 모든 페이로드, 메타데이터, 마지막 컬렉션 포인터 제거.
     */
    public synchronized void clearAll() {
        for (String key : store.getAll().keySet()) {
            if (key.startsWith(DATA_KEY_PREFIX)) {
                store.remove(key);
            }
        }
        store.remove(METADATA_KEY);
        store.remove(LAST_COLLECTION_ID_KEY);
        store.remove(LAST_COLLECTION_NAME_KEY);
        log.info("Cache cleared");
    }

    public synchronized CacheStats stats() {
        CacheMetadata metadata = loadMetadata();
        List<CacheEntrySummary> entries = new ArrayList<>(metadata.entries().values());
        entries.sort(Comparator.comparingLong(CacheEntrySummary::lastAccessTime).reversed());
        double usage = metadata.totalSizeBytes() * 100.0 / config.maxBytes();
        return new CacheStats(
            metadata.entryCount(),
            metadata.totalSizeBytes(),
            config.maxEntries(),
            config.maxBytes(),
            Math.round(usage * 10.0) / 10.0,
            entries
        );
    }

    // ==================== 마지막 컬렉션 ====================

    /**
     * 현재 컬렉션으로 기록하고 해당 항목을 touch.
     *
     * @param collectionId 컬렉션 ID
     * @param collectionName 컬렉션 이름 (null이면 "Unknown Course")
     */
    public synchronized void setLastCollection(String collectionId, String collectionName) {
        requireId(collectionId);
        store.set(LAST_COLLECTION_ID_KEY, collectionId);
        store.set(LAST_COLLECTION_NAME_KEY,
            collectionName == null || collectionName.isBlank() ? "Unknown Course" : collectionName);
        touch(collectionId);
    }

    public Optional<String> lastCollectionId() {
        return store.get(LAST_COLLECTION_ID_KEY);
    }

    public Optional<String> lastCollectionName() {
        return store.get(LAST_COLLECTION_NAME_KEY);
    }

    public synchronized Optional<CatalogSnapshot> lastCollectionData() {
        return lastCollectionId().flatMap(this::get);
    }

    /**
     * 캐시된 레코드 수 (touch하지 않음).
     *
     * @param collectionId 컬렉션 ID
     * @return 레코드 수, 캐시에 없으면 0
     */
    public synchronized int cachedItemCount(String collectionId) {
        return read(collectionId).map(CatalogSnapshot::recordCount).orElse(0);
    }

    // ==================== 내부 ====================

    private Optional<CatalogSnapshot> read(String collectionId) {
        requireId(collectionId);
        CacheMetadata metadata = loadMetadata();
        Optional<CacheEntrySummary> summary = metadata.find(collectionId);
        Optional<String> raw = store.get(dataKey(collectionId));

        if (summary.isEmpty()) {
            if (raw.isPresent()) {
                // 메타데이터 없이 남은 페이로드는 용량 계산 밖에 있으므로 제거
                store.remove(dataKey(collectionId));
                log.warn("Removed orphaned payload without metadata: collectionId={}", collectionId);
            }
            return Optional.empty();
        }

        if (clock.millis() - summary.get().createdAt() > config.maxAgeMs()) {
            log.info("Cache entry expired: collectionId={}, createdAt={}", collectionId, summary.get().createdAt());
            removeEntry(metadata, collectionId);
            return Optional.empty();
        }

        Optional<CatalogSnapshot> snapshot = raw.flatMap(json -> codec.read(json, CatalogSnapshot.class));
        if (snapshot.isEmpty()) {
            removeEntry(metadata, collectionId);
        }
        return snapshot;
    }

    /**
     * 페이로드와 메타데이터를 함께 기록.
     *
     * @return 기록된 메타데이터
     * @throws StorageException 둘 중 하나라도 저장소가 거부한 경우
     */
    private CacheMetadata writeEntry(CacheMetadata metadata, String collectionId, CatalogSnapshot snapshot,
                                     String json, long size) {
        store.set(dataKey(collectionId), json);

        long now = clock.millis();
        Optional<CacheEntrySummary> existing = metadata.find(collectionId);
        CacheEntrySummary summary = new CacheEntrySummary(
            collectionId,
            snapshot.collectionName(),
            size,
            existing.map(e -> Math.max(e.lastAccessTime(), now)).orElse(now),
            existing.map(e -> e.accessCount() + 1).orElse(1L),
            now,
            existing.map(CacheEntrySummary::insertionOrder).orElse(metadata.nextInsertionOrder())
        );
        CacheMetadata updated = metadata.with(summary);
        saveMetadata(updated);
        return updated;
    }

    private boolean needsEviction(CacheMetadata metadata, String collectionId, long newSize) {
        Optional<CacheEntrySummary> existing = metadata.find(collectionId);
        long netDelta = newSize - existing.map(CacheEntrySummary::sizeBytes).orElse(0L);
        boolean overBytes = metadata.totalSizeBytes() + netDelta > config.maxBytes();
        boolean overCount = existing.isEmpty() && metadata.entryCount() >= config.maxEntries();
        return overBytes || overCount;
    }

    private CacheMetadata evictOldest(CacheMetadata metadata) {
        CacheEntrySummary victim = metadata.leastRecentlyUsed()
            .orElseThrow(() -> new IllegalStateException("Cannot evict from an empty cache"));
        log.info("Evicting LRU entry: collectionId={}, lastAccessTime={}, sizeBytes={}",
            victim.collectionId(), victim.lastAccessTime(), victim.sizeBytes());
        return removeEntry(metadata, victim.collectionId());
    }

    private CacheMetadata removeEntry(CacheMetadata metadata, String collectionId) {
        store.remove(dataKey(collectionId));
        CacheMetadata updated = metadata.without(collectionId);
        saveMetadata(updated);
        return updated;
    }

    private CacheMetadata loadMetadata() {
        CacheMetadata metadata = codec.read(store.get(METADATA_KEY).orElse(null), CacheMetadata.class)
            .orElseGet(CacheMetadata::empty);

        CacheMetadata healed = metadata;
        for (Map.Entry<String, CacheEntrySummary> entry : metadata.entries().entrySet()) {
            if (store.get(dataKey(entry.getKey())).isEmpty()) {
                healed = healed.without(entry.getKey());
            }
        }
        if (healed != metadata) {
            log.warn("Cache metadata repaired: dropped {} entries without payload",
                metadata.entryCount() - healed.entryCount());
            saveMetadata(healed);
        }
        return healed;
    }

    private void saveMetadata(CacheMetadata metadata) {
        store.set(METADATA_KEY, codec.write(metadata));
    }

    private static String dataKey(String collectionId) {
        return DATA_KEY_PREFIX + collectionId;
    }

    private static void requireId(String collectionId) {
        if (collectionId == null || collectionId.isBlank()) {
            throw new IllegalArgumentException("collectionId cannot be null or blank");
        }
    }
}
