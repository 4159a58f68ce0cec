package com.ryuqq.classdrop.adapter.runner.cache;

import com.ryuqq.classdrop.adapter.inmemory.store.InMemoryKeyValueStore;
import com.ryuqq.classdrop.adapter.runner.support.JsonCodec;
import com.ryuqq.classdrop.adapter.runner.support.TestClock;
import com.ryuqq.classdrop.core.error.StorageException;
import com.ryuqq.classdrop.core.model.Attachment;
import com.ryuqq.classdrop.core.model.CatalogSnapshot;
import com.ryuqq.classdrop.core.model.CourseRecord;
import com.ryuqq.classdrop.core.model.DriveFile;
import com.ryuqq.classdrop.core.model.RecordKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * RecordCache 단위 테스트.
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
@DisplayName("RecordCache 단위 테스트")
class RecordCacheTest {

    private static final long START = Instant.parse("2024-03-01T12:00:00Z").toEpochMilli();
    private static final long DAY_MS = 24 * 60 * 60 * 1000L;

    private final JsonCodec codec = new JsonCodec();

    private InMemoryKeyValueStore store;
    private TestClock clock;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        clock = new TestClock(START);
    }

    private RecordCache cache(RecordCacheConfig config) {
        return new RecordCache(store, codec, config, clock);
    }

    private static CatalogSnapshot snapshot(String collectionId) {
        CourseRecord record = new CourseRecord(collectionId + "-r1", "Week 1", RecordKind.MATERIAL, List.of(
            new DriveFile(collectionId + "-f1", "notes.pdf", "application/pdf", 100L, null)
        ));
        return new CatalogSnapshot(collectionId, "Course " + collectionId, List.of(), List.of(record), List.of(), START, false);
    }

    private static CatalogSnapshot largeSnapshot(String collectionId, int titleLength) {
        Attachment file = new DriveFile(collectionId + "-big", "x".repeat(titleLength), "application/pdf", 1L, null);
        CourseRecord record = new CourseRecord(collectionId + "-r1", "Big", RecordKind.ASSIGNMENT, List.of(file));
        return new CatalogSnapshot(collectionId, "Course " + collectionId, List.of(record), List.of(), List.of(), START, false);
    }

    private static List<CourseRecord> records(String prefix, RecordKind kind, int count) {
        List<CourseRecord> records = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            records.add(new CourseRecord(String.format("%s%03d", prefix, i), "Title", kind, List.of()));
        }
        return records;
    }

    private long sizeOf(CatalogSnapshot snapshot) {
        return JsonCodec.byteSize(codec.write(snapshot));
    }

    private static List<String> ids(CacheStats stats) {
        return stats.entries().stream().map(CacheEntrySummary::collectionId).sorted().collect(Collectors.toList());
    }

    // ============================================================
    // 1. LRU 개수 한도
    // ============================================================

    @Nested
    @DisplayName("개수 한도")
    class CountBound {

        @Test
        @DisplayName("6번째 저장은 가장 오래 사용되지 않은 항목을 제거한다")
        void sixthEvictsLeastRecentlyUsed() {
            // given: c1..c5 저장 후 c1을 조회
            RecordCache cache = cache(new RecordCacheConfig());
            for (int i = 1; i <= 5; i++) {
                cache.set("c" + i, snapshot("c" + i));
                clock.advance(1000);
            }
            assertThat(cache.get("c1")).isPresent();
            clock.advance(1000);

            // when
            cache.set("c6", snapshot("c6"));

            // then
            CacheStats stats = cache.stats();
            assertEquals(5, stats.entryCount());
            assertThat(ids(stats)).containsExactly("c1", "c3", "c4", "c5", "c6");
            assertThat(store.get(RecordCache.DATA_KEY_PREFIX + "c2")).isEmpty();
        }

        @Test
        @DisplayName("같은 키 재저장은 개수를 늘리지 않는다")
        void overwriteKeepsCount() {
            RecordCache cache = cache(new RecordCacheConfig().withMaxEntries(2));
            cache.set("c1", snapshot("c1"));
            cache.set("c2", snapshot("c2"));

            cache.set("c2", snapshot("c2"));

            assertEquals(2, cache.stats().entryCount());
            assertThat(cache.get("c1")).isPresent();
        }

        @Test
        @DisplayName("evictLRU는 빈 캐시에서 false")
        void evictOnEmpty() {
            RecordCache cache = cache(new RecordCacheConfig());

            assertFalse(cache.evictLRU());
        }

        @Test
        @DisplayName("evictLRU는 가장 오래된 항목 하나를 제거한다")
        void evictOne() {
            RecordCache cache = cache(new RecordCacheConfig());
            cache.set("c1", snapshot("c1"));
            clock.advance(10);
            cache.set("c2", snapshot("c2"));

            assertTrue(cache.evictLRU());

            assertThat(ids(cache.stats())).containsExactly("c2");
        }
    }

    // ============================================================
    // 2. 바이트 한도와 축소
    // ============================================================

    @Nested
    @DisplayName("바이트 한도")
    class ByteBound {

        @Test
        @DisplayName("총 크기가 한도를 넘으면 LRU 항목을 제거한다")
        void evictsToFitBytes() {
            // given: 두 항목만 들어가는 크기
            long size = sizeOf(snapshot("c1"));
            RecordCache cache = cache(new RecordCacheConfig().withMaxBytes(size * 2 + size / 2));
            cache.set("c1", snapshot("c1"));
            clock.advance(10);
            cache.set("c2", snapshot("c2"));
            clock.advance(10);

            // when
            cache.set("c3", snapshot("c3"));

            // then
            CacheStats stats = cache.stats();
            assertThat(ids(stats)).containsExactly("c2", "c3");
            assertThat(stats.totalSizeBytes()).isLessThanOrEqualTo(stats.maxBytes());
        }

        @Test
        @DisplayName("totalSizeBytes는 항목 크기의 합과 같다")
        void totalMatchesSum() {
            RecordCache cache = cache(new RecordCacheConfig());
            cache.set("c1", snapshot("c1"));
            cache.set("c2", largeSnapshot("c2", 500));

            CacheStats stats = cache.stats();

            long sum = stats.entries().stream().mapToLong(CacheEntrySummary::sizeBytes).sum();
            assertEquals(sum, stats.totalSizeBytes());
            assertEquals(sizeOf(snapshot("c1")) + sizeOf(largeSnapshot("c2", 500)), sum);
        }

        @Test
        @DisplayName("큰 페이로드는 종류별 상한으로 축소된다")
        void truncatesPerKindLimits() {
            // given
            CatalogSnapshot big = new CatalogSnapshot("c1", "Big", records("a", RecordKind.ASSIGNMENT, 150),
                List.of(), List.of(), START, false);
            RecordCache cache = cache(new RecordCacheConfig().withMaxBytes(sizeOf(big)));

            // when
            cache.set("c1", big);

            // then
            CatalogSnapshot stored = cache.get("c1").orElseThrow();
            assertTrue(stored.truncated());
            assertEquals(100, stored.assignments().size());
            assertEquals("a000", stored.assignments().get(0).id());
        }

        @Test
        @DisplayName("상한 적용 후에도 크면 공지부터 통째로 제거한다")
        void dropsAnnouncementsFirst() {
            CatalogSnapshot big = new CatalogSnapshot("c1", "Big",
                records("a", RecordKind.ASSIGNMENT, 20),
                records("m", RecordKind.MATERIAL, 20),
                records("n", RecordKind.ANNOUNCEMENT, 20),
                START, false);
            RecordCache cache = cache(new RecordCacheConfig().withMaxBytes(sizeOf(big)));

            cache.set("c1", big);

            CatalogSnapshot stored = cache.get("c1").orElseThrow();
            assertTrue(stored.truncated());
            assertThat(stored.announcements()).isEmpty();
            assertEquals(20, stored.materials().size());
            assertEquals(20, stored.assignments().size());
        }

        @Test
        @DisplayName("빈 캐시에는 한도를 넘는 단일 항목도 저장된다")
        void singleOversizeEntryInEmptyCache() {
            RecordCache cache = cache(new RecordCacheConfig().withMaxBytes(100));

            cache.set("c1", largeSnapshot("c1", 1000));

            CacheStats stats = cache.stats();
            assertEquals(1, stats.entryCount());
            assertThat(cache.get("c1").orElseThrow().truncated()).isTrue();
        }
    }

    // ============================================================
    // 3. 저장소 쿼터
    // ============================================================

    @Nested
    @DisplayName("저장소 쿼터")
    class Quota {

        @Test
        @DisplayName("쿼터 초과 시 하나만 남기고 제거 후 재시도한다")
        void evictsDownToOneAndRetries() {
            // given
            long payload = sizeOf(largeSnapshot("c1", 10_000));
            store = new InMemoryKeyValueStore(payload * 3 + 5000);
            RecordCache cache = cache(new RecordCacheConfig().withMaxBytes(10L * 1024 * 1024));
            for (int i = 1; i <= 3; i++) {
                cache.set("c" + i, largeSnapshot("c" + i, 10_000));
                clock.advance(10);
            }

            // when
            cache.set("c4", largeSnapshot("c4", 10_000));

            // then
            assertThat(ids(cache.stats())).containsExactly("c3", "c4");
            assertThat(cache.get("c4")).isPresent();
        }

        @Test
        @DisplayName("메타데이터 기록만 쿼터를 넘어도 제거 후 재시도한다")
        void metadataQuotaTriggersFallback() {
            // given: 같은 순서로 기록했을 때의 총 사용량보다 1바이트 작은 쿼터
            InMemoryKeyValueStore unlimited = new InMemoryKeyValueStore();
            RecordCache dryRun = new RecordCache(unlimited, codec, new RecordCacheConfig(), new TestClock(START));
            for (String id : List.of("a", "b", "c")) {
                dryRun.set(id, snapshot(id));
            }
            store = new InMemoryKeyValueStore(unlimited.getBytesInUse() - 1);
            RecordCache cache = cache(new RecordCacheConfig());
            cache.set("a", snapshot("a"));
            cache.set("b", snapshot("b"));

            // when: c의 페이로드는 들어가고 메타데이터 기록이 거부됨
            cache.set("c", snapshot("c"));

            // then
            CacheStats stats = cache.stats();
            assertEquals(2, stats.entryCount());
            assertThat(ids(stats)).contains("c");
            assertThat(cache.get("c")).isPresent();
            assertTrue(store.get(RecordCache.DATA_KEY_PREFIX + "c").isPresent());
        }

        @Test
        @DisplayName("재시도도 실패하면 StorageException이 전파된다")
        void retryFailurePropagates() {
            long payload = sizeOf(largeSnapshot("c1", 10_000));
            store = new InMemoryKeyValueStore(payload / 2);
            RecordCache cache = cache(new RecordCacheConfig().withMaxBytes(10L * 1024 * 1024));

            StorageException thrown = assertThrows(StorageException.class,
                () -> cache.set("c1", largeSnapshot("c1", 10_000)));

            assertTrue(thrown.isQuotaExceeded());
            assertEquals(0, cache.stats().entryCount());
        }

        @Test
        @DisplayName("쿼터 이외의 저장 실패는 재시도 없이 전파된다")
        void nonQuotaFailurePropagates() {
            RecordCache cache = cache(new RecordCacheConfig());
            cache.set("c1", snapshot("c1"));
            store.failWritesFor(RecordCache.DATA_KEY_PREFIX);

            assertThatThrownBy(() -> cache.set("c2", snapshot("c2")))
                .isInstanceOf(StorageException.class);

            assertThat(ids(cache.stats())).containsExactly("c1");
        }
    }

    // ============================================================
    // 4. 조회, 만료, 자가 복구
    // ============================================================

    @Nested
    @DisplayName("조회")
    class Lookup {

        @Test
        @DisplayName("get은 사용 기록을 갱신한다")
        void getTouches() {
            RecordCache cache = cache(new RecordCacheConfig());
            cache.set("c1", snapshot("c1"));
            clock.advance(5000);

            cache.get("c1");

            CacheEntrySummary summary = cache.stats().entries().get(0);
            assertEquals(2, summary.accessCount());
            assertEquals(START + 5000, summary.lastAccessTime());
        }

        @Test
        @DisplayName("cachedItemCount는 사용 기록을 바꾸지 않는다")
        void itemCountDoesNotTouch() {
            RecordCache cache = cache(new RecordCacheConfig());
            cache.set("c1", snapshot("c1"));
            clock.advance(5000);

            assertEquals(1, cache.cachedItemCount("c1"));
            assertEquals(0, cache.cachedItemCount("missing"));

            CacheEntrySummary summary = cache.stats().entries().get(0);
            assertEquals(1, summary.accessCount());
            assertEquals(START, summary.lastAccessTime());
        }

        @Test
        @DisplayName("30일이 지난 항목은 만료되어 삭제된다")
        void expiresAfterMaxAge() {
            RecordCache cache = cache(new RecordCacheConfig());
            cache.set("c1", snapshot("c1"));

            clock.advance(31 * DAY_MS);

            assertThat(cache.get("c1")).isEmpty();
            assertThat(store.get(RecordCache.DATA_KEY_PREFIX + "c1")).isEmpty();
            assertEquals(0, cache.stats().entryCount());
        }

        @Test
        @DisplayName("페이로드가 사라진 메타데이터 항목은 다음 접근에서 정리된다")
        void healsMissingPayload() {
            RecordCache cache = cache(new RecordCacheConfig());
            cache.set("c1", snapshot("c1"));
            cache.set("c2", snapshot("c2"));

            store.remove(RecordCache.DATA_KEY_PREFIX + "c1");

            CacheStats stats = cache.stats();
            assertThat(ids(stats)).containsExactly("c2");
            assertEquals(sizeOf(snapshot("c2")), stats.totalSizeBytes());
        }

        @Test
        @DisplayName("메타데이터 없는 페이로드는 읽을 때 제거된다")
        void removesOrphanPayload() {
            RecordCache cache = cache(new RecordCacheConfig());
            store.set(RecordCache.DATA_KEY_PREFIX + "orphan", codec.write(snapshot("orphan")));

            assertThat(cache.get("orphan")).isEmpty();
            assertThat(store.get(RecordCache.DATA_KEY_PREFIX + "orphan")).isEmpty();
        }

        @Test
        @DisplayName("깨진 페이로드는 항목째 제거된다")
        void corruptPayloadRemoved() {
            RecordCache cache = cache(new RecordCacheConfig());
            cache.set("c1", snapshot("c1"));
            store.set(RecordCache.DATA_KEY_PREFIX + "c1", "{broken");

            assertThat(cache.get("c1")).isEmpty();
            assertEquals(0, cache.stats().entryCount());
        }

        @Test
        @DisplayName("깨진 메타데이터는 빈 캐시로 취급된다")
        void corruptMetadataTreatedAsEmpty() {
            RecordCache cache = cache(new RecordCacheConfig());
            store.set(RecordCache.METADATA_KEY, "[]");

            assertEquals(0, cache.stats().entryCount());
            cache.set("c1", snapshot("c1"));
            assertEquals(1, cache.stats().entryCount());
        }

        @Test
        @DisplayName("stats는 최근 사용 순으로 정렬된다")
        void statsOrderedByRecency() {
            RecordCache cache = cache(new RecordCacheConfig());
            cache.set("c1", snapshot("c1"));
            clock.advance(10);
            cache.set("c2", snapshot("c2"));
            clock.advance(10);
            cache.touch("c1");

            CacheStats stats = cache.stats();

            assertEquals("c1", stats.entries().get(0).collectionId());
            assertEquals(5, stats.maxEntries());
            assertEquals(2, stats.entryCount());
        }

        @Test
        void 빈_ID는_예외() {
            RecordCache cache = cache(new RecordCacheConfig());

            assertThatThrownBy(() -> cache.get(" "))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    // ============================================================
    // 5. 마지막 컬렉션
    // ============================================================

    @Nested
    @DisplayName("마지막 컬렉션")
    class LastCollection {

        @Test
        @DisplayName("기록한 컬렉션의 ID, 이름, 데이터를 돌려준다")
        void rememberLast() {
            RecordCache cache = cache(new RecordCacheConfig());
            cache.set("c1", snapshot("c1"));

            cache.setLastCollection("c1", "Biology");

            assertEquals("c1", cache.lastCollectionId().orElseThrow());
            assertEquals("Biology", cache.lastCollectionName().orElseThrow());
            assertEquals("c1", cache.lastCollectionData().orElseThrow().collectionId());
        }

        @Test
        @DisplayName("이름이 없으면 Unknown Course")
        void unknownName() {
            RecordCache cache = cache(new RecordCacheConfig());

            cache.setLastCollection("c9", null);

            assertEquals("Unknown Course", cache.lastCollectionName().orElseThrow());
            assertThat(cache.lastCollectionData()).isEmpty();
        }

        @Test
        @DisplayName("clearAll은 페이로드, 메타데이터, 포인터를 모두 지운다")
        void clearAllRemovesEverything() {
            RecordCache cache = cache(new RecordCacheConfig());
            cache.set("c1", snapshot("c1"));
            cache.set("c2", snapshot("c2"));
            cache.setLastCollection("c1", "Biology");
            store.set("unrelated", "keep");

            cache.clearAll();

            assertEquals(1, store.size());
            assertThat(store.get("unrelated")).contains("keep");
            assertEquals(0, cache.stats().entryCount());
        }

        @Test
        @DisplayName("clear는 한 항목만 지운다")
        void clearOne() {
            RecordCache cache = cache(new RecordCacheConfig());
            cache.set("c1", snapshot("c1"));
            cache.set("c2", snapshot("c2"));

            cache.clear("c1");

            assertThat(ids(cache.stats())).containsExactly("c2");
        }
    }
}
