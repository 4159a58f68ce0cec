package com.ryuqq.classdrop.adapter.runner.catalog;

import com.ryuqq.classdrop.adapter.runner.cache.RecordCache;
import com.ryuqq.classdrop.adapter.runner.support.JsonCodec;
import com.ryuqq.classdrop.application.credential.CredentialService;
import com.ryuqq.classdrop.core.error.ApiException;
import com.ryuqq.classdrop.core.error.CredentialException;
import com.ryuqq.classdrop.core.error.StorageException;
import com.ryuqq.classdrop.core.model.CatalogSnapshot;
import com.ryuqq.classdrop.core.model.CollectionId;
import com.ryuqq.classdrop.core.protection.Priority;
import com.ryuqq.classdrop.core.protection.RateLimiter;
import com.ryuqq.classdrop.core.spi.CatalogApi;
import com.ryuqq.classdrop.core.spi.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.Optional;

/**
 * 캐시 우선 카탈로그 조회기.
 *
 * <p><strong>조회 절차:</strong></p>
 * <ol>
 *   <li>강제 갱신이 아니면 RecordCache 조회 (hit이면 마지막 컬렉션으로 기록 후 반환)</li>
 *   <li>같은 컬렉션 조회가 이미 진행 중이면 거부</li>
 *   <li>{@value #FETCH_IN_PROGRESS_KEY} 표시 후 HIGH 우선순위로 카탈로그 API 호출</li>
 *   <li>401이면 자격 증명을 갱신해 한 번 더 시도</li>
 *   <li>결과를 캐시에 저장하고 마지막 컬렉션으로 기록</li>
 * </ol>
 *
 * <p>진행 중 표시는 2분이 지나면 방치된 것으로 보고 무시합니다. 표시 확인과 기록은 이 인스턴스 안에서
 * 원자적으로 수행되며, 조회가 끝나면 자신이 남긴 표시일 때만 지웁니다.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public class CatalogFetcher {

    private static final Logger log = LoggerFactory.getLogger(CatalogFetcher.class);

    public static final String FETCH_IN_PROGRESS_KEY = "gcr_fetch_in_progress";
    static final long FETCH_STALE_MS = 2 * 60 * 1000L;

    private final CatalogApi catalogApi;
    private final RateLimiter rateLimiter;
    private final CredentialService credentials;
    private final RecordCache cache;
    private final KeyValueStore store;
    private final JsonCodec codec;
    private final Clock clock;
    private final Object markerLock = new Object();

    public CatalogFetcher(CatalogApi catalogApi, RateLimiter rateLimiter, CredentialService credentials,
                          RecordCache cache, KeyValueStore store, JsonCodec codec, Clock clock) {
        if (catalogApi == null) {
            throw new IllegalArgumentException("catalogApi cannot be null");
        }
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (credentials == null) {
            throw new IllegalArgumentException("credentials cannot be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.catalogApi = catalogApi;
        this.rateLimiter = rateLimiter;
        this.credentials = credentials;
        this.cache = cache;
        this.store = store;
        this.codec = codec;
        this.clock = clock;
    }

    /**
     * 카탈로그 조회.
     *
     * @param collectionId 컬렉션 ID
     * @param forceRefresh true면 캐시를 건너뜀
     * @return 카탈로그
     * @throws ApiException 원격 서비스가 실패 응답을 준 경우
     * @throws IOException 전송 실패
     * @throws CredentialException 자격 증명을 얻지 못한 경우
     * @throws InterruptedException 레이트 리미터 대기 중 인터럽트
     * @throws IllegalStateException 같은 컬렉션 조회가 이미 진행 중인 경우
     */
    public CatalogSnapshot fetch(CollectionId collectionId, boolean forceRefresh)
        throws ApiException, IOException, CredentialException, InterruptedException {
        if (collectionId == null) {
            throw new IllegalArgumentException("collectionId cannot be null");
        }
        String id = collectionId.getValue();

        if (!forceRefresh) {
            Optional<CatalogSnapshot> cached = cache.get(id);
            if (cached.isPresent()) {
                log.debug("Catalog cache hit: collectionId={}", id);
                cache.setLastCollection(id, cached.get().collectionName());
                return cached.get();
            }
        }

        FetchMarker ours = claimMarker(id);
        try {
            CatalogSnapshot snapshot = fetchRemote(collectionId);
            try {
                cache.set(id, snapshot);
                cache.setLastCollection(id, snapshot.collectionName());
            } catch (StorageException e) {
                log.warn("Catalog fetched but could not be cached: collectionId={}, {}", id, e.getMessage());
            }
            return snapshot;
        } finally {
            releaseMarker(ours);
        }
    }

    /**
     * 진행 중인 조회 표시 (방치된 표시는 제거하고 빈 값).
     *
     * @return 진행 중인 조회
     */
    public Optional<FetchMarker> inProgress() {
        Optional<FetchMarker> marker = store.get(FETCH_IN_PROGRESS_KEY)
            .flatMap(json -> codec.read(json, FetchMarker.class));
        if (marker.isPresent() && clock.millis() - marker.get().startTime() > FETCH_STALE_MS) {
            log.info("Clearing stale fetch marker: collectionId={}", marker.get().collectionId());
            store.remove(FETCH_IN_PROGRESS_KEY);
            return Optional.empty();
        }
        return marker;
    }

    private FetchMarker claimMarker(String id) {
        synchronized (markerLock) {
            Optional<FetchMarker> marker = inProgress();
            if (marker.isPresent() && marker.get().collectionId().equals(id)) {
                throw new IllegalStateException("Fetch already in progress for collection: " + id);
            }
            FetchMarker ours = new FetchMarker(id, clock.millis());
            store.set(FETCH_IN_PROGRESS_KEY, codec.write(ours));
            return ours;
        }
    }

    private void releaseMarker(FetchMarker ours) {
        synchronized (markerLock) {
            Optional<FetchMarker> current = store.get(FETCH_IN_PROGRESS_KEY)
                .flatMap(json -> codec.read(json, FetchMarker.class));
            if (current.isPresent() && current.get().equals(ours)) {
                store.remove(FETCH_IN_PROGRESS_KEY);
            } else {
                log.debug("Fetch marker was replaced by another fetch, leaving it: collectionId={}", ours.collectionId());
            }
        }
    }

    private CatalogSnapshot fetchRemote(CollectionId collectionId)
        throws ApiException, IOException, CredentialException, InterruptedException {
        String token = credentials.getToken(true);
        try {
            return rateLimiter.execute(Priority.HIGH, () -> catalogApi.fetchCollection(collectionId, token));
        } catch (ApiException e) {
            if (e.getStatus() != 401) {
                throw e;
            }
            log.info("Catalog request unauthorized, refreshing credential and retrying once");
            String refreshed = credentials.refresh(true);
            return rateLimiter.execute(Priority.HIGH, () -> catalogApi.fetchCollection(collectionId, refreshed));
        }
    }
}
