package com.ryuqq.classdrop.adapter.runner.download;

import com.ryuqq.classdrop.adapter.runner.support.JsonCodec;
import com.ryuqq.classdrop.core.error.StorageException;
import com.ryuqq.classdrop.core.spi.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * 네트워크 장애로 실패한 파일의 영속 재시도 큐.
 *
 * <p>{@value #QUEUE_KEY}에 JSON 배열로 저장되며 재시작 후에도 남습니다.</p>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>fileId가 같은 항목은 한 번만 들어감</li>
 *   <li>최대 {@value #MAX_ITEMS}개, 가득 차면 가장 오래된 항목을 버림</li>
 *   <li>재생이 {@value #MAX_RETRIES}번 실패하면 큐에서 제거</li>
 * </ul>
 *
 * <p>저장소 쓰기 실패는 경고 로그만 남깁니다.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
final class OfflineRetryQueue {

    private static final Logger log = LoggerFactory.getLogger(OfflineRetryQueue.class);

    static final String QUEUE_KEY = "gcr_offline_queue";
    static final int MAX_ITEMS = 100;
    static final int MAX_RETRIES = 3;

    private final KeyValueStore store;
    private final JsonCodec codec;

    OfflineRetryQueue(KeyValueStore store, JsonCodec codec) {
        this.store = store;
        this.codec = codec;
    }

    /**
     * 항목 추가.
     *
     * @param item 추가할 항목
     * @return 추가되었으면 true, 같은 fileId가 이미 있으면 false
     */
    synchronized boolean add(OfflineQueueItem item) {
        List<OfflineQueueItem> items = load();
        if (items.stream().anyMatch(existing -> existing.fileId().equals(item.fileId()))) {
            log.debug("Already in offline queue: fileId={}", item.fileId());
            return false;
        }
        if (items.size() >= MAX_ITEMS) {
            OfflineQueueItem dropped = items.remove(0);
            log.warn("Offline queue full, dropping oldest item: fileId={}", dropped.fileId());
        }
        items.add(item);
        save(items);
        log.info("Added to offline queue: fileId={}, reason={}", item.fileId(), item.reason());
        return true;
    }

    synchronized List<OfflineQueueItem> items() {
        return List.copyOf(load());
    }

    synchronized void remove(String fileId) {
        List<OfflineQueueItem> items = load();
        if (items.removeIf(item -> item.fileId().equals(fileId))) {
            save(items);
        }
    }

    /**
     * 재생 실패 기록.
     *
     * @param fileId 실패한 항목
     * @param reason 실패 사유
     * @return 재생 한도에 도달해 큐에서 제거되었으면 true
     */
    synchronized boolean recordFailedRetry(String fileId, String reason) {
        List<OfflineQueueItem> items = load();
        for (int i = 0; i < items.size(); i++) {
            OfflineQueueItem item = items.get(i);
            if (!item.fileId().equals(fileId)) {
                continue;
            }
            OfflineQueueItem updated = item.withFailedRetry(reason);
            boolean exhausted = updated.retryCount() >= MAX_RETRIES;
            if (exhausted) {
                items.remove(i);
                log.warn("Giving up on offline item after {} retries: fileId={}", updated.retryCount(), fileId);
            } else {
                items.set(i, updated);
            }
            save(items);
            return exhausted;
        }
        return false;
    }

    synchronized void clear() {
        store.remove(QUEUE_KEY);
    }

    private List<OfflineQueueItem> load() {
        Optional<OfflineQueueItem[]> saved = store.get(QUEUE_KEY).flatMap(json -> codec.read(json, OfflineQueueItem[].class));
        return saved.map(array -> new ArrayList<>(Arrays.asList(array))).orElseGet(ArrayList::new);
    }

    private void save(List<OfflineQueueItem> items) {
        try {
            if (items.isEmpty()) {
                store.remove(QUEUE_KEY);
            } else {
                store.set(QUEUE_KEY, codec.write(items));
            }
        } catch (StorageException e) {
            log.warn("Failed to persist offline queue: {}", e.getMessage());
        }
    }
}
