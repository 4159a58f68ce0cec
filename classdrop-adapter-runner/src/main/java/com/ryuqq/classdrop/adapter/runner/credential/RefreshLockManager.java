package com.ryuqq.classdrop.adapter.runner.credential;

import com.ryuqq.classdrop.adapter.runner.support.JsonCodec;
import com.ryuqq.classdrop.core.model.RefreshLock;
import com.ryuqq.classdrop.core.spi.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * KV 저장소 기반 갱신 락.
 *
 * <p>프로세스가 갱신 도중 재시작될 수 있으므로 락은 메모리가 아닌
 * {@value #LOCK_KEY}에 저장됩니다. 방치된 락 (lockStaleMs 이상 경과)은 빼앗을 수 있습니다.</p>
 *
 * <p><strong>획득 절차:</strong></p>
 * <ol>
 *   <li>현재 락을 읽어 살아 있는 타인 소유면 실패</li>
 *   <li>자신의 lockId로 기록 (tentative write)</li>
 *   <li>다시 읽어 소유자가 자신인지 확인</li>
 * </ol>
 *
 * <p>2와 3은 프로세스 내 가드 아래에서 실행되므로 같은 프로세스의 두 호출자가
 * 동시에 소유를 확인하는 일은 없습니다.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
final class RefreshLockManager {

    private static final Logger log = LoggerFactory.getLogger(RefreshLockManager.class);

    static final String LOCK_KEY = "gcr_token_refresh_lock";

    private final KeyValueStore store;
    private final JsonCodec codec;
    private final CredentialConfig config;
    private final Clock clock;
    private final ReentrantLock guard = new ReentrantLock();

    RefreshLockManager(KeyValueStore store, JsonCodec codec, CredentialConfig config, Clock clock) {
        this.store = store;
        this.codec = codec;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 제한된 시간 동안 락 획득 시도.
     *
     * <p>대기 총량은 {@code lockWaitMs / lockPollMs}회의 폴링으로 제한됩니다.</p>
     *
     * @param lockId 호출자 락 ID
     * @return 획득했으면 true
     * @throws InterruptedException 폴링 대기 중 인터럽트
     */
    boolean acquire(String lockId) throws InterruptedException {
        long polls = Math.max(1, config.lockWaitMs() / config.lockPollMs());
        for (long attempt = 0; attempt <= polls; attempt++) {
            if (tryClaim(lockId)) {
                log.debug("Refresh lock acquired: lockId={}, attempt={}", lockId, attempt);
                return true;
            }
            if (attempt < polls) {
                Thread.sleep(config.lockPollMs());
            }
        }
        log.info("Refresh lock not acquired within {}ms: lockId={}", config.lockWaitMs(), lockId);
        return false;
    }

    /**
     * 락 해제. 저장된 lockId가 여전히 자신일 때만 제거합니다.
     *
     * @param lockId 호출자 락 ID
     */
    void release(String lockId) {
        guard.lock();
        try {
            Optional<RefreshLock> current = read();
            if (current.isPresent() && current.get().isOwnedBy(lockId)) {
                store.remove(LOCK_KEY);
                log.debug("Refresh lock released: lockId={}", lockId);
            } else {
                log.warn("Refresh lock no longer owned, leaving it in place: lockId={}, current={}",
                    lockId, current.map(RefreshLock::lockId).orElse(null));
            }
        } finally {
            guard.unlock();
        }
    }

    Optional<RefreshLock> read() {
        return store.get(LOCK_KEY).flatMap(json -> codec.read(json, RefreshLock.class));
    }

    private boolean tryClaim(String lockId) {
        guard.lock();
        try {
            long now = clock.millis();
            Optional<RefreshLock> current = read();
            if (current.isPresent() && !current.get().isOwnedBy(lockId)) {
                if (!current.get().isStale(now, config.lockStaleMs())) {
                    return false;
                }
                log.warn("Seizing stale refresh lock: owner={}, acquiredAt={}",
                    current.get().lockId(), current.get().acquiredAt());
            }

            store.set(LOCK_KEY, codec.write(new RefreshLock(lockId, now)));
            return read().map(lock -> lock.isOwnedBy(lockId)).orElse(false);
        } finally {
            guard.unlock();
        }
    }
}
