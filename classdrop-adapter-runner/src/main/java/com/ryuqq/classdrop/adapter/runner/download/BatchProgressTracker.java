package com.ryuqq.classdrop.adapter.runner.download;

import com.ryuqq.classdrop.adapter.runner.support.JsonCodec;
import com.ryuqq.classdrop.core.error.StorageException;
import com.ryuqq.classdrop.core.model.BatchProgress;
import com.ryuqq.classdrop.core.spi.KeyValueStore;
import com.ryuqq.classdrop.core.statemachine.BatchState;
import com.ryuqq.classdrop.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * 배치 진행 상황 소유자.
 *
 * <p>모든 변경은 이 클래스의 메서드를 거치며, 변경마다 {@value #PROGRESS_KEY}에 기록됩니다.
 * 외부에는 불변 스냅샷만 노출합니다.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
final class BatchProgressTracker {

    private static final Logger log = LoggerFactory.getLogger(BatchProgressTracker.class);

    static final String PROGRESS_KEY = "gcr_download_progress";

    private final KeyValueStore store;
    private final JsonCodec codec;
    private final Clock clock;

    private volatile BatchProgress current = BatchProgress.idle();

    BatchProgressTracker(KeyValueStore store, JsonCodec codec, Clock clock) {
        this.store = store;
        this.codec = codec;
        this.clock = clock;
    }

    BatchProgress snapshot() {
        return current;
    }

    synchronized void start(String batchId, int total) {
        StateTransition.validate(current.state(), BatchState.RUNNING);
        update(BatchProgress.started(batchId, total, clock.millis()));
    }

    synchronized void currentFile(String fileName) {
        update(current.withCurrentFile(fileName));
    }

    synchronized void recordCompleted() {
        update(current.withCompleted());
    }

    synchronized void recordFailed() {
        update(current.withFailed());
    }

    synchronized BatchProgress finish(BatchState terminal) {
        StateTransition.validate(current.state(), terminal);
        update(current.finish(terminal, clock.millis()));
        return current;
    }

    /**
     * 재시작 후 저장된 진행 상황 복원.
     *
     * <p>저장된 값이 active인데 살아 있는 배치가 없으면 중단된 것이므로
     * CANCELLED로 마감하고 다시 기록합니다.</p>
     *
     * @param liveBatch 현재 프로세스에서 배치가 실행 중인지 여부
     * @return 복원된 진행 상황
     */
    synchronized BatchProgress restore(boolean liveBatch) {
        if (liveBatch) {
            return current;
        }
        Optional<BatchProgress> saved = store.get(PROGRESS_KEY).flatMap(json -> codec.read(json, BatchProgress.class));
        if (saved.isEmpty()) {
            return current;
        }

        BatchProgress progress = saved.get();
        if (progress.active() || !progress.state().isTerminal() && progress.state() != BatchState.IDLE) {
            log.warn("Batch {} was interrupted by a restart at {}/{}, marking as cancelled",
                progress.batchId(), progress.settled(), progress.total());
            progress = progress.finish(BatchState.CANCELLED, clock.millis());
            current = progress;
            persist();
        } else {
            current = progress;
        }
        return current;
    }

    private void update(BatchProgress next) {
        current = next;
        persist();
    }

    private void persist() {
        try {
            store.set(PROGRESS_KEY, codec.write(current));
        } catch (StorageException e) {
            log.warn("Failed to persist batch progress: {}", e.getMessage());
        }
    }
}
