package com.ryuqq.classdrop.adapter.runner.download;

import com.ryuqq.classdrop.adapter.runner.support.JsonCodec;
import com.ryuqq.classdrop.application.credential.CredentialService;
import com.ryuqq.classdrop.application.orchestrator.DownloadOrchestrator;
import com.ryuqq.classdrop.application.orchestrator.RejectReason;
import com.ryuqq.classdrop.application.orchestrator.SubmitResult;
import com.ryuqq.classdrop.core.error.CredentialException;
import com.ryuqq.classdrop.core.error.ErrorCategory;
import com.ryuqq.classdrop.core.model.BatchProgress;
import com.ryuqq.classdrop.core.model.CatalogSnapshot;
import com.ryuqq.classdrop.core.model.DownloadJob;
import com.ryuqq.classdrop.core.model.DriveFile;
import com.ryuqq.classdrop.core.outcome.Fail;
import com.ryuqq.classdrop.core.outcome.Outcome;
import com.ryuqq.classdrop.core.outcome.Retry;
import com.ryuqq.classdrop.core.protection.RateLimiter;
import com.ryuqq.classdrop.core.spi.ContentApi;
import com.ryuqq.classdrop.core.spi.FileSink;
import com.ryuqq.classdrop.core.spi.KeyValueStore;
import com.ryuqq.classdrop.core.statemachine.BatchState;
import com.ryuqq.classdrop.core.statemachine.JobState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Queue 기반 다운로드 배치 실행기.
 *
 * <p>제출된 배치를 디스패처 스레드가 제출 순서대로 꺼내 워커 풀에 넘기며,
 * 세마포어로 동시 전송 수를 concurrency 이하로 제한합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * submit(catalog, ids)
 *   ↓ running CAS (false → true), 실패 시 BATCH_ALREADY_ACTIVE
 *   ↓ BatchPlanner.plan → 비었으면 NOTHING_SELECTED / NOTHING_MATCHED
 *   ↓ credentials.ensureValidForBatch → 실패 시 CREDENTIAL_UNAVAILABLE
 *   ↓ progress 기록 후 즉시 반환
 * dispatcher:
 *   For each content job (abort 플래그 확인 → permit 획득 → worker 제출):
 *     worker: attempt → Ok | Retry (backoff 후 재시도) | Fail
 *   모든 작업 정착 → (취소되지 않았고 링크가 있으면) 매니페스트 저장
 *   → COMPLETED 또는 CANCELLED, running = false
 * </pre>
 *
 * <p><strong>취소:</strong> {@link #cancel()}은 abort 플래그만 설정합니다.
 * 이미 시작된 전송은 끝까지 진행되고, 새 작업은 꺼내지 않으며, 재시도 대기 중인 작업은 포기합니다.</p>
 *
 * <p><strong>오류 처리:</strong> 개별 작업 실패는 failed 카운트로만 집계되고 배치를 멈추지 않습니다.
 * 일부가 실패한 배치도 COMPLETED로 끝납니다. 배치 단위 실패(TERMINAL_BATCH)는 취소와 같이
 * 새 작업 디스패치를 멈추고 배치를 CANCELLED로 마감합니다.</p>
 *
 * <p><strong>오프라인 큐:</strong> 일시적 오류로 재시도 예산을 다 쓴 파일은 {@link OfflineRetryQueue}에 남고,
 * 연결이 돌아온 뒤 {@link #retryOfflineQueue()}로 다시 받습니다.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public final class QueueDownloadRunner implements DownloadOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(QueueDownloadRunner.class);

    private final CredentialService credentials;
    private final FileSink fileSink;
    private final DownloadRunnerConfig config;
    private final Clock clock;
    private final DownloadJobExecutor jobExecutor;
    private final BatchProgressTracker tracker;
    private final OfflineRetryQueue offlineQueue;
    private final ResourceManifestWriter manifestWriter = new ResourceManifestWriter();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean aborted = new AtomicBoolean(false);
    private final ExecutorService dispatcher;
    private final ExecutorService workers;
    private final Semaphore permits;

    /**
     * 생성자 (설정 기반 BackoffCalculator 사용).
     *
     * @param rateLimiter 레이트 리미터
     * @param credentials 자격 증명 서비스
     * @param contentApi 콘텐츠 API
     * @param fileSink 파일 저장소
     * @param store 진행 상황 저장소
     * @param codec JSON 직렬화기
     * @param config 설정
     * @param clock 시간 소스
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public QueueDownloadRunner(RateLimiter rateLimiter, CredentialService credentials, ContentApi contentApi,
                               FileSink fileSink, KeyValueStore store, JsonCodec codec,
                               DownloadRunnerConfig config, Clock clock) {
        this(rateLimiter, credentials, contentApi, fileSink, store, codec, config, clock,
            config == null ? null : new BackoffCalculator(config));
    }

    /**
     * 생성자 (커스텀 BackoffCalculator 주입).
     *
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public QueueDownloadRunner(RateLimiter rateLimiter, CredentialService credentials, ContentApi contentApi,
                               FileSink fileSink, KeyValueStore store, JsonCodec codec,
                               DownloadRunnerConfig config, Clock clock, BackoffCalculator backoffCalculator) {
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (credentials == null) {
            throw new IllegalArgumentException("credentials cannot be null");
        }
        if (contentApi == null) {
            throw new IllegalArgumentException("contentApi cannot be null");
        }
        if (fileSink == null) {
            throw new IllegalArgumentException("fileSink cannot be null");
        }
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
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }

        this.credentials = credentials;
        this.fileSink = fileSink;
        this.config = config;
        this.clock = clock;
        this.jobExecutor = new DownloadJobExecutor(rateLimiter, credentials, contentApi, fileSink, config, backoffCalculator);
        this.tracker = new BatchProgressTracker(store, codec, clock);
        this.offlineQueue = new OfflineRetryQueue(store, codec);
        this.dispatcher = Executors.newSingleThreadExecutor();
        this.workers = Executors.newFixedThreadPool(config.concurrency());
        this.permits = new Semaphore(config.concurrency());
    }

    @Override
    public SubmitResult submit(CatalogSnapshot catalog, Set<String> requestedIds) {
        if (catalog == null) {
            throw new IllegalArgumentException("catalog cannot be null");
        }
        if (!running.compareAndSet(false, true)) {
            log.info("Submission rejected: a batch is already running");
            return SubmitResult.rejected(RejectReason.BATCH_ALREADY_ACTIVE, "A download batch is already running");
        }

        boolean started = false;
        try {
            if (requestedIds == null || requestedIds.isEmpty()) {
                return SubmitResult.rejected(RejectReason.NOTHING_SELECTED, "No files selected");
            }

            BatchPlan plan = BatchPlanner.plan(catalog, requestedIds);
            if (!plan.hasWork()) {
                log.info("Submission rejected: none of {} requested ids matched collection {}",
                    requestedIds.size(), catalog.collectionId());
                return SubmitResult.rejected(RejectReason.NOTHING_MATCHED, "No files matched the selection");
            }

            try {
                credentials.ensureValidForBatch();
            } catch (CredentialException e) {
                log.error("Batch not started, no valid credential: kind={}, message={}", e.getKind(), e.getMessage());
                return SubmitResult.rejected(RejectReason.CREDENTIAL_UNAVAILABLE, e.getMessage());
            }

            aborted.set(false);
            tracker.start(plan.batchId(), plan.total());
            dispatcher.submit(() -> runBatch(plan));
            started = true;

            log.info("Batch started: batchId={}, contentJobs={}, links={}, total={}",
                plan.batchId(), plan.contentJobs().size(), plan.links().size(), plan.total());
            return SubmitResult.accepted(plan.batchId(), plan.total());
        } finally {
            if (!started) {
                running.set(false);
            }
        }
    }

    @Override
    public void cancel() {
        if (running.get() && aborted.compareAndSet(false, true)) {
            log.info("Batch cancellation requested: batchId={}", tracker.snapshot().batchId());
        }
    }

    @Override
    public BatchProgress progress() {
        return tracker.snapshot();
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    /**
     * 재시작 후 저장된 진행 상황 복원.
     *
     * <p>저장된 진행 상황이 active인데 이 프로세스에서 실행 중인 배치가 없으면
     * CANCELLED 배치로 보고합니다.</p>
     *
     * @return 복원된 진행 상황
     */
    public BatchProgress restoreProgress() {
        return tracker.restore(running.get());
    }

    /**
     * 오프라인 큐에 남은 파일 목록.
     *
     * @return 큐 스냅샷 (오래된 순)
     */
    public List<OfflineQueueItem> offlineQueue() {
        return offlineQueue.items();
    }

    public void clearOfflineQueue() {
        offlineQueue.clear();
    }

    /**
     * 오프라인 큐 재생.
     *
     * <p>호출 스레드에서 큐의 항목을 순서대로 다시 받습니다. 항목마다 배치와 같은 재시도 정책을 적용하며,
     * 성공하거나 항목 단위 영구 실패이면 큐에서 빼고, 일시적 오류로 끝나면 재생 실패 횟수를 올립니다.
     * 배치 단위 실패(자격 증명 없음 등)를 만나면 남은 항목을 그대로 두고 멈춥니다.
     * 배치와 동시에 실행되지 않습니다.</p>
     *
     * @return 재생 결과
     * @throws IllegalStateException 배치가 실행 중인 경우
     */
    public OfflineRetryResult retryOfflineQueue() {
        List<OfflineQueueItem> items = offlineQueue.items();
        if (items.isEmpty()) {
            return OfflineRetryResult.empty();
        }
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A download batch is already running");
        }

        int retried = 0;
        int failed = 0;
        try {
            log.info("Retrying offline queue: {} items", items.size());
            for (OfflineQueueItem item : items) {
                if (Thread.currentThread().isInterrupted()) {
                    break;
                }
                Outcome outcome = replay(item);
                if (outcome.isOk()) {
                    offlineQueue.remove(item.fileId());
                    retried++;
                } else if (outcome instanceof Fail fail) {
                    if (fail.affectsBatch()) {
                        log.error("Offline queue retry stopped: code={}, message={}", fail.errorCode(), fail.message());
                        break;
                    }
                    offlineQueue.remove(item.fileId());
                    failed++;
                    log.warn("Offline item failed permanently: fileId={}, code={}", item.fileId(), fail.errorCode());
                } else if (offlineQueue.recordFailedRetry(item.fileId(), ((Retry) outcome).reason())) {
                    failed++;
                }
            }
        } finally {
            running.set(false);
        }

        OfflineRetryResult result = new OfflineRetryResult(retried, failed, offlineQueue.items().size());
        log.info("Offline queue retry finished: retried={}, failed={}, remaining={}",
            result.retried(), result.failed(), result.remaining());
        return result;
    }

    /**
     * Runner 종료 (리소스 정리).
     *
     * <p>디스패처와 워커 풀을 graceful shutdown하여 진행 중인 작업이
     * 완료되도록 대기하고, 시간 안에 끝나지 않으면 강제 종료합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        dispatcher.shutdown();
        if (!dispatcher.awaitTermination(config.shutdownTimeoutSeconds(), TimeUnit.SECONDS)) {
            dispatcher.shutdownNow();
        }
        workers.shutdown();
        if (!workers.awaitTermination(config.shutdownTimeoutSeconds(), TimeUnit.SECONDS)) {
            workers.shutdownNow();
        }
    }

    // ==================== 배치 실행 ====================

    private void runBatch(BatchPlan plan) {
        BatchState terminal = BatchState.COMPLETED;
        try {
            List<Future<?>> inFlight = new ArrayList<>();
            for (PlannedJob planned : plan.contentJobs()) {
                if (aborted.get()) {
                    break;
                }
                permits.acquire();
                if (aborted.get()) {
                    permits.release();
                    break;
                }
                inFlight.add(workers.submit(() -> {
                    try {
                        runJob(planned);
                    } finally {
                        permits.release();
                    }
                }));
            }

            awaitAll(inFlight);

            if (aborted.get()) {
                terminal = BatchState.CANCELLED;
            } else if (plan.hasLinks()) {
                writeManifest(plan);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Batch dispatcher interrupted: batchId={}", plan.batchId());
            terminal = BatchState.CANCELLED;
        } catch (RuntimeException e) {
            log.error("Batch dispatcher failed: batchId={}", plan.batchId(), e);
        } finally {
            BatchProgress finished = tracker.finish(terminal);
            running.set(false);
            log.info("Batch finished: batchId={}, state={}, completed={}, failed={}, total={}",
                finished.batchId(), finished.state(), finished.completed(), finished.failed(), finished.total());
        }
    }

    private void runJob(PlannedJob planned) {
        DownloadJob job = planned.job().transitionTo(JobState.ACTIVE);
        tracker.currentFile(job.displayName());

        while (true) {
            job = job.nextAttempt();
            Outcome outcome = jobExecutor.attempt(job, planned.path());

            if (outcome.isOk()) {
                job.transitionTo(JobState.SUCCEEDED);
                tracker.recordCompleted();
                return;
            }

            if (outcome instanceof Fail fail) {
                job.withLastError(fail.message()).transitionTo(JobState.FAILED);
                tracker.recordFailed();
                if (fail.affectsBatch()) {
                    aborted.set(true);
                    log.error("Batch-level failure, stopping dispatch: fileId={}, code={}, message={}",
                        job.fileId(), fail.errorCode(), fail.message());
                } else {
                    log.warn("Download failed: fileId={}, code={}, message={}", job.fileId(), fail.errorCode(), fail.message());
                }
                return;
            }

            Retry retry = (Retry) outcome;
            job = job.withLastError(retry.reason());
            if (!retry.hasBudget(config.maxAttempts())) {
                job.transitionTo(JobState.FAILED);
                tracker.recordFailed();
                log.warn("Retry budget exhausted: fileId={}, attempts={}, lastError={}",
                    job.fileId(), retry.attemptCount(), retry.reason());
                if (retry.category() == ErrorCategory.TRANSIENT) {
                    offlineQueue.add(OfflineQueueItem.of((DriveFile) job.source(), planned.path(), retry.reason(),
                        clock.millis()));
                }
                return;
            }
            if (aborted.get()) {
                job.transitionTo(JobState.CANCELLED);
                tracker.recordFailed();
                log.info("Retry abandoned after cancellation: fileId={}", job.fileId());
                return;
            }

            log.info("Retry scheduled: fileId={}, throttled={}, after {}ms (attempt {})",
                job.fileId(), retry.isThrottled(), retry.nextRetryAfterMillis(), retry.attemptCount());
            if (!sleep(retry.nextRetryAfterMillis())) {
                job.transitionTo(JobState.CANCELLED);
                tracker.recordFailed();
                return;
            }
        }
    }

    private Outcome replay(OfflineQueueItem item) {
        DownloadJob job = DownloadJob.pending(item.toDriveFile()).transitionTo(JobState.ACTIVE);
        while (true) {
            job = job.nextAttempt();
            Outcome outcome = jobExecutor.attempt(job, item.path());
            if (!(outcome instanceof Retry retry)) {
                return outcome;
            }
            if (!retry.hasBudget(config.maxAttempts()) || !sleep(retry.nextRetryAfterMillis())) {
                return retry;
            }
        }
    }

    private void writeManifest(BatchPlan plan) {
        String path = plan.batchId() + "/" + ResourceManifestWriter.FILE_NAME;
        tracker.currentFile(ResourceManifestWriter.FILE_NAME);
        String content = manifestWriter.write(plan.collectionName(), plan.links(), clock.instant());
        try {
            fileSink.save(path, content.getBytes(StandardCharsets.UTF_8));
            tracker.recordCompleted();
            log.info("Links manifest saved: {} ({} items)", path, plan.links().size());
        } catch (IOException e) {
            tracker.recordFailed();
            log.error("Failed to save links manifest: {}", path, e);
        }
    }

    private void awaitAll(List<Future<?>> futures) throws InterruptedException {
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                log.error("Download worker failed unexpectedly", e.getCause());
            }
        }
    }

    /**
     * Sleep (재시도 간격 대기).
     *
     * <p>InterruptedException 발생 시 현재 스레드의 인터럽트 플래그를 복원합니다.</p>
     *
     * @param millis 대기 시간 (밀리초)
     * @return 끝까지 대기했으면 true, 인터럽트되었으면 false
     */
    private boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Retry wait interrupted");
            return false;
        }
    }
}
