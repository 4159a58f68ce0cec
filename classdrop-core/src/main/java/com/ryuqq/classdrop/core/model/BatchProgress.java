package com.ryuqq.classdrop.core.model;

import com.ryuqq.classdrop.core.statemachine.BatchState;

/**
 * 실행 중(또는 마지막) 배치의 진행 상황 스냅샷 (불변).
 *
 * <p>DownloadOrchestrator만 새 스냅샷을 만들고, 외부에서는 읽기만 합니다.
 * 매 변경마다 KV 저장소에 기록되어 프로세스 재시작 후에도 조회할 수 있습니다.</p>
 *
 * @param batchId 배치 식별자 (배치 폴더 이름)
 * @param total 전체 작업 수 (링크 매니페스트 포함)
 * @param completed 성공한 작업 수
 * @param failed 실패한 작업 수
 * @param currentFile 마지막으로 시작된 파일 이름 (없으면 null)
 * @param active 배치 루프가 아직 돌고 있는지
 * @param state 배치 상태
 * @param startedAt 시작 시각 (epoch millis)
 * @param finishedAt 종료 시각 (진행 중이면 0)
 * @author ClassDrop Team
 * @since 1.0.0
 */
public record BatchProgress(
    String batchId,
    int total,
    int completed,
    int failed,
    String currentFile,
    boolean active,
    BatchState state,
    long startedAt,
    long finishedAt
) {

    private static final BatchProgress IDLE = new BatchProgress(null, 0, 0, 0, null, false, BatchState.IDLE, 0, 0);

    public BatchProgress {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (total < 0 || completed < 0 || failed < 0) {
            throw new IllegalArgumentException(
                "counts must be non-negative (total: " + total + ", completed: " + completed + ", failed: " + failed + ")"
            );
        }
    }

    /**
     * 배치가 한 번도 실행되지 않은 상태.
     *
     * @return IDLE 스냅샷
     */
    public static BatchProgress idle() {
        return IDLE;
    }

    /**
     * 새 배치 시작 스냅샷.
     *
     * @param batchId 배치 식별자
     * @param total 전체 작업 수
     * @param now 시작 시각
     * @return RUNNING 스냅샷 (completed=0, failed=0, active=true)
     */
    public static BatchProgress started(String batchId, int total, long now) {
        return new BatchProgress(batchId, total, 0, 0, null, true, BatchState.RUNNING, now, 0);
    }

    public BatchProgress withCurrentFile(String fileName) {
        return new BatchProgress(batchId, total, completed, failed, fileName, active, state, startedAt, finishedAt);
    }

    public BatchProgress withCompleted() {
        return new BatchProgress(batchId, total, completed + 1, failed, currentFile, active, state, startedAt, finishedAt);
    }

    public BatchProgress withFailed() {
        return new BatchProgress(batchId, total, completed, failed + 1, currentFile, active, state, startedAt, finishedAt);
    }

    /**
     * 종료 스냅샷.
     *
     * @param terminal COMPLETED 또는 CANCELLED
     * @param now 종료 시각
     * @return active=false 스냅샷
     */
    public BatchProgress finish(BatchState terminal, long now) {
        if (terminal == null || !terminal.isTerminal()) {
            throw new IllegalArgumentException("terminal must be a terminal state (current: " + terminal + ")");
        }
        return new BatchProgress(batchId, total, completed, failed, currentFile, false, terminal, startedAt, now);
    }

    /**
     * 처리된 작업 수 (성공 + 실패).
     *
     * @return settled 수
     */
    public int settled() {
        return completed + failed;
    }

    /**
     * 진행률 (0~100).
     *
     * @return 백분율, total이 0이면 0
     */
    public int percent() {
        return total == 0 ? 0 : (int) Math.round(settled() * 100.0 / total);
    }

    public boolean hasFailures() {
        return failed > 0;
    }
}
