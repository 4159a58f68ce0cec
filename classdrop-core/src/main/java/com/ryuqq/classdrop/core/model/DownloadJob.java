package com.ryuqq.classdrop.core.model;

import com.ryuqq.classdrop.core.statemachine.JobState;
import com.ryuqq.classdrop.core.statemachine.StateTransition;

/**
 * 배치 안의 단일 다운로드 작업 (불변).
 *
 * <p>상태 변경은 새 인스턴스를 반환하며, 전이 규칙은
 * {@link StateTransition}이 검증합니다.</p>
 *
 * <p><strong>유일성:</strong> 한 배치 안에서 fileId는 중복되지 않습니다.
 * 중복은 제출 시점에 제거됩니다.</p>
 *
 * @param fileId 첨부 식별자
 * @param displayName 표시 이름 (파일명 원천)
 * @param source 원본 첨부
 * @param state 현재 상태
 * @param attemptCount 시도 횟수
 * @param lastError 마지막 오류 (없으면 null)
 * @author ClassDrop Team
 * @since 1.0.0
 */
public record DownloadJob(
    String fileId,
    String displayName,
    Attachment source,
    JobState state,
    int attemptCount,
    String lastError
) {

    public DownloadJob {
        if (fileId == null || fileId.isBlank()) {
            throw new IllegalArgumentException("fileId cannot be null or blank");
        }
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (attemptCount < 0) {
            throw new IllegalArgumentException("attemptCount must be non-negative (current: " + attemptCount + ")");
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = source.title();
        }
    }

    /**
     * 첨부로부터 대기 상태 작업 생성.
     *
     * @param source 첨부
     * @return PENDING 상태 작업
     */
    public static DownloadJob pending(Attachment source) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        return new DownloadJob(source.id(), source.title(), source, JobState.PENDING, 0, null);
    }

    /**
     * 상태 전이.
     *
     * @param next 다음 상태
     * @return 새 상태의 작업
     * @throws IllegalStateException 허용되지 않는 전이인 경우
     */
    public DownloadJob transitionTo(JobState next) {
        return new DownloadJob(fileId, displayName, source, StateTransition.transition(state, next), attemptCount, lastError);
    }

    /**
     * 시도 횟수 1 증가.
     *
     * @return 새 작업
     */
    public DownloadJob nextAttempt() {
        return new DownloadJob(fileId, displayName, source, state, attemptCount + 1, lastError);
    }

    public DownloadJob withLastError(String error) {
        return new DownloadJob(fileId, displayName, source, state, attemptCount, error);
    }
}
