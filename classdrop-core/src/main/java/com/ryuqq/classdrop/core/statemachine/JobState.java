package com.ryuqq.classdrop.core.statemachine;

/**
 * 다운로드 작업(DownloadJob)의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING
 *    │
 *    ├─► CANCELLED (배치 취소로 시작되지 못함)
 *    │
 *    ▼ (디스패처가 꺼냄)
 * ACTIVE
 *    │
 *    ├─► SUCCEEDED (저장 완료)
 *    ├─► FAILED (영구 실패 또는 재시도 소진)
 *    └─► CANCELLED (취소 후 재시도 포기)
 *
 * 금지된 전이:
 * - 종료 상태 → 모든 상태 ❌
 * - ACTIVE → PENDING ❌
 * </pre>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public enum JobState {

    /**
     * 대기 중 (아직 디스패치되지 않음).
     */
    PENDING,

    /**
     * 전송 중.
     */
    ACTIVE,

    /**
     * 저장 완료.
     */
    SUCCEEDED,

    /**
     * 실패 (영구).
     */
    FAILED,

    /**
     * 취소됨.
     */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return SUCCEEDED, FAILED, CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
