package com.ryuqq.classdrop.core.statemachine;

/**
 * 다운로드 배치의 상태.
 *
 * <pre>
 * IDLE → RUNNING → (COMPLETED | CANCELLED)
 * </pre>
 *
 * <p>일부 항목이 실패해도 배치는 COMPLETED로 끝납니다 (failed 카운트로 구분).
 * 시작조차 못한 배치는 상태를 갖지 않고 제출 결과로만 보고됩니다.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public enum BatchState {

    IDLE,

    RUNNING,

    COMPLETED,

    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
