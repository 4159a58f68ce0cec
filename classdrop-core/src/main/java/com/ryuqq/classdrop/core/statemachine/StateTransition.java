package com.ryuqq.classdrop.core.statemachine;

/**
 * 상태 전이 검증 및 실행.
 *
 * <p>작업과 배치의 상태 전이가 허용된 규칙을 따르는지 검증합니다.</p>
 *
 * <p><strong>작업 전이:</strong></p>
 * <ul>
 *   <li>PENDING → ACTIVE | CANCELLED</li>
 *   <li>ACTIVE → SUCCEEDED | FAILED | CANCELLED</li>
 * </ul>
 *
 * <p><strong>배치 전이:</strong></p>
 * <ul>
 *   <li>IDLE → RUNNING</li>
 *   <li>RUNNING → COMPLETED | CANCELLED</li>
 *   <li>COMPLETED, CANCELLED → RUNNING (새 배치 시작 시 초기화)</li>
 * </ul>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 작업 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(JobState from, JobState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        // 종료 상태에서는 어디로도 전이 불가
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid;
        switch (from) {
            case PENDING:
                valid = to == JobState.ACTIVE || to == JobState.CANCELLED;
                break;
            case ACTIVE:
                valid = to == JobState.SUCCEEDED || to == JobState.FAILED || to == JobState.CANCELLED;
                break;
            default:
                valid = false;
        }

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 배치 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(BatchState from, BatchState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        boolean valid;
        if (from == BatchState.RUNNING) {
            valid = to.isTerminal();
        } else {
            // IDLE 또는 이전 배치의 종료 상태에서는 새 배치 시작만 가능
            valid = to == BatchState.RUNNING;
        }

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid batch transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 작업 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static JobState transition(JobState current, JobState next) {
        validate(current, next);
        return next;
    }

    /**
     * 배치 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static BatchState transition(BatchState current, BatchState next) {
        validate(current, next);
        return next;
    }
}
