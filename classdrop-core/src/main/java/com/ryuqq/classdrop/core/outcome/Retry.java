package com.ryuqq.classdrop.core.outcome;

import com.ryuqq.classdrop.core.error.ErrorCategory;

/**
 * 재시도 가능한 실패 결과.
 *
 * <p>429 스로틀링, 5xx, 타임아웃 같은 일시적 장애를 나타냅니다.</p>
 *
 * @param reason 실패 사유
 * @param category THROTTLED 또는 TRANSIENT
 * @param attemptCount 지금까지의 시도 횟수 (1부터)
 * @param nextRetryAfterMillis 다음 시도 전 대기 시간 (밀리초)
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public record Retry(
    String reason,
    ErrorCategory category,
    int attemptCount,
    long nextRetryAfterMillis
) implements Outcome {

    public Retry {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (category == null || !category.isRetryable()) {
            throw new IllegalArgumentException("category must be retryable (current: " + category + ")");
        }
        if (attemptCount < 1) {
            throw new IllegalArgumentException("attemptCount must be positive (current: " + attemptCount + ")");
        }
        if (nextRetryAfterMillis < 0) {
            throw new IllegalArgumentException("nextRetryAfterMillis must be non-negative (current: " + nextRetryAfterMillis + ")");
        }
    }

    public boolean isThrottled() {
        return category == ErrorCategory.THROTTLED;
    }

    /**
     * 재시도 예산이 남았는지 여부.
     *
     * @param maxAttempts 최대 시도 횟수
     * @return 다음 시도가 허용되면 true
     */
    public boolean hasBudget(int maxAttempts) {
        return attemptCount < maxAttempts;
    }
}
