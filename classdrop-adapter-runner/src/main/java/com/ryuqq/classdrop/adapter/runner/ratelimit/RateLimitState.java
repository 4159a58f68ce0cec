package com.ryuqq.classdrop.adapter.runner.ratelimit;

/**
 * 재시작 후에도 유지되는 레이트 리미터 상태.
 *
 * <p>대기열은 저장하지 않습니다. 재시작 시 대기 중이던 호출자는 이미 사라졌기 때문입니다.</p>
 *
 * @param tokens 버킷 잔량
 * @param lastRefill 마지막 보충 시각 (epoch millis)
 * @param backoffUntil 백오프 종료 시각 (epoch millis, 0이면 없음)
 * @author ClassDrop Team
 * @since 1.0.0
 */
public record RateLimitState(double tokens, long lastRefill, long backoffUntil) {
}
