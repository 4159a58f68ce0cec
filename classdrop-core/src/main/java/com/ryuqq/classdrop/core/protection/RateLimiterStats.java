package com.ryuqq.classdrop.core.protection;

/**
 * Rate Limiter 관측용 스냅샷 (읽기 전용).
 *
 * @param availableTokens 현재 시점으로 보충을 투영한 가용 토큰 수
 * @param capacity 버킷 크기
 * @param refillPerSecond 초당 보충량
 * @param backingOff 백오프 윈도우 활성 여부
 * @param backoffRemainingMs 남은 백오프 시간
 * @param waiting 대기 중인 호출자 수
 * @param totalGranted 지금까지 허가된 수
 * @param totalThrottled 지금까지 보고된 429 수
 * @author ClassDrop Team
 * @since 1.0.0
 */
public record RateLimiterStats(
    double availableTokens,
    int capacity,
    double refillPerSecond,
    boolean backingOff,
    long backoffRemainingMs,
    int waiting,
    long totalGranted,
    long totalThrottled
) {
}
