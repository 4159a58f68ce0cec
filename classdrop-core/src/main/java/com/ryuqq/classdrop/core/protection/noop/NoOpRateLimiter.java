package com.ryuqq.classdrop.core.protection.noop;

import com.ryuqq.classdrop.core.protection.Priority;
import com.ryuqq.classdrop.core.protection.RateLimiter;
import com.ryuqq.classdrop.core.protection.RateLimiterConfig;
import com.ryuqq.classdrop.core.protection.RateLimiterStats;

/**
 * Rate Limiter NoOp 구현.
 *
 * <p>모든 요청을 즉시 허가합니다. 429 보고는 무시됩니다.
 * 테스트나 오프라인 도구처럼 속도 제한이 필요 없을 때 사용합니다.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public final class NoOpRateLimiter implements RateLimiter {

    private static final RateLimiterConfig UNLIMITED_CONFIG =
        new RateLimiterConfig(Integer.MAX_VALUE, Double.MAX_VALUE, 1, 1);

    @Override
    public void acquire(Priority priority) {
        // 항상 즉시 허가
    }

    @Override
    public boolean tryAcquire() {
        return true;
    }

    @Override
    public void report429(String retryAfterValue) {
        // 백오프 없음
    }

    @Override
    public void clearBackoff() {
        // 백오프 없음
    }

    @Override
    public RateLimiterStats stats() {
        return new RateLimiterStats(Integer.MAX_VALUE, Integer.MAX_VALUE, Double.MAX_VALUE, false, 0, 0, 0, 0);
    }

    @Override
    public RateLimiterConfig getConfig() {
        return UNLIMITED_CONFIG;
    }
}
