package com.ryuqq.classdrop.core.protection;

/**
 * Rate Limiter 설정.
 *
 * <p>Token Bucket과 429 백오프 동작을 제어하는 설정 정보입니다.</p>
 *
 * @param capacity 버킷 크기 (최대 버스트, 기본 90)
 * @param refillPerSecond 초당 토큰 보충량 (기본 1.5)
 * @param initialBackoffMs Retry-After를 해석할 수 없을 때의 기본 백오프 (기본 2000ms)
 * @param maxBackoffMs 백오프 상한 (기본 64000ms)
 * @author ClassDrop Team
 * @since 1.0.0
 */
public record RateLimiterConfig(
    int capacity,
    double refillPerSecond,
    long initialBackoffMs,
    long maxBackoffMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: capacity=90, refillPerSecond=1.5, initialBackoffMs=2000, maxBackoffMs=64000</p>
     */
    public RateLimiterConfig() {
        this(90, 1.5, 2000, 64000);
    }

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RateLimiterConfig {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        if (refillPerSecond <= 0 || Double.isNaN(refillPerSecond)) {
            throw new IllegalArgumentException("refillPerSecond must be positive (current: " + refillPerSecond + ")");
        }
        if (initialBackoffMs <= 0) {
            throw new IllegalArgumentException("initialBackoffMs must be positive (current: " + initialBackoffMs + ")");
        }
        if (maxBackoffMs < initialBackoffMs) {
            throw new IllegalArgumentException(
                "maxBackoffMs must be >= initialBackoffMs (initial: " + initialBackoffMs + ", max: " + maxBackoffMs + ")"
            );
        }
    }

    public RateLimiterConfig withCapacity(int capacity) {
        return new RateLimiterConfig(capacity, refillPerSecond, initialBackoffMs, maxBackoffMs);
    }

    public RateLimiterConfig withRefillPerSecond(double refillPerSecond) {
        return new RateLimiterConfig(capacity, refillPerSecond, initialBackoffMs, maxBackoffMs);
    }

    public RateLimiterConfig withInitialBackoffMs(long initialBackoffMs) {
        return new RateLimiterConfig(capacity, refillPerSecond, initialBackoffMs, maxBackoffMs);
    }

    public RateLimiterConfig withMaxBackoffMs(long maxBackoffMs) {
        return new RateLimiterConfig(capacity, refillPerSecond, initialBackoffMs, maxBackoffMs);
    }
}
