package com.ryuqq.classdrop.adapter.runner.credential;

/**
 * CredentialManager 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>lifetimeMs: 추정 토큰 수명 (기본 60분)</li>
 *   <li>expiryBufferMs: 만료 안전 여유 (기본 5분)</li>
 *   <li>proactiveIntervalMinutes: 선제 갱신 주기 (기본 50분)</li>
 *   <li>lockWaitMs / lockPollMs / lockStaleMs: 갱신 락 대기 총량, 폴링 간격, 방치 판정 (기본 15초 / 500ms / 10초)</li>
 *   <li>contentionPauseMs: 락 경합 시 기존 토큰 재사용 전 대기 (기본 2초)</li>
 *   <li>minRemainingLifetimeSeconds: 배치 시작 전 요구되는 최소 잔여 수명 (기본 600초)</li>
 * </ul>
 *
 * @param lifetimeMs 토큰 수명 (밀리초)
 * @param expiryBufferMs 만료 여유 (밀리초, lifetimeMs보다 작아야 함)
 * @param proactiveIntervalMinutes 선제 갱신 주기 (분)
 * @param lockWaitMs 락 획득 최대 대기 (밀리초)
 * @param lockPollMs 락 폴링 간격 (밀리초)
 * @param lockStaleMs 락 방치 판정 시간 (밀리초)
 * @param contentionPauseMs 경합 시 대기 (밀리초)
 * @param minRemainingLifetimeSeconds 배치 시작 최소 잔여 수명 (초)
 * @author ClassDrop Team
 * @since 1.0.0
 */
public record CredentialConfig(
    long lifetimeMs,
    long expiryBufferMs,
    long proactiveIntervalMinutes,
    long lockWaitMs,
    long lockPollMs,
    long lockStaleMs,
    long contentionPauseMs,
    long minRemainingLifetimeSeconds
) {

    /**
     * 기본 설정 생성자.
     */
    public CredentialConfig() {
        this(60 * 60 * 1000L, 5 * 60 * 1000L, 50, 15_000, 500, 10_000, 2_000, 600);
    }

    public CredentialConfig {
        if (lifetimeMs <= 0) {
            throw new IllegalArgumentException("lifetimeMs must be positive (current: " + lifetimeMs + ")");
        }
        if (expiryBufferMs < 0 || expiryBufferMs >= lifetimeMs) {
            throw new IllegalArgumentException(
                "expiryBufferMs must be in [0, lifetimeMs) (buffer: " + expiryBufferMs + ", lifetime: " + lifetimeMs + ")"
            );
        }
        if (proactiveIntervalMinutes <= 0) {
            throw new IllegalArgumentException(
                "proactiveIntervalMinutes must be positive (current: " + proactiveIntervalMinutes + ")"
            );
        }
        if (lockPollMs <= 0) {
            throw new IllegalArgumentException("lockPollMs must be positive (current: " + lockPollMs + ")");
        }
        if (lockWaitMs < lockPollMs) {
            throw new IllegalArgumentException(
                "lockWaitMs must be >= lockPollMs (wait: " + lockWaitMs + ", poll: " + lockPollMs + ")"
            );
        }
        if (lockStaleMs <= 0) {
            throw new IllegalArgumentException("lockStaleMs must be positive (current: " + lockStaleMs + ")");
        }
        if (contentionPauseMs < 0) {
            throw new IllegalArgumentException("contentionPauseMs must be non-negative (current: " + contentionPauseMs + ")");
        }
        if (minRemainingLifetimeSeconds < 0) {
            throw new IllegalArgumentException(
                "minRemainingLifetimeSeconds must be non-negative (current: " + minRemainingLifetimeSeconds + ")"
            );
        }
    }

    /**
     * 캐시된 토큰을 신뢰하는 최대 경과 시간.
     *
     * @return lifetimeMs - expiryBufferMs
     */
    public long trustedAgeMs() {
        return lifetimeMs - expiryBufferMs;
    }

    public CredentialConfig withLifetimeMs(long lifetimeMs) {
        return new CredentialConfig(lifetimeMs, expiryBufferMs, proactiveIntervalMinutes,
            lockWaitMs, lockPollMs, lockStaleMs, contentionPauseMs, minRemainingLifetimeSeconds);
    }

    public CredentialConfig withExpiryBufferMs(long expiryBufferMs) {
        return new CredentialConfig(lifetimeMs, expiryBufferMs, proactiveIntervalMinutes,
            lockWaitMs, lockPollMs, lockStaleMs, contentionPauseMs, minRemainingLifetimeSeconds);
    }

    public CredentialConfig withProactiveIntervalMinutes(long proactiveIntervalMinutes) {
        return new CredentialConfig(lifetimeMs, expiryBufferMs, proactiveIntervalMinutes,
            lockWaitMs, lockPollMs, lockStaleMs, contentionPauseMs, minRemainingLifetimeSeconds);
    }

    /**
     * 락 대기 관련 값을 한 번에 변경.
     */
    public CredentialConfig withLockTiming(long lockWaitMs, long lockPollMs, long lockStaleMs) {
        return new CredentialConfig(lifetimeMs, expiryBufferMs, proactiveIntervalMinutes,
            lockWaitMs, lockPollMs, lockStaleMs, contentionPauseMs, minRemainingLifetimeSeconds);
    }

    public CredentialConfig withContentionPauseMs(long contentionPauseMs) {
        return new CredentialConfig(lifetimeMs, expiryBufferMs, proactiveIntervalMinutes,
            lockWaitMs, lockPollMs, lockStaleMs, contentionPauseMs, minRemainingLifetimeSeconds);
    }

    public CredentialConfig withMinRemainingLifetimeSeconds(long minRemainingLifetimeSeconds) {
        return new CredentialConfig(lifetimeMs, expiryBufferMs, proactiveIntervalMinutes,
            lockWaitMs, lockPollMs, lockStaleMs, contentionPauseMs, minRemainingLifetimeSeconds);
    }
}
