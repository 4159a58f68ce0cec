package com.ryuqq.classdrop.adapter.runner.download;

/**
 * QueueDownloadRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 동시 전송 상한 (기본 5)</li>
 *   <li>maxAttempts: 작업당 최대 시도 횟수 (기본 3)</li>
 *   <li>baseBackoffMs / maxBackoffMs / jitterFactor: 재시도 지연 (기본 2000ms / 30000ms / 0.1)</li>
 *   <li>largeFileWarnBytes: 경고 로그 기준 크기 (기본 500 MiB)</li>
 *   <li>maxFileBytes: 시도 없이 실패 처리하는 크기 (기본 2 GiB)</li>
 *   <li>shutdownTimeoutSeconds: shutdown 시 대기 상한 (기본 60초)</li>
 * </ul>
 *
 * @param concurrency 동시 전송 상한 (1 이상)
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param baseBackoffMs 기본 재시도 지연 (밀리초)
 * @param maxBackoffMs 최대 재시도 지연 (밀리초)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 * @param largeFileWarnBytes 대용량 경고 기준 (바이트)
 * @param maxFileBytes 최대 허용 크기 (바이트, largeFileWarnBytes 이상)
 * @param shutdownTimeoutSeconds shutdown 대기 (초)
 * @author ClassDrop Team
 * @since 1.0.0
 */
public record DownloadRunnerConfig(
    int concurrency,
    int maxAttempts,
    long baseBackoffMs,
    long maxBackoffMs,
    double jitterFactor,
    long largeFileWarnBytes,
    long maxFileBytes,
    long shutdownTimeoutSeconds
) {

    private static final long MIB = 1024L * 1024;

    /**
     * 기본 설정 생성자.
     */
    public DownloadRunnerConfig() {
        this(5, 3, 2000, 30_000, 0.1, 500 * MIB, 2048 * MIB, 60);
    }

    public DownloadRunnerConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive (current: " + concurrency + ")");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        if (largeFileWarnBytes <= 0) {
            throw new IllegalArgumentException("largeFileWarnBytes must be positive (current: " + largeFileWarnBytes + ")");
        }
        if (maxFileBytes < largeFileWarnBytes) {
            throw new IllegalArgumentException(
                "maxFileBytes must be >= largeFileWarnBytes (warn: " + largeFileWarnBytes + ", max: " + maxFileBytes + ")"
            );
        }
        if (shutdownTimeoutSeconds <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutSeconds must be positive (current: " + shutdownTimeoutSeconds + ")"
            );
        }
        // 지연 값 검증은 BackoffCalculator 생성자가 담당
    }

    public DownloadRunnerConfig withConcurrency(int concurrency) {
        return new DownloadRunnerConfig(concurrency, maxAttempts, baseBackoffMs, maxBackoffMs, jitterFactor,
            largeFileWarnBytes, maxFileBytes, shutdownTimeoutSeconds);
    }

    public DownloadRunnerConfig withMaxAttempts(int maxAttempts) {
        return new DownloadRunnerConfig(concurrency, maxAttempts, baseBackoffMs, maxBackoffMs, jitterFactor,
            largeFileWarnBytes, maxFileBytes, shutdownTimeoutSeconds);
    }

    /**
     * 재시도 지연 설정을 한 번에 변경.
     */
    public DownloadRunnerConfig withBackoff(long baseBackoffMs, long maxBackoffMs, double jitterFactor) {
        return new DownloadRunnerConfig(concurrency, maxAttempts, baseBackoffMs, maxBackoffMs, jitterFactor,
            largeFileWarnBytes, maxFileBytes, shutdownTimeoutSeconds);
    }

    public DownloadRunnerConfig withFileSizeLimits(long largeFileWarnBytes, long maxFileBytes) {
        return new DownloadRunnerConfig(concurrency, maxAttempts, baseBackoffMs, maxBackoffMs, jitterFactor,
            largeFileWarnBytes, maxFileBytes, shutdownTimeoutSeconds);
    }

    public DownloadRunnerConfig withShutdownTimeoutSeconds(long shutdownTimeoutSeconds) {
        return new DownloadRunnerConfig(concurrency, maxAttempts, baseBackoffMs, maxBackoffMs, jitterFactor,
            largeFileWarnBytes, maxFileBytes, shutdownTimeoutSeconds);
    }
}
