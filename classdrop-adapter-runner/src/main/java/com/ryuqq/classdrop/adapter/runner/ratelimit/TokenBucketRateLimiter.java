package com.ryuqq.classdrop.adapter.runner.ratelimit;

import com.ryuqq.classdrop.adapter.runner.support.JsonCodec;
import com.ryuqq.classdrop.core.error.StorageException;
import com.ryuqq.classdrop.core.protection.Priority;
import com.ryuqq.classdrop.core.protection.RateLimiter;
import com.ryuqq.classdrop.core.protection.RateLimiterConfig;
import com.ryuqq.classdrop.core.protection.RateLimiterStats;
import com.ryuqq.classdrop.core.spi.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 우선순위 토큰 버킷 레이트 리미터.
 *
 * <p>용량 C의 버킷이 초당 R개씩 연속적으로 보충됩니다. 429 응답으로 설치된
 * 백오프 윈도우가 활성인 동안에는 버킷 잔량과 관계없이 허가를 발급하지 않습니다.</p>
 *
 * <p><strong>대기자 순서:</strong></p>
 * <ul>
 *   <li>대기자는 (우선순위 rank, 도착 순번) 순으로 정렬된 큐에 들어감</li>
 *   <li>큐의 맨 앞 대기자만 토큰을 가져갈 수 있음</li>
 *   <li>같은 우선순위 안에서는 FIFO</li>
 * </ul>
 *
 * <p><strong>백오프 계산 ({@link #report429(String)}):</strong></p>
 * <pre>
 * delay = parse(Retry-After)
 *       ?: (윈도우 활성 ? max(initial, 2 * 남은 시간) : initial)
 * delay = min(delay, maxBackoff)
 * backoffUntil = max(backoffUntil, now + delay)
 * </pre>
 *
 * <p><strong>영속화:</strong> KeyValueStore가 주어지면 버킷 잔량과 백오프 윈도우를
 * {@value #STATE_KEY}에 기록하고, 생성 시 복원합니다. 저장 실패는 경고만 남깁니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RateLimiter limiter = new TokenBucketRateLimiter(new RateLimiterConfig(), Clock.systemUTC());
 * CatalogSnapshot snapshot = limiter.execute(Priority.HIGH,
 *     () -&gt; catalogApi.fetchCollection(collectionId, token));
 * </pre>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public final class TokenBucketRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

    /**
     * 상태 저장 키.
     */
    public static final String STATE_KEY = "gcr_rate_limit_state";

    private final RateLimiterConfig config;
    private final Clock clock;
    private final KeyValueStore store;
    private final JsonCodec codec;

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Condition changed = lock.newCondition();
    private final PriorityQueue<Waiter> waiters = new PriorityQueue<>(
        Comparator.comparingInt((Waiter w) -> w.rank).thenComparingLong(w -> w.sequence)
    );

    private long nextSequence;
    private double tokens;
    private long lastRefill;
    private long backoffUntil;
    private long totalGranted;
    private long totalThrottled;

    /**
     * 생성자 (영속화 없음).
     *
     * @param config 설정
     * @param clock 시간 소스
     */
    public TokenBucketRateLimiter(RateLimiterConfig config, Clock clock) {
        this(config, clock, null, null);
    }

    /**
     * 생성자 (KV 저장소 영속화).
     *
     * @param config 설정
     * @param clock 시간 소스
     * @param store 상태 저장소 (null이면 영속화하지 않음)
     * @param codec JSON 직렬화기 (store가 있으면 필수)
     * @throws IllegalArgumentException config 또는 clock이 null이거나, store만 있고 codec이 없는 경우
     */
    public TokenBucketRateLimiter(RateLimiterConfig config, Clock clock, KeyValueStore store, JsonCodec codec) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (store != null && codec == null) {
            throw new IllegalArgumentException("codec cannot be null when store is given");
        }

        this.config = config;
        this.clock = clock;
        this.store = store;
        this.codec = codec;
        this.tokens = config.capacity();
        this.lastRefill = clock.millis();

        restore();
    }

    @Override
    public void acquire(Priority priority) throws InterruptedException {
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }

        lock.lockInterruptibly();
        try {
            Waiter self = new Waiter(priority.getRank(), nextSequence++);
            waiters.add(self);
            try {
                while (true) {
                    long now = clock.millis();
                    refill(now);

                    long waitMs;
                    if (now < backoffUntil) {
                        waitMs = backoffUntil - now;
                    } else if (waiters.peek() != self) {
                        // 앞선 대기자가 허가를 받거나 떠날 때 깨어남
                        waitMs = 0;
                    } else if (tokens >= 1.0) {
                        grant(priority);
                        return;
                    } else {
                        waitMs = (long) Math.ceil((1.0 - tokens) * 1000.0 / config.refillPerSecond());
                    }

                    if (waitMs > 0) {
                        changed.await(waitMs, TimeUnit.MILLISECONDS);
                    } else {
                        changed.await();
                    }
                }
            } finally {
                waiters.remove(self);
                changed.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean tryAcquire() {
        lock.lock();
        try {
            long now = clock.millis();
            refill(now);
            if (now < backoffUntil || !waiters.isEmpty() || tokens < 1.0) {
                return false;
            }
            grant(null);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void report429(String retryAfterValue) {
        lock.lock();
        try {
            long now = clock.millis();
            long remaining = Math.max(0, backoffUntil - now);

            long delay = RetryAfterParser.parseDelayMillis(retryAfterValue, now)
                .orElse(remaining > 0
                    ? Math.max(config.initialBackoffMs(), remaining * 2)
                    : config.initialBackoffMs());
            delay = Math.min(delay, config.maxBackoffMs());

            totalThrottled++;
            long until = now + delay;
            if (until > backoffUntil) {
                backoffUntil = until;
            }

            log.warn("429 received, backing off: retryAfter={}, delay={}ms, backoffUntil={}",
                retryAfterValue, delay, backoffUntil);
            persist();
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clearBackoff() {
        lock.lock();
        try {
            if (backoffUntil == 0) {
                return;
            }
            backoffUntil = 0;
            log.info("Backoff cleared after successful response");
            persist();
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public RateLimiterStats stats() {
        lock.lock();
        try {
            long now = clock.millis();
            double projected = Math.min(
                config.capacity(),
                tokens + Math.max(0, now - lastRefill) / 1000.0 * config.refillPerSecond()
            );
            long remaining = Math.max(0, backoffUntil - now);
            return new RateLimiterStats(
                projected,
                config.capacity(),
                config.refillPerSecond(),
                remaining > 0,
                remaining,
                waiters.size(),
                totalGranted,
                totalThrottled
            );
        } finally {
            lock.unlock();
        }
    }

    @Override
    public RateLimiterConfig getConfig() {
        return config;
    }

    private void grant(Priority priority) {
        tokens -= 1.0;
        totalGranted++;
        if (log.isDebugEnabled()) {
            log.debug("Permit granted: priority={}, tokensLeft={}", priority, String.format("%.2f", tokens));
        }
        persist();
    }

    private void refill(long now) {
        long elapsed = now - lastRefill;
        if (elapsed <= 0) {
            return;
        }
        tokens = Math.min(config.capacity(), tokens + elapsed / 1000.0 * config.refillPerSecond());
        lastRefill = now;
    }

    private void restore() {
        if (store == null) {
            return;
        }
        Optional<RateLimitState> saved = codec.read(store.get(STATE_KEY).orElse(null), RateLimitState.class);
        if (saved.isEmpty()) {
            return;
        }
        RateLimitState state = saved.get();
        this.tokens = Math.max(0, Math.min(config.capacity(), state.tokens()));
        this.lastRefill = Math.min(state.lastRefill(), clock.millis());
        this.backoffUntil = Math.max(0, state.backoffUntil());
        log.info("Rate limiter state restored: tokens={}, backoffUntil={}", tokens, backoffUntil);
    }

    private void persist() {
        if (store == null) {
            return;
        }
        try {
            store.set(STATE_KEY, codec.write(new RateLimitState(tokens, lastRefill, backoffUntil)));
        } catch (StorageException e) {
            log.warn("Failed to persist rate limiter state: {}", e.getMessage());
        }
    }

    private static final class Waiter {
        private final int rank;
        private final long sequence;

        private Waiter(int rank, long sequence) {
            this.rank = rank;
            this.sequence = sequence;
        }
    }
}
