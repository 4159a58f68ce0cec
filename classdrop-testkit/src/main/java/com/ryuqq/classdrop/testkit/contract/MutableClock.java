package com.ryuqq.classdrop.testkit.contract;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Clock whose time only moves when a test moves it.
 *
 * <p>Components that compare timestamps (cache expiry, lock staleness, token buckets)
 * read this clock, so a contract test can jump days ahead without sleeping.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private final AtomicLong millis;

    /**
     * Creates a clock frozen at the given instant.
     *
     * @param start initial instant
     */
    public MutableClock(Instant start) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.millis = new AtomicLong(start.toEpochMilli());
    }

    /**
     * Moves the clock forward.
     *
     * @param duration amount to add, must not be negative
     */
    public void advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration must be non-negative (current: " + duration + ")");
        }
        millis.addAndGet(duration.toMillis());
    }

    public void advanceMillis(long deltaMillis) {
        advance(Duration.ofMillis(deltaMillis));
    }

    public void set(Instant instant) {
        millis.set(instant.toEpochMilli());
    }

    @Override
    public long millis() {
        return millis.get();
    }

    @Override
    public Instant instant() {
        return Instant.ofEpochMilli(millis.get());
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }
}
