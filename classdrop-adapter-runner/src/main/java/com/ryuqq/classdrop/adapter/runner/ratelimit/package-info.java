/**
 * Token bucket rate limiter with server-driven backoff.
 *
 * <p>{@link com.ryuqq.classdrop.adapter.runner.ratelimit.TokenBucketRateLimiter} gates every call
 * to the catalog and content services. Callers report throttling with
 * {@code report429(retryAfter)} and clear it on success, or use
 * {@link com.ryuqq.classdrop.core.protection.RateLimiter#execute} which does both.</p>
 *
 * @since 1.0.0
 * @author ClassDrop Team
 */
package com.ryuqq.classdrop.adapter.runner.ratelimit;
