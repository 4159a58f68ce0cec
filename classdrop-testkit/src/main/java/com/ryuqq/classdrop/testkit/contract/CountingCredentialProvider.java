package com.ryuqq.classdrop.testkit.contract;

import com.ryuqq.classdrop.core.error.CredentialException;
import com.ryuqq.classdrop.core.spi.CredentialProvider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalLong;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of CredentialProvider for testing purposes.
 *
 * <p>Issues {@code token-1}, {@code token-2}, ... and counts every issued and revoked token.
 * Revoked tokens fail introspection.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public class CountingCredentialProvider implements CredentialProvider {

    private final AtomicInteger issued = new AtomicInteger();
    private final List<String> revoked = Collections.synchronizedList(new ArrayList<>());
    private final Queue<CredentialException> pendingFailures = new ConcurrentLinkedQueue<>();
    private volatile long remainingLifetimeSeconds = 3600;
    private volatile long issueDelayMs;

    @Override
    public String requestToken(boolean interactive) throws CredentialException {
        CredentialException failure = pendingFailures.poll();
        if (failure != null) {
            throw failure;
        }
        if (issueDelayMs > 0) {
            try {
                Thread.sleep(issueDelayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CredentialException(CredentialException.Kind.CANCELLED, "Interrupted while issuing", e);
            }
        }
        return "token-" + issued.incrementAndGet();
    }

    @Override
    public void revokeToken(String token) {
        revoked.add(token);
    }

    @Override
    public OptionalLong remainingLifetimeSeconds(String token) {
        if (revoked.contains(token)) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(remainingLifetimeSeconds);
    }

    public CountingCredentialProvider withRemainingLifetimeSeconds(long seconds) {
        this.remainingLifetimeSeconds = seconds;
        return this;
    }

    /**
     * Slows down issuing so concurrent refreshes overlap.
     *
     * @param delayMs delay before each token is returned
     * @return this
     */
    public CountingCredentialProvider withIssueDelayMs(long delayMs) {
        this.issueDelayMs = delayMs;
        return this;
    }

    public CountingCredentialProvider failNextRequest(CredentialException error) {
        pendingFailures.add(error);
        return this;
    }

    public int issuedCount() {
        return issued.get();
    }

    public List<String> revokedTokens() {
        synchronized (revoked) {
            return List.copyOf(revoked);
        }
    }
}
