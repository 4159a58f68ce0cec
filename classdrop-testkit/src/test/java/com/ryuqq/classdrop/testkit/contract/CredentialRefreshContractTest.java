package com.ryuqq.classdrop.testkit.contract;

import com.ryuqq.classdrop.adapter.runner.credential.CredentialManager;
import com.ryuqq.classdrop.core.error.CredentialException;
import com.ryuqq.classdrop.core.model.RefreshLock;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Contract Test for Scenario 5: Credential Refresh.
 *
 * <p>Validates the refresh lock, coalescing of concurrent refreshes, the proactive refresh
 * alarm and the pre-batch lifetime check against a shared KV store.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
class CredentialRefreshContractTest extends AbstractContractTest {

    private static final String LOCK_KEY = "gcr_token_refresh_lock";

    // ===================================================================
    // LOCKING AND COALESCING
    // ===================================================================

    @Test
    void testConcurrentRefreshesIssueOneToken() throws Exception {
        // Given
        CredentialManager manager = newCredentialManager();
        assertEquals("token-1", manager.getToken(false));
        credentialProvider.withIssueDelayMs(100);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<String>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 4; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return manager.refresh(false);
                }));
            }

            // When
            start.countDown();
            List<String> tokens = new ArrayList<>();
            for (Future<String> result : results) {
                tokens.add(result.get(5, TimeUnit.SECONDS));
            }

            // Then
            assertEquals(2, credentialProvider.issuedCount(), "Concurrent refreshes must share one new token");
            assertTrue(tokens.stream().allMatch("token-2"::equals), "All callers see the new token: " + tokens);
            assertEquals(List.of("token-1"), credentialProvider.revokedTokens());
            assertFalse(store.get(LOCK_KEY).isPresent(), "Lock must be released");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testLiveForeignLockIsRespected() throws CredentialException {
        // Given: another context is refreshing right now
        CredentialManager manager = newCredentialManager();
        manager.getToken(false);
        store.set(LOCK_KEY, codec.write(new RefreshLock("other-context", clock.millis())));

        // When
        String token = manager.refresh(false);

        // Then: falls back to the current credential without issuing
        assertEquals("token-1", token);
        assertEquals(1, credentialProvider.issuedCount());
        assertTrue(store.get(LOCK_KEY).isPresent(), "Foreign lock must not be removed");
    }

    @Test
    void testStaleForeignLockIsSeized() throws CredentialException {
        // Given: a lock left behind by a context that died
        CredentialManager manager = newCredentialManager();
        manager.getToken(false);
        store.set(LOCK_KEY, codec.write(new RefreshLock("dead-context", clock.millis())));
        clock.advanceMillis(fastCredentialConfig().lockStaleMs() + 1);

        // When
        String token = manager.refresh(false);

        // Then
        assertEquals("token-2", token);
        assertFalse(store.get(LOCK_KEY).isPresent());
    }

    @Test
    void testFailedRefreshReleasesLock() {
        // Given
        CredentialManager manager = newCredentialManager();
        credentialProvider.failNextRequest(new CredentialException(CredentialException.Kind.NETWORK, "offline"));

        // When / Then
        assertThrows(CredentialException.class, () -> manager.refresh(false));
        assertFalse(store.get(LOCK_KEY).isPresent(), "Lock must be released after failure");
    }

    // ===================================================================
    // PROACTIVE REFRESH AND BATCH CHECK
    // ===================================================================

    @Test
    void testProactiveAlarmRotatesCredential() throws CredentialException {
        // Given
        CredentialManager manager = newCredentialManager();
        manager.start();
        manager.getToken(false);

        // When
        assertTrue(alarms.fire(CredentialManager.PROACTIVE_ALARM));

        // Then
        assertEquals("token-2", manager.getToken(false));
        assertEquals(List.of("token-1"), credentialProvider.revokedTokens());
        assertEquals(50, alarms.intervalOf(CredentialManager.PROACTIVE_ALARM).orElseThrow());
    }

    @Test
    void testProactiveAlarmFailureIsContained() throws CredentialException {
        // Given
        CredentialManager manager = newCredentialManager();
        manager.start();
        manager.getToken(false);
        credentialProvider.failNextRequest(new CredentialException(CredentialException.Kind.NETWORK, "offline"));

        // When
        alarms.fire(CredentialManager.PROACTIVE_ALARM);

        // Then: next call simply issues a fresh token
        assertEquals("token-2", manager.getToken(false));
        assertTrue(alarms.isScheduled(CredentialManager.PROACTIVE_ALARM));
    }

    @Test
    void testShortLivedCredentialRefreshedBeforeBatch() throws CredentialException {
        // Given
        credentialProvider.withRemainingLifetimeSeconds(300);
        CredentialManager manager = newCredentialManager();

        // When
        String token = manager.ensureValidForBatch();

        // Then
        assertEquals("token-2", token);
        assertEquals(2, credentialProvider.issuedCount());
    }

    @Test
    void testCredentialSharedAcrossContexts() throws CredentialException {
        // Given
        CredentialManager first = newCredentialManager();
        CredentialManager second = newCredentialManager();

        // When
        String a = first.getToken(false);
        String b = second.getToken(false);

        // Then
        assertEquals(a, b);
        assertEquals(1, credentialProvider.issuedCount());
    }
}
