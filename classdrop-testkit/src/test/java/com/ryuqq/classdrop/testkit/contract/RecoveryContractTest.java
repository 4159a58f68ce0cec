package com.ryuqq.classdrop.testkit.contract;

import com.ryuqq.classdrop.adapter.runner.cache.RecordCache;
import com.ryuqq.classdrop.adapter.runner.cache.RecordCacheConfig;
import com.ryuqq.classdrop.adapter.runner.catalog.CatalogFetcher;
import com.ryuqq.classdrop.adapter.runner.catalog.FetchMarker;
import com.ryuqq.classdrop.adapter.runner.credential.CredentialManager;
import com.ryuqq.classdrop.adapter.runner.download.OfflineRetryResult;
import com.ryuqq.classdrop.adapter.runner.download.QueueDownloadRunner;
import com.ryuqq.classdrop.core.error.ApiException;
import com.ryuqq.classdrop.core.model.BatchProgress;
import com.ryuqq.classdrop.core.model.CatalogSnapshot;
import com.ryuqq.classdrop.core.model.CollectionId;
import com.ryuqq.classdrop.core.statemachine.BatchState;
import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Contract Test for Scenario 6: Restart Recovery.
 *
 * <p>A restart is simulated by building new component instances over the same KV store.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>A batch interrupted by a restart is reported as cancelled</li>
 *   <li>A finished batch keeps its final counts</li>
 *   <li>A catalog fetched before the restart is served from cache</li>
 *   <li>A fetch marker left by a dead context expires</li>
 *   <li>Files that failed on the network are replayed from the offline queue after a restart</li>
 * </ul>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
class RecoveryContractTest extends AbstractContractTest {

    @Test
    void testInterruptedBatchRestoredAsCancelled() throws InterruptedException {
        // Given: a batch is mid-flight when the host goes away
        QueueDownloadRunner before = newRunner(newCredentialManager(), fastRunnerConfig());
        contentApi.hold();
        before.submit(catalogOf("Biology", file("f1"), file("f2")), Set.of("f1", "f2"));
        assertTrue(contentApi.awaitInFlight(1, 5_000));

        // When
        QueueDownloadRunner after = newRunner(newCredentialManager(), fastRunnerConfig());
        BatchProgress restored = after.restoreProgress();

        // Then
        assertEquals("Biology", restored.batchId());
        assertEquals(BatchState.CANCELLED, restored.state());
        assertFalse(restored.active());
        assertFalse(after.isRunning());
        assertEquals(restored, after.progress());
    }

    @Test
    void testFinishedBatchRestoredUnchanged() {
        // Given
        contentApi.alwaysFail("f2", new ApiException(404, "gone"));
        QueueDownloadRunner before = newRunner(newCredentialManager(), fastRunnerConfig());
        before.submit(catalogOf("Chem", file("f1"), file("f2")), Set.of("f1", "f2"));
        BatchProgress finished = awaitIdle(before);

        // When
        BatchProgress restored = newRunner(newCredentialManager(), fastRunnerConfig()).restoreProgress();

        // Then
        assertFinished(restored, BatchState.COMPLETED, 1, 1);
        assertEquals(finished.finishedAt(), restored.finishedAt());
    }

    @Test
    void testRestoredRunnerAcceptsNewBatch() {
        // Given
        QueueDownloadRunner before = newRunner(newCredentialManager(), fastRunnerConfig());
        before.submit(catalogOf("Art", file("f1")), Set.of("f1"));
        awaitIdle(before);

        // When
        QueueDownloadRunner after = newRunner(newCredentialManager(), fastRunnerConfig());
        after.restoreProgress();
        after.submit(catalogOf("Music", file("f2")), Set.of("f2"));

        // Then
        assertFinished(awaitIdle(after), BatchState.COMPLETED, 1, 0);
    }

    @Test
    void testOfflineQueueReplayedAfterRestart() {
        // Given: f1 times out on every attempt of the batch
        contentApi.failWith("f1",
            new SocketTimeoutException("t1"), new SocketTimeoutException("t2"), new SocketTimeoutException("t3"));
        QueueDownloadRunner before = newRunner(newCredentialManager(), fastRunnerConfig());
        before.submit(catalogOf("Physics", file("f1"), file("f2")), Set.of("f1", "f2"));
        assertFinished(awaitIdle(before), BatchState.COMPLETED, 1, 1);
        assertEquals(1, before.offlineQueue().size(), "Network failure must be queued for later");

        // When: the connection is back and the host restarted
        QueueDownloadRunner after = newRunner(newCredentialManager(), fastRunnerConfig());
        OfflineRetryResult result = after.retryOfflineQueue();

        // Then
        assertEquals(new OfflineRetryResult(1, 0, 0), result);
        assertEquals(4, contentApi.callCount("f1"));
        assertTrue(fileSink.savedPaths().contains("Physics/f1.pdf"), "Replayed file must be saved");
        assertTrue(after.offlineQueue().isEmpty());
    }

    @Test
    void testCatalogServedFromCacheAfterRestart() throws Exception {
        // Given
        CatalogSnapshot remote = sizedCatalog("c1", 3);
        catalogApi.register(remote);
        CredentialManager credentials = newCredentialManager();
        CatalogFetcher before = newCatalogFetcher(newCache(new RecordCacheConfig()), credentials);
        before.fetch(CollectionId.of("c1"), false);

        // When
        RecordCache cacheAfter = newCache(new RecordCacheConfig());
        CatalogFetcher after = newCatalogFetcher(cacheAfter, newCredentialManager());
        CatalogSnapshot served = after.fetch(CollectionId.of("c1"), false);

        // Then
        assertEquals(remote.collectionName(), served.collectionName());
        assertEquals(1, catalogApi.callCount(), "Restart must not refetch a cached catalog");
        assertEquals("c1", cacheAfter.lastCollectionId().orElseThrow());
    }

    @Test
    void testStaleFetchMarkerFromDeadContextExpires() throws Exception {
        // Given: a context died while fetching
        catalogApi.register(sizedCatalog("c1", 1));
        store.set(CatalogFetcher.FETCH_IN_PROGRESS_KEY, codec.write(new FetchMarker("c1", clock.millis())));
        CatalogFetcher fetcher = newCatalogFetcher(newCache(new RecordCacheConfig()), newCredentialManager());

        // When / Then
        assertThrows(IllegalStateException.class, () -> fetcher.fetch(CollectionId.of("c1"), true));
        clock.advance(Duration.ofMinutes(2).plusMillis(1));
        assertEquals("c1", fetcher.fetch(CollectionId.of("c1"), true).collectionId());
        assertFalse(fetcher.inProgress().isPresent());
    }

    @Test
    void testUnauthorizedFetchRefreshesCredentialOnce() throws Exception {
        // Given
        catalogApi.register(sizedCatalog("c1", 1)).failNext(new ApiException(401, "expired"));
        CatalogFetcher fetcher = newCatalogFetcher(newCache(new RecordCacheConfig()), newCredentialManager());

        // When
        fetcher.fetch(CollectionId.of("c1"), false);

        // Then
        assertEquals(2, catalogApi.callCount());
        assertEquals("token-2", catalogApi.tokensSeen().get(1));
        assertEquals(2, credentialProvider.issuedCount());
    }
}
