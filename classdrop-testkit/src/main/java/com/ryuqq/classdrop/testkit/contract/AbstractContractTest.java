package com.ryuqq.classdrop.testkit.contract;

import com.ryuqq.classdrop.adapter.inmemory.alarm.InMemoryAlarmScheduler;
import com.ryuqq.classdrop.adapter.inmemory.sink.InMemoryFileSink;
import com.ryuqq.classdrop.adapter.inmemory.store.InMemoryKeyValueStore;
import com.ryuqq.classdrop.adapter.runner.cache.RecordCache;
import com.ryuqq.classdrop.adapter.runner.cache.RecordCacheConfig;
import com.ryuqq.classdrop.adapter.runner.catalog.CatalogFetcher;
import com.ryuqq.classdrop.adapter.runner.credential.CredentialConfig;
import com.ryuqq.classdrop.adapter.runner.credential.CredentialManager;
import com.ryuqq.classdrop.adapter.runner.download.DownloadRunnerConfig;
import com.ryuqq.classdrop.adapter.runner.download.QueueDownloadRunner;
import com.ryuqq.classdrop.adapter.runner.ratelimit.TokenBucketRateLimiter;
import com.ryuqq.classdrop.adapter.runner.support.JsonCodec;
import com.ryuqq.classdrop.application.credential.CredentialService;
import com.ryuqq.classdrop.core.model.Attachment;
import com.ryuqq.classdrop.core.model.BatchProgress;
import com.ryuqq.classdrop.core.model.CatalogSnapshot;
import com.ryuqq.classdrop.core.model.CourseRecord;
import com.ryuqq.classdrop.core.model.DriveFile;
import com.ryuqq.classdrop.core.model.RecordKind;
import com.ryuqq.classdrop.core.protection.RateLimiter;
import com.ryuqq.classdrop.core.protection.RateLimiterConfig;
import com.ryuqq.classdrop.core.statemachine.BatchState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Abstract base class for Contract Tests.
 *
 * <p>Wires the real runner components against the in-memory adapters and scripted remote fakes,
 * so a contract test exercises the same code paths a production host would.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>InMemoryKeyValueStore: persistent KV store shared by every component</li>
 *   <li>InMemoryFileSink / InMemoryAlarmScheduler: local side effects</li>
 *   <li>ScriptedContentApi / FakeCatalogApi / CountingCredentialProvider: remote services</li>
 *   <li>MutableClock: time source for expiry and staleness checks</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractContractTest {
 *     {@literal @}Test
 *     void testScenario() throws Exception {
 *         QueueDownloadRunner runner = newRunner(newCredentialManager(), fastRunnerConfig());
 *         runner.submit(catalogOf("Biology", file("f1")), Set.of("f1"));
 *
 *         assertFinished(awaitIdle(runner), BatchState.COMPLETED, 1, 0);
 *     }
 * }
 * </pre>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    protected static final Instant START = Instant.parse("2024-03-01T09:00:00Z");
    private static final long IDLE_TIMEOUT_MS = 10_000;

    protected InMemoryKeyValueStore store;
    protected InMemoryFileSink fileSink;
    protected InMemoryAlarmScheduler alarms;
    protected JsonCodec codec;
    protected MutableClock clock;
    protected ScriptedContentApi contentApi;
    protected FakeCatalogApi catalogApi;
    protected CountingCredentialProvider credentialProvider;

    private final List<QueueDownloadRunner> runners = new ArrayList<>();

    /**
     * Sets up test fixtures before each test.
     *
     * <p>Creates fresh instances of all adapters and fakes.</p>
     */
    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        fileSink = new InMemoryFileSink();
        alarms = new InMemoryAlarmScheduler();
        codec = new JsonCodec();
        clock = new MutableClock(START);
        contentApi = new ScriptedContentApi();
        catalogApi = new FakeCatalogApi();
        credentialProvider = new CountingCredentialProvider();
    }

    /**
     * Releases parked calls and shuts down every runner created through {@link #newRunner}.
     */
    @AfterEach
    void tearDown() throws InterruptedException {
        if (contentApi != null) {
            contentApi.release();
        }
        for (QueueDownloadRunner runner : runners) {
            runner.cancel();
            runner.shutdown();
        }
        runners.clear();
        if (store != null) {
            store.clear();
        }
    }

    // ===================================================================
    // COMPONENT FACTORIES
    // ===================================================================

    protected TokenBucketRateLimiter newRateLimiter(RateLimiterConfig config, Clock limiterClock) {
        return new TokenBucketRateLimiter(config, limiterClock, store, codec);
    }

    protected RecordCache newCache(RecordCacheConfig config) {
        return new RecordCache(store, codec, config, clock);
    }

    protected CredentialManager newCredentialManager() {
        return newCredentialManager(fastCredentialConfig());
    }

    protected CredentialManager newCredentialManager(CredentialConfig config) {
        return new CredentialManager(credentialProvider, store, codec, alarms, config, clock);
    }

    /**
     * Creates a runner that is shut down automatically after the test.
     *
     * <p>The runner gets an unthrottled token bucket on the system clock, since retry waits
     * and bucket refills must progress in real time.</p>
     */
    protected QueueDownloadRunner newRunner(CredentialService credentials, DownloadRunnerConfig config) {
        RateLimiter limiter = new TokenBucketRateLimiter(new RateLimiterConfig(1000, 1000, 20, 200), Clock.systemUTC());
        return newRunner(limiter, credentials, config);
    }

    protected QueueDownloadRunner newRunner(RateLimiter rateLimiter, CredentialService credentials,
                                            DownloadRunnerConfig config) {
        QueueDownloadRunner runner = new QueueDownloadRunner(rateLimiter, credentials, contentApi, fileSink,
            store, codec, config, clock);
        runners.add(runner);
        return runner;
    }

    protected CatalogFetcher newCatalogFetcher(RecordCache cache, CredentialService credentials) {
        return new CatalogFetcher(catalogApi, newRateLimiter(new RateLimiterConfig(), clock), credentials,
            cache, store, codec, clock);
    }

    protected static CredentialConfig fastCredentialConfig() {
        return new CredentialConfig().withLockTiming(300, 20, 1000).withContentionPauseMs(10);
    }

    protected static DownloadRunnerConfig fastRunnerConfig() {
        return new DownloadRunnerConfig().withBackoff(10, 50, 0.0);
    }

    // ===================================================================
    // CATALOG BUILDERS
    // ===================================================================

    protected static DriveFile file(String id) {
        return new DriveFile(id, id + ".pdf", "application/pdf", 1024L, null);
    }

    protected static CatalogSnapshot catalogOf(String name, Attachment... attachments) {
        CourseRecord material = new CourseRecord("m-" + name, "Materials", RecordKind.MATERIAL, List.of(attachments));
        return new CatalogSnapshot("c-" + name, name, List.of(), List.of(material), List.of(), START.toEpochMilli(), false);
    }

    protected static CatalogSnapshot sizedCatalog(String collectionId, int records) {
        List<CourseRecord> assignments = new ArrayList<>();
        for (int i = 0; i < records; i++) {
            assignments.add(new CourseRecord(collectionId + "-a" + i, "Assignment " + i, RecordKind.ASSIGNMENT,
                List.of(file(collectionId + "-f" + i))));
        }
        return new CatalogSnapshot(collectionId, "Course " + collectionId, assignments, List.of(), List.of(),
            START.toEpochMilli(), false);
    }

    // ===================================================================
    // ASSERTIONS
    // ===================================================================

    /**
     * Polls until the runner reports no active batch.
     *
     * @param runner runner under test
     * @return the final progress
     */
    protected BatchProgress awaitIdle(QueueDownloadRunner runner) {
        long deadline = System.currentTimeMillis() + IDLE_TIMEOUT_MS;
        while (runner.isRunning()) {
            if (System.currentTimeMillis() >= deadline) {
                fail("Batch did not finish within " + IDLE_TIMEOUT_MS + "ms: " + runner.progress());
            }
            sleep(10);
        }
        return runner.progress();
    }

    /**
     * Asserts a finished batch with the given terminal state and counts.
     */
    protected void assertFinished(BatchProgress progress, BatchState state, int completed, int failed) {
        assertFalse(progress.active(), "Finished batch must not be active: " + progress);
        assertEquals(state, progress.state(),
            String.format("Expected batch state %s but was %s", state, progress.state()));
        assertEquals(completed, progress.completed(), "completed count mismatch: " + progress);
        assertEquals(failed, progress.failed(), "failed count mismatch: " + progress);
    }

    /**
     * Sleeps for the specified duration. Used for timing-sensitive tests.
     *
     * @param millis milliseconds to sleep
     */
    protected void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Sleep interrupted", e);
        }
    }
}
