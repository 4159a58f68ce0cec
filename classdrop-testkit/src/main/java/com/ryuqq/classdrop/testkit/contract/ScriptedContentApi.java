package com.ryuqq.classdrop.testkit.contract;

import com.ryuqq.classdrop.core.error.ApiException;
import com.ryuqq.classdrop.core.model.ExportFormat;
import com.ryuqq.classdrop.core.spi.ContentApi;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of ContentApi for testing purposes.
 *
 * <p>Every item succeeds with {@link #contentOf(String)} unless failures were scripted for it.
 * Scripted failures are consumed one per call, so {@code failWith("f1", e1, e2)} makes the
 * first two calls fail and the third succeed.</p>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Per-item call counting and a global call log</li>
 *   <li>Peak in-flight call tracking for concurrency bounds</li>
 *   <li>A gate that parks every call until released</li>
 * </ul>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public class ScriptedContentApi implements ContentApi {

    private final Map<String, Deque<Exception>> scripted = new ConcurrentHashMap<>();
    private final Map<String, Exception> permanent = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private final List<String> callLog = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peakInFlight = new AtomicInteger();
    private volatile CountDownLatch gate;

    /**
     * Expected payload of a successful download.
     *
     * @param itemId item id
     * @return content bytes
     */
    public static byte[] contentOf(String itemId) {
        return ("content:" + itemId).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Queues failures for the next calls on an item.
     *
     * @param itemId item id
     * @param errors ApiException or IOException instances, consumed in order
     * @return this
     */
    public ScriptedContentApi failWith(String itemId, Exception... errors) {
        Deque<Exception> queue = scripted.computeIfAbsent(itemId, id -> new ArrayDeque<>());
        synchronized (queue) {
            for (Exception error : errors) {
                requireSupported(error);
                queue.addLast(error);
            }
        }
        return this;
    }

    /**
     * Makes every call on an item fail.
     *
     * @param itemId item id
     * @param error ApiException or IOException
     * @return this
     */
    public ScriptedContentApi alwaysFail(String itemId, Exception error) {
        requireSupported(error);
        permanent.put(itemId, error);
        return this;
    }

    /**
     * Parks every subsequent call until {@link #release()}.
     */
    public void hold() {
        gate = new CountDownLatch(1);
    }

    public void release() {
        CountDownLatch current = gate;
        gate = null;
        if (current != null) {
            current.countDown();
        }
    }

    @Override
    public byte[] fetchContent(String itemId, String token) throws ApiException, IOException {
        return serve(itemId);
    }

    @Override
    public byte[] convertAndFetch(String itemId, ExportFormat targetFormat, String token)
            throws ApiException, IOException {
        return serve(itemId);
    }

    public int callCount(String itemId) {
        AtomicInteger count = calls.get(itemId);
        return count == null ? 0 : count.get();
    }

    public int totalCalls() {
        return callLog.size();
    }

    public List<String> callLog() {
        synchronized (callLog) {
            return List.copyOf(callLog);
        }
    }

    public int peakInFlight() {
        return peakInFlight.get();
    }

    public int inFlight() {
        return inFlight.get();
    }

    /**
     * Waits until at least {@code expected} calls are in flight.
     *
     * @param expected number of parked or running calls
     * @param timeoutMs maximum wait
     * @return {@code true} if reached in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitInFlight(int expected, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (inFlight.get() < expected) {
            if (System.currentTimeMillis() >= deadline) {
                return false;
            }
            Thread.sleep(5);
        }
        return true;
    }

    private byte[] serve(String itemId) throws ApiException, IOException {
        calls.computeIfAbsent(itemId, id -> new AtomicInteger()).incrementAndGet();
        callLog.add(itemId);
        int current = inFlight.incrementAndGet();
        peakInFlight.accumulateAndGet(current, Math::max);
        try {
            awaitGate();
            Exception failure = nextFailure(itemId);
            if (failure instanceof ApiException apiException) {
                throw apiException;
            }
            if (failure instanceof IOException ioException) {
                throw ioException;
            }
            return contentOf(itemId);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private void awaitGate() throws InterruptedIOException {
        CountDownLatch current = gate;
        if (current == null) {
            return;
        }
        try {
            if (!current.await(10, TimeUnit.SECONDS)) {
                throw new InterruptedIOException("Gate was never released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while parked at gate");
        }
    }

    private Exception nextFailure(String itemId) {
        Exception always = permanent.get(itemId);
        if (always != null) {
            return always;
        }
        Deque<Exception> queue = scripted.get(itemId);
        if (queue == null) {
            return null;
        }
        synchronized (queue) {
            return queue.pollFirst();
        }
    }

    private static void requireSupported(Exception error) {
        if (!(error instanceof ApiException) && !(error instanceof IOException)) {
            throw new IllegalArgumentException("Only ApiException or IOException can be scripted: " + error);
        }
    }
}
