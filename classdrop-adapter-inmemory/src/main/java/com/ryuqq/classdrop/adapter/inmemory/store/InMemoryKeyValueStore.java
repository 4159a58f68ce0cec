package com.ryuqq.classdrop.adapter.inmemory.store;

import com.ryuqq.classdrop.core.error.StorageException;
import com.ryuqq.classdrop.core.spi.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link KeyValueStore} SPI for testing and reference purposes.
 *
 * <p>Values live in a {@link ConcurrentHashMap}. Writes are serialized so that the
 * byte quota check and the write happen atomically.</p>
 *
 * <p><strong>Quota Simulation:</strong></p>
 * <ul>
 *   <li>Usage is the UTF-8 length of every key plus its value</li>
 *   <li>A write that would push usage above {@code quotaBytes} throws
 *       {@link StorageException} with {@code quotaExceeded = true}</li>
 *   <li>{@code quotaBytes <= 0} means unlimited</li>
 * </ul>
 *
 * <p><strong>Failure Injection:</strong> {@link #failWritesFor(String)} makes every write
 * to keys with the given prefix fail, which lets tests exercise fallback paths.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryKeyValueStore store = new InMemoryKeyValueStore(10 * 1024 * 1024);
 * store.set("gcr_auth_credential", json);
 * Optional&lt;String&gt; raw = store.get("gcr_auth_credential");
 * </pre>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryKeyValueStore.class);

    private final ConcurrentHashMap<String, String> entries;
    private final long quotaBytes;
    private volatile String failingPrefix;
    private long bytesInUse;

    /**
     * Creates an unlimited store.
     */
    public InMemoryKeyValueStore() {
        this(0);
    }

    /**
     * Creates a store with a byte quota.
     *
     * @param quotaBytes maximum total bytes, {@code <= 0} for unlimited
     */
    public InMemoryKeyValueStore(long quotaBytes) {
        this.entries = new ConcurrentHashMap<>();
        this.quotaBytes = quotaBytes;
    }

    @Override
    public Optional<String> get(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * {@inheritDoc}
     *
     * @throws StorageException when the quota would be exceeded or a failure was injected
     */
    @Override
    public synchronized void set(String key, String value) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }

        String prefix = failingPrefix;
        if (prefix != null && key.startsWith(prefix)) {
            throw new StorageException("Injected write failure for key: " + key, false);
        }

        String previous = entries.get(key);
        long delta = sizeOf(key, value) - (previous == null ? 0 : sizeOf(key, previous));
        if (quotaBytes > 0 && bytesInUse + delta > quotaBytes) {
            log.debug("Quota exceeded: key={}, inUse={}, delta={}, quota={}", key, bytesInUse, delta, quotaBytes);
            throw new StorageException(
                "Storage quota exceeded (inUse: " + bytesInUse + ", requested: " + delta + ", quota: " + quotaBytes + ")",
                true
            );
        }

        entries.put(key, value);
        bytesInUse += delta;
    }

    @Override
    public synchronized void remove(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        String previous = entries.remove(key);
        if (previous != null) {
            bytesInUse -= sizeOf(key, previous);
        }
    }

    @Override
    public Map<String, String> getAll() {
        return Map.copyOf(entries);
    }

    /**
     * Removes every entry.
     */
    public synchronized void clear() {
        entries.clear();
        bytesInUse = 0;
    }

    /**
     * Makes writes to keys starting with {@code prefix} fail until reset with {@code null}.
     *
     * @param prefix key prefix, or {@code null} to stop failing
     */
    public void failWritesFor(String prefix) {
        this.failingPrefix = prefix;
    }

    public synchronized long getBytesInUse() {
        return bytesInUse;
    }

    public int size() {
        return entries.size();
    }

    private static long sizeOf(String key, String value) {
        return key.getBytes(StandardCharsets.UTF_8).length + value.getBytes(StandardCharsets.UTF_8).length;
    }
}
