package com.ryuqq.classdrop.core.spi;

import com.ryuqq.classdrop.core.error.StorageException;

import java.util.Map;
import java.util.Optional;

/**
 * Durable key-value store provided by the host platform.
 *
 * <p>Values survive process restarts. Writes to different keys are not transactional:
 * callers must tolerate a crash between two related writes.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public interface KeyValueStore {

    /**
     * Reads a value.
     *
     * @param key storage key
     * @return the stored value, or empty if absent
     */
    Optional<String> get(String key);

    /**
     * Writes a value, replacing any previous one.
     *
     * @param key storage key
     * @param value serialized value
     * @throws StorageException if the store rejects the write (for example, quota exceeded)
     */
    void set(String key, String value);

    /**
     * Removes a value. Removing an absent key is a no-op.
     *
     * @param key storage key
     */
    void remove(String key);

    /**
     * Returns a snapshot of all entries.
     *
     * @return key to value map (never null)
     */
    Map<String, String> getAll();
}
