package com.ryuqq.classdrop.adapter.inmemory.sink;

import com.ryuqq.classdrop.core.spi.FileSink;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of {@link FileSink} SPI.
 *
 * <p>Saved files are kept in insertion order so tests can assert on the exact
 * paths a batch produced. {@link #failOn(String)} injects an {@link IOException}
 * for any path containing the given fragment.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public class InMemoryFileSink implements FileSink {

    private final Map<String, byte[]> files = new LinkedHashMap<>();
    private volatile String failingFragment;

    @Override
    public synchronized void save(String pathHint, byte[] bytes) throws IOException {
        if (pathHint == null || pathHint.isBlank()) {
            throw new IllegalArgumentException("pathHint cannot be null or blank");
        }
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        String fragment = failingFragment;
        if (fragment != null && pathHint.contains(fragment)) {
            throw new IOException("Injected save failure: " + pathHint);
        }
        files.put(pathHint, bytes.clone());
    }

    public synchronized List<String> savedPaths() {
        return new ArrayList<>(files.keySet());
    }

    public synchronized Optional<byte[]> contentOf(String path) {
        byte[] bytes = files.get(path);
        return bytes == null ? Optional.empty() : Optional.of(bytes.clone());
    }

    public synchronized int count() {
        return files.size();
    }

    /**
     * @param fragment path fragment that triggers a failure, or {@code null} to stop failing
     */
    public void failOn(String fragment) {
        this.failingFragment = fragment;
    }
}
