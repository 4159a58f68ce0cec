package com.ryuqq.classdrop.testkit.contract;

import com.ryuqq.classdrop.core.error.ApiException;
import com.ryuqq.classdrop.core.model.CatalogSnapshot;
import com.ryuqq.classdrop.core.model.CollectionId;
import com.ryuqq.classdrop.core.spi.CatalogApi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.Queue;

/**
 * In-memory implementation of CatalogApi for testing purposes.
 *
 * <p>Unknown collections answer 404. Queued failures are thrown before any registered snapshot.</p>
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
public class FakeCatalogApi implements CatalogApi {

    private final Map<String, CatalogSnapshot> collections = new ConcurrentHashMap<>();
    private final Queue<ApiException> pendingFailures = new ConcurrentLinkedQueue<>();
    private final List<String> tokensSeen = Collections.synchronizedList(new ArrayList<>());

    public FakeCatalogApi register(CatalogSnapshot snapshot) {
        collections.put(snapshot.collectionId(), snapshot);
        return this;
    }

    public FakeCatalogApi failNext(ApiException error) {
        pendingFailures.add(error);
        return this;
    }

    @Override
    public CatalogSnapshot fetchCollection(CollectionId collectionId, String token) throws ApiException {
        tokensSeen.add(token);
        ApiException failure = pendingFailures.poll();
        if (failure != null) {
            throw failure;
        }
        CatalogSnapshot snapshot = collections.get(collectionId.getValue());
        if (snapshot == null) {
            throw new ApiException(404, "Collection not found: " + collectionId.getValue());
        }
        return snapshot;
    }

    public int callCount() {
        return tokensSeen.size();
    }

    public List<String> tokensSeen() {
        synchronized (tokensSeen) {
            return List.copyOf(tokensSeen);
        }
    }
}
