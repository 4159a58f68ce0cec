/**
 * In-memory key-value store adapter.
 *
 * <p>{@link com.ryuqq.classdrop.adapter.inmemory.store.InMemoryKeyValueStore} backs the
 * rate limiter state, the record cache, the credential and the refresh lock in tests.
 * It simulates a byte quota so that cache shrink-and-retry paths can be exercised.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @see com.ryuqq.classdrop.core.spi.KeyValueStore
 * @author ClassDrop Team
 * @since 1.0.0
 */
package com.ryuqq.classdrop.adapter.inmemory.store;
