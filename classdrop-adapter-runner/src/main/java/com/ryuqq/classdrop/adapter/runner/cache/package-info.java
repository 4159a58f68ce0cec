/**
 * Dual-bounded LRU cache of catalog snapshots.
 *
 * <p>Entries are bounded by count and by aggregate serialized size. The least recently used
 * entry is evicted first, and oversized payloads are truncated before they are stored.</p>
 *
 * @since 1.0.0
 * @author ClassDrop Team
 */
package com.ryuqq.classdrop.adapter.runner.cache;
