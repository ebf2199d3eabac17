package com.docqa.rag.service.sync;

import com.docqa.rag.service.index.VectorIndex;

import java.time.Instant;

/**
 * Cached view of a collection. The index is published read-only: writers work on
 * {@link VectorIndex#copy()} and publish a new entry after a successful persist.
 *
 * @param lastSyncedVersion version confirmed in durable storage; equals {@code version} for every
 *                          entry the cache publishes
 * @param generation        blob generation the entry was read from or written as, {@code null} if the
 *                          collection has no snapshot
 */
public record LoadedCollection(String collectionId,
                               VectorIndex index,
                               long version,
                               long lastSyncedVersion,
                               Long generation,
                               boolean exists,
                               Instant loadedAt) {

    static LoadedCollection restored(RestoredCollection restored, Instant now) {
        return new LoadedCollection(restored.collectionId(), restored.index(), restored.version(),
                restored.version(), restored.generation(), restored.exists(), now);
    }

    static LoadedCollection persisted(String collectionId, VectorIndex index, long version, long generation, Instant now) {
        return new LoadedCollection(collectionId, index, version, version, generation, true, now);
    }

    LoadedCollection touched(Instant now) {
        return new LoadedCollection(collectionId, index, version, lastSyncedVersion, generation, exists, now);
    }
}
