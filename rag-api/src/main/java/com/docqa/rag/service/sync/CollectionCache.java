package com.docqa.rag.service.sync;

import com.docqa.rag.config.KeyedLocks;
import com.docqa.rag.config.RagProperties;
import com.docqa.rag.service.index.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Per-instance cache of restored collections. Durable storage stays the source of truth: entries older
 * than {@code rag.sync.revalidate-after} are checked against the stored generation. Collections without a
 * snapshot are never cached, so every read of one goes to storage.
 */
@Component
public class CollectionCache {

    private static final Logger log = LoggerFactory.getLogger(CollectionCache.class);

    private final Map<String, LoadedCollection> collections = new ConcurrentHashMap<>();
    private final KeyedLocks<String> writeLocks = new KeyedLocks<>();
    private final IndexSyncManager syncManager;
    private final Duration revalidateAfter;
    private final Clock clock;

    @Autowired
    public CollectionCache(IndexSyncManager syncManager, RagProperties properties) {
        this(syncManager, properties.getSync().getRevalidateAfter(), Clock.systemUTC());
    }

    public CollectionCache(IndexSyncManager syncManager, Duration revalidateAfter, Clock clock) {
        this.syncManager = syncManager;
        this.revalidateAfter = revalidateAfter;
        this.clock = clock;
    }

    public LoadedCollection get(String collectionId) {
        LoadedCollection current = collections.get(collectionId);
        if (current == null) {
            return reload(collectionId);
        }
        if (current.exists() && current.loadedAt().plus(revalidateAfter).isAfter(clock.instant())) {
            return current;
        }
        Optional<Long> stored = syncManager.currentGeneration(collectionId);
        if (Objects.equals(stored.orElse(null), current.generation())) {
            LoadedCollection touched = current.touched(clock.instant());
            collections.replace(collectionId, current, touched);
            return touched;
        }
        log.debug("Collection {} changed in storage (generation {} -> {}), reloading",
                collectionId, current.generation(), stored.orElse(null));
        return reload(collectionId);
    }

    /**
     * Restores the collection from durable storage, bypassing the cached entry.
     */
    public LoadedCollection reload(String collectionId) {
        LoadedCollection fresh = LoadedCollection.restored(syncManager.restore(collectionId), clock.instant());
        if (!fresh.exists()) {
            collections.remove(collectionId);
            return fresh;
        }
        return collections.merge(collectionId, fresh, CollectionCache::newer);
    }

    /**
     * Publishes an index that was just persisted as {@code version} with {@code generation}.
     */
    public LoadedCollection publish(String collectionId, VectorIndex index, long version, long generation) {
        LoadedCollection written = LoadedCollection.persisted(collectionId, index, version, generation, clock.instant());
        return collections.merge(collectionId, written, CollectionCache::newer);
    }

    public void evict(String collectionId) {
        collections.remove(collectionId);
    }

    /**
     * Runs {@code work} as the single local writer of the collection.
     */
    public <T> T withWriteLock(String collectionId, Supplier<T> work) {
        try (KeyedLocks.Held ignored = writeLocks.acquire(collectionId)) {
            return work.get();
        }
    }

    int cachedCount() {
        return collections.size();
    }

    int writeLockCount() {
        return writeLocks.size();
    }

    // Later generation wins.
    private static LoadedCollection newer(LoadedCollection cached, LoadedCollection incoming) {
        if (cached.generation() == null) {
            return incoming;
        }
        return incoming.generation() >= cached.generation() ? incoming : cached;
    }
}
