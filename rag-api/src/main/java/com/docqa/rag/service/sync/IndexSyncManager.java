package com.docqa.rag.service.sync;

import com.docqa.rag.config.RagProperties;
import com.docqa.rag.config.Retries;
import com.docqa.rag.service.index.VectorIndex;
import com.docqa.rag.service.sync.blob.Blob;
import com.docqa.rag.service.sync.blob.BlobStorageException;
import com.docqa.rag.service.sync.blob.BlobStore;
import com.docqa.rag.service.sync.blob.Precondition;
import com.docqa.rag.service.sync.blob.PreconditionFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Mirrors collection indexes to durable blob storage. Writes are optimistic: a snapshot lands only if
 * its version is greater than the stored one and nobody wrote in between.
 */
@Service
public class IndexSyncManager {

    private static final Logger log = LoggerFactory.getLogger(IndexSyncManager.class);

    private final BlobStore blobStore;
    private final IndexSnapshotCodec codec;
    private final String keyPrefix;
    private final RagProperties.RetryPolicy retryPolicy;

    public IndexSyncManager(BlobStore blobStore, IndexSnapshotCodec codec, RagProperties properties) {
        this.blobStore = blobStore;
        this.codec = codec;
        this.keyPrefix = properties.getSync().getKeyPrefix();
        this.retryPolicy = properties.getSync().getRetry();
    }

    public RestoredCollection restore(String collectionId) {
        Optional<Blob> blob = withRetry("restore " + collectionId, () -> blobStore.get(keyFor(collectionId)));
        if (blob.isEmpty()) {
            log.debug("No snapshot for collection {}", collectionId);
            return RestoredCollection.absent(collectionId);
        }
        IndexSnapshotCodec.IndexSnapshot snapshot = codec.decode(blob.get().content());
        VectorIndex index = snapshot.toIndex();
        log.info("Restored collection {} at version {} ({} chunks, generation {})",
                collectionId, snapshot.version(), index.size(), blob.get().generation());
        return new RestoredCollection(collectionId, index, snapshot.version(), blob.get().generation(), true);
    }

    /**
     * Writes {@code index} as version {@code version}.
     *
     * @return generation of the written snapshot
     * @throws StaleVersionException when the stored version is not lower or another writer got there first
     */
    public long persist(String collectionId, VectorIndex index, long version) {
        String key = keyFor(collectionId);
        Optional<Blob> current = withRetry("read " + collectionId, () -> blobStore.get(key));
        Precondition precondition = Precondition.ifAbsent();
        if (current.isPresent()) {
            long storedVersion = codec.readVersion(current.get().content());
            if (version <= storedVersion) {
                log.warn("Rejected version {} of collection {}, stored version is {}", version, collectionId, storedVersion);
                throw new StaleVersionException(collectionId, version, storedVersion);
            }
            precondition = Precondition.ifGenerationMatch(current.get().generation());
        }
        byte[] bytes = codec.encode(collectionId, index, version, Instant.now());
        Precondition guard = precondition;
        long generation;
        try {
            generation = withRetry("persist " + collectionId, () -> blobStore.put(key, bytes, guard));
        } catch (PreconditionFailedException e) {
            log.warn("Lost write race for collection {} at version {}", collectionId, version);
            throw new StaleVersionException(collectionId, version, e);
        }
        log.info("Persisted collection {} version {} ({} chunks, {} bytes, generation {})",
                collectionId, version, index.size(), bytes.length, generation);
        return generation;
    }

    public boolean delete(String collectionId) {
        boolean deleted = withRetry("delete " + collectionId, () -> blobStore.delete(keyFor(collectionId)));
        if (deleted) {
            log.info("Deleted snapshot of collection {}", collectionId);
        }
        return deleted;
    }

    /**
     * Generation of the stored snapshot, empty when the collection has none.
     */
    public Optional<Long> currentGeneration(String collectionId) {
        return withRetry("probe " + collectionId, () -> blobStore.head(keyFor(collectionId)));
    }

    String keyFor(String collectionId) {
        return keyPrefix + collectionId + ".json.gz";
    }

    private <T> T withRetry(String operation, Callable<T> call) {
        return Mono.fromCallable(call)
                .retryWhen(Retries.backoff(retryPolicy, BlobStorageException.class::isInstance)
                        .doBeforeRetry(signal -> log.warn("Blob storage {} failed (attempt {}): {}",
                                operation, signal.totalRetries() + 1, signal.failure().getMessage())))
                .block();
    }
}
