package com.docqa.rag.service.sync.blob;

import java.util.Optional;

/**
 * Durable key/value storage for collection snapshots. Every successful write produces a strictly
 * larger generation for its key.
 */
public interface BlobStore {

    Optional<Blob> get(String key);

    /**
     * Generation of the stored blob without reading its content.
     */
    Optional<Long> head(String key);

    /**
     * @return generation of the written blob
     * @throws PreconditionFailedException when the stored state does not satisfy {@code precondition}
     */
    long put(String key, byte[] content, Precondition precondition);

    /**
     * @return whether a blob was removed
     */
    boolean delete(String key);
}
