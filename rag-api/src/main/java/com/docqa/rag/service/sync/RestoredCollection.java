package com.docqa.rag.service.sync;

import com.docqa.rag.service.index.VectorIndex;

/**
 * Result of a restore. {@code generation} is {@code null} and {@code exists} false when no snapshot
 * has been persisted for the collection.
 */
public record RestoredCollection(String collectionId,
                                 VectorIndex index,
                                 long version,
                                 Long generation,
                                 boolean exists) {

    public static RestoredCollection absent(String collectionId) {
        return new RestoredCollection(collectionId, new VectorIndex(), 0L, null, false);
    }
}
