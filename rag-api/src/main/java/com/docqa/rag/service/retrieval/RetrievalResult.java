package com.docqa.rag.service.retrieval;

import com.docqa.rag.model.RetrievedChunk;

import java.util.List;

public record RetrievalResult(Status status, List<RetrievedChunk> chunks) {

    public enum Status {
        FOUND,
        /** Nothing scored above the threshold, or the collection holds no chunks. */
        EMPTY,
        /** The collection was never ingested. */
        NO_DOCUMENT
    }

    public RetrievalResult {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
    }

    public static RetrievalResult noDocument() {
        return new RetrievalResult(Status.NO_DOCUMENT, List.of());
    }

    public static RetrievalResult empty() {
        return new RetrievalResult(Status.EMPTY, List.of());
    }

    public static RetrievalResult of(List<RetrievedChunk> chunks) {
        return chunks.isEmpty() ? empty() : new RetrievalResult(Status.FOUND, chunks);
    }
}
