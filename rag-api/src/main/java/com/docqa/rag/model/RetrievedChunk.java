package com.docqa.rag.model;

public record RetrievedChunk(Chunk chunk, double score) {

    public String chunkId() {
        return chunk.chunkId();
    }
}
