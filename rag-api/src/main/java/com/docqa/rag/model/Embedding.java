package com.docqa.rag.model;

public record Embedding(String chunkId, float[] vector, String modelVersion) {

    public int dimension() {
        return vector == null ? 0 : vector.length;
    }
}
