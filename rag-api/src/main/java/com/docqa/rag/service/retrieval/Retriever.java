package com.docqa.rag.service.retrieval;

public interface Retriever {

    RetrievalResult retrieve(String collectionId, String query, int k, double scoreThreshold);

    /**
     * Retrieves with the configured {@code rag.retrieval} defaults.
     */
    RetrievalResult retrieve(String collectionId, String query);
}
