package com.docqa.rag.service.ingestion;

import java.util.List;

public interface EmbeddingsClient {

    /**
     * Returns one vector per input text, in input order.
     *
     * @throws EmbeddingUnavailableException when the service stays unreachable after retries
     */
    EmbeddingBatch embed(List<String> texts);

    record EmbeddingBatch(List<float[]> vectors, String model, int dimensions) {

        public EmbeddingBatch {
            vectors = List.copyOf(vectors);
        }

        public int size() {
            return vectors.size();
        }
    }
}
