package com.docqa.rag.service.ingestion;

import com.docqa.rag.config.RagProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Offline stand-in for the embedding service: bag-of-words feature hashing, L2 normalised. Only meant
 * for local runs without network access.
 */
@Component
@Profile("template")
public class HashingEmbeddingsClient implements EmbeddingsClient {

    static final String MODEL = "hashing-v1";

    private final int dimension;

    @Autowired
    public HashingEmbeddingsClient(RagProperties properties) {
        this(properties.getEmbeddings().getHashingDimension());
    }

    public HashingEmbeddingsClient(int dimension) {
        this.dimension = dimension;
    }

    @Override
    public EmbeddingBatch embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            throw new IllegalArgumentException("No texts provided for embedding");
        }
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return new EmbeddingBatch(vectors, MODEL + "-" + dimension, dimension);
    }

    private float[] embed(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{Nd}]+")) {
            if (token.isBlank()) {
                continue;
            }
            vector[Math.floorMod(token.hashCode(), dimension)] += 1f;
        }
        float norm = 0f;
        for (float v : vector) {
            norm += v * v;
        }
        norm = (float) Math.sqrt(norm);
        if (norm > 0f) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] /= norm;
            }
        }
        return vector;
    }
}
