package com.docqa.rag.service.retrieval;

import com.docqa.rag.model.RetrievedChunk;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Greedy maximal marginal relevance selection: each step takes the candidate maximising
 * {@code lambda * relevance - (1 - lambda) * max similarity to the already selected ones}.
 */
final class MaximalMarginalRelevance {

    private MaximalMarginalRelevance() {
    }

    static List<RetrievedChunk> select(List<RetrievedChunk> candidates,
                                       Function<String, float[]> vectors,
                                       int k,
                                       double lambda) {
        if (k <= 0) {
            return List.of();
        }
        if (candidates.size() <= 1) {
            return List.copyOf(candidates);
        }
        List<RetrievedChunk> remaining = new ArrayList<>(candidates);
        List<float[]> remainingVectors = new ArrayList<>(candidates.size());
        for (RetrievedChunk candidate : candidates) {
            remainingVectors.add(vectors.apply(candidate.chunkId()));
        }
        List<RetrievedChunk> selected = new ArrayList<>(Math.min(k, candidates.size()));
        List<float[]> selectedVectors = new ArrayList<>();
        while (selected.size() < k && !remaining.isEmpty()) {
            int best = 0;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < remaining.size(); i++) {
                double redundancy = 0.0;
                for (float[] chosen : selectedVectors) {
                    redundancy = Math.max(redundancy, cosine(remainingVectors.get(i), chosen));
                }
                double score = lambda * remaining.get(i).score() - (1.0 - lambda) * redundancy;
                // candidates arrive ranked, strict comparison keeps the earlier one on ties
                if (score > bestScore) {
                    bestScore = score;
                    best = i;
                }
            }
            selected.add(remaining.remove(best));
            selectedVectors.add(remainingVectors.remove(best));
        }
        return List.copyOf(selected);
    }

    private static double cosine(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
