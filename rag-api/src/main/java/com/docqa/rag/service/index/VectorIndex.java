package com.docqa.rag.service.index;

import com.docqa.rag.model.Chunk;
import com.docqa.rag.model.RetrievedChunk;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * In-process cosine similarity index over the chunks of one collection. Every vector in an index comes
 * from the same embedding model and has the same dimension.
 * <p>
 * Not thread-safe. Readers get a published instance that is never mutated again; writers work on a
 * {@link #copy()}.
 */
public class VectorIndex {

    private static final Comparator<RetrievedChunk> RANKING = Comparator
            .comparingDouble(RetrievedChunk::score).reversed()
            .thenComparingInt(hit -> hit.chunk().sequenceIndex())
            .thenComparing(hit -> hit.chunk().documentId())
            .thenComparing(RetrievedChunk::chunkId);

    private static final Comparator<Chunk> DOCUMENT_ORDER = Comparator
            .comparing(Chunk::documentId)
            .thenComparingInt(Chunk::sequenceIndex);

    private final Map<String, IndexedChunk> entries = new HashMap<>();
    private String modelVersion;
    private int dimension;

    public VectorIndex() {
    }

    public VectorIndex(String modelVersion, int dimension) {
        this.modelVersion = modelVersion;
        this.dimension = dimension;
    }

    /**
     * Adds or replaces a chunk. The first vector added to an empty index without a declared model fixes
     * the model and dimension.
     */
    public void add(Chunk chunk, float[] vector, String vectorModel) {
        Objects.requireNonNull(chunk, "chunk");
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("Chunk " + chunk.chunkId() + " has no vector");
        }
        if (modelVersion == null) {
            modelVersion = vectorModel;
            dimension = vector.length;
        }
        if (!Objects.equals(modelVersion, vectorModel)) {
            throw new IllegalArgumentException("Index holds " + modelVersion + " vectors, got " + vectorModel);
        }
        if (vector.length != dimension) {
            throw new IllegalArgumentException("Index dimension is " + dimension + ", got " + vector.length);
        }
        float[] stored = Arrays.copyOf(vector, vector.length);
        entries.put(chunk.chunkId(), new IndexedChunk(chunk, stored, norm(stored)));
    }

    /**
     * Returns at most {@code k} chunks ordered by descending cosine similarity. Ties go to the lower
     * sequence index, then document id, then chunk id.
     */
    public List<RetrievedChunk> search(float[] query, int k) {
        if (k <= 0 || entries.isEmpty()) {
            return List.of();
        }
        if (query == null || query.length != dimension) {
            throw new IllegalArgumentException("Query dimension " + (query == null ? 0 : query.length)
                    + " does not match index dimension " + dimension);
        }
        double queryNorm = norm(query);
        List<RetrievedChunk> hits = new ArrayList<>(entries.size());
        for (IndexedChunk entry : entries.values()) {
            hits.add(new RetrievedChunk(entry.chunk(), cosine(query, queryNorm, entry.vector, entry.norm())));
        }
        hits.sort(RANKING);
        return hits.size() > k ? List.copyOf(hits.subList(0, k)) : List.copyOf(hits);
    }

    /**
     * Removes every chunk of the document.
     *
     * @return number of chunks removed
     */
    public int removeDocument(String documentId) {
        int before = entries.size();
        entries.values().removeIf(entry -> entry.chunk().documentId().equals(documentId));
        return before - entries.size();
    }

    public List<Chunk> chunksOf(String documentId) {
        return entries.values().stream()
                .map(IndexedChunk::chunk)
                .filter(chunk -> chunk.documentId().equals(documentId))
                .sorted(DOCUMENT_ORDER)
                .toList();
    }

    public Set<String> documentIds() {
        Set<String> ids = new TreeSet<>();
        entries.values().forEach(entry -> ids.add(entry.chunk().documentId()));
        return ids;
    }

    public float[] vectorOf(String chunkId) {
        IndexedChunk entry = entries.get(chunkId);
        return entry == null ? null : entry.vector();
    }

    public boolean contains(String chunkId) {
        return entries.containsKey(chunkId);
    }

    /**
     * Chunks with their vectors, in document then sequence order.
     */
    public List<IndexedChunk> entries() {
        return entries.values().stream()
                .sorted(Comparator.comparing(IndexedChunk::chunk, DOCUMENT_ORDER))
                .toList();
    }

    public VectorIndex copy() {
        VectorIndex copy = new VectorIndex(modelVersion, dimension);
        copy.entries.putAll(entries);
        return copy;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public String modelVersion() {
        return modelVersion;
    }

    public int dimension() {
        return dimension;
    }

    private static double cosine(float[] a, double normA, float[] b, double normB) {
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double dot = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
        }
        return dot / (normA * normB);
    }

    private static double norm(float[] vector) {
        double sum = 0.0;
        for (float v : vector) {
            sum += v * v;
        }
        return Math.sqrt(sum);
    }

    /**
     * Copies of an index share entries; {@link #vector()} hands out a copy of the stored vector.
     */
    public record IndexedChunk(Chunk chunk, float[] vector, double norm) {

        @Override
        public float[] vector() {
            return Arrays.copyOf(vector, vector.length);
        }
    }
}
