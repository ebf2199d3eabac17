package com.docqa.rag.service.retrieval;

import com.docqa.rag.config.RagProperties;
import com.docqa.rag.model.RetrievedChunk;
import com.docqa.rag.service.index.VectorIndex;
import com.docqa.rag.service.ingestion.EmbeddingsClient;
import com.docqa.rag.service.sync.CollectionCache;
import com.docqa.rag.service.sync.LoadedCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

@Service
public class DenseRetriever implements Retriever {

    private static final Logger log = LoggerFactory.getLogger(DenseRetriever.class);

    private final CollectionCache collectionCache;
    private final EmbeddingsClient embeddingsClient;
    private final RagProperties.Retrieval settings;

    public DenseRetriever(CollectionCache collectionCache, EmbeddingsClient embeddingsClient, RagProperties properties) {
        this.collectionCache = collectionCache;
        this.embeddingsClient = embeddingsClient;
        this.settings = properties.getRetrieval();
    }

    @Override
    public RetrievalResult retrieve(String collectionId, String query) {
        return retrieve(collectionId, query, settings.getTopK(), settings.getScoreThreshold());
    }

    @Override
    public RetrievalResult retrieve(String collectionId, String query, int k, double scoreThreshold) {
        LoadedCollection collection = collectionCache.get(collectionId);
        VectorIndex index = collection.index();
        if (!collection.exists() && index.isEmpty()) {
            return RetrievalResult.noDocument();
        }
        if (index.isEmpty() || k <= 0) {
            return RetrievalResult.empty();
        }
        EmbeddingsClient.EmbeddingBatch embedded = embeddingsClient.embed(List.of(query));
        if (!Objects.equals(embedded.model(), index.modelVersion()) || embedded.dimensions() != index.dimension()) {
            log.warn("Query embedded with {} ({} dims) but collection {} holds {} ({} dims), returning no hits",
                    embedded.model(), embedded.dimensions(), collectionId, index.modelVersion(), index.dimension());
            return RetrievalResult.empty();
        }
        boolean mmr = settings.getStrategy() == RagProperties.Retrieval.Strategy.MMR;
        int fetch = mmr ? Math.max(k, settings.getFetchK()) : k;
        List<RetrievedChunk> hits = index.search(embedded.vectors().get(0), fetch).stream()
                .filter(hit -> hit.score() >= scoreThreshold)
                .toList();
        if (mmr) {
            hits = MaximalMarginalRelevance.select(hits, index::vectorOf, k, settings.getMmrLambda());
        } else if (hits.size() > k) {
            hits = hits.subList(0, k);
        }
        log.debug("Retrieved {} chunks from collection {} (version {})", hits.size(), collectionId, collection.version());
        return RetrievalResult.of(hits);
    }
}
