package com.docqa.rag.service.ingestion;

import com.docqa.rag.config.RagProperties;
import com.docqa.rag.config.Retries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Profile;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@Component
@Profile("!template")
public class WebClientEmbeddingsClient implements EmbeddingsClient {

    private static final Logger log = LoggerFactory.getLogger(WebClientEmbeddingsClient.class);

    private final WebClient embeddingsWebClient;
    private final int batchSize;
    private final Duration timeout;
    private final RagProperties.RetryPolicy retryPolicy;

    public WebClientEmbeddingsClient(@Qualifier("embeddingsWebClient") WebClient embeddingsWebClient,
                                     RagProperties properties) {
        this.embeddingsWebClient = embeddingsWebClient;
        this.batchSize = properties.getEmbeddings().getBatchSize();
        this.timeout = properties.getEmbeddings().getTimeout();
        this.retryPolicy = properties.getEmbeddings().getRetry();
    }

    @Override
    public EmbeddingBatch embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            throw new IllegalArgumentException("No texts provided for embedding");
        }
        List<float[]> vectors = new ArrayList<>(texts.size());
        String model = null;
        int dimensions = -1;
        for (int from = 0; from < texts.size(); from += batchSize) {
            List<String> batch = texts.subList(from, Math.min(texts.size(), from + batchSize));
            EmbedResponse response = requestBatch(batch);
            if (response == null || response.vectors() == null || response.vectors().size() != batch.size()) {
                throw new EmbeddingUnavailableException("Embeddings service returned "
                        + (response == null || response.vectors() == null ? 0 : response.vectors().size())
                        + " vectors for " + batch.size() + " texts");
            }
            if (model != null && !Objects.equals(model, response.model())) {
                throw new EmbeddingUnavailableException("Embedding model changed mid-request from " + model + " to " + response.model());
            }
            model = response.model();
            for (float[] vector : response.vectors()) {
                if (vector == null || vector.length == 0) {
                    throw new EmbeddingUnavailableException("Embeddings service returned an empty vector");
                }
                if (dimensions >= 0 && vector.length != dimensions) {
                    throw new EmbeddingUnavailableException("Embeddings service returned vectors of mixed dimension");
                }
                dimensions = vector.length;
                vectors.add(vector);
            }
        }
        log.debug("Embedded {} texts with model {} ({} dimensions)", texts.size(), model, dimensions);
        return new EmbeddingBatch(vectors, model, dimensions);
    }

    private EmbedResponse requestBatch(List<String> batch) {
        try {
            return embeddingsWebClient.post()
                    .uri("/embed")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(new EmbedRequest(batch))
                    .retrieve()
                    .bodyToMono(EmbedResponse.class)
                    .timeout(timeout)
                    .retryWhen(Retries.backoff(retryPolicy, Retries::isTransientHttpFailure)
                            .doBeforeRetry(signal -> log.warn("Embeddings call failed (attempt {}): {}",
                                    signal.totalRetries() + 1, signal.failure().getMessage())))
                    .block();
        } catch (EmbeddingUnavailableException ex) {
            throw ex;
        } catch (Exception e) {
            log.error("Embeddings service call failed: {}", e.getMessage());
            throw new EmbeddingUnavailableException("Failed to compute embeddings", e);
        }
    }

    private record EmbedRequest(List<String> texts) {}

    private record EmbedResponse(List<float[]> vectors, String model, int dimensions) {}
}
