package com.docqa.rag.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Engine configuration bound from the {@code rag.*} namespace. Built once at startup, validated, and
 * injected into every component that needs a tunable.
 */
@Validated
@ConfigurationProperties(prefix = "rag")
public class RagProperties {

    @Valid
    private final Ingest ingest = new Ingest();

    @Valid
    private final Chunking chunking = new Chunking();

    @Valid
    private final Embeddings embeddings = new Embeddings();

    @Valid
    private final Retrieval retrieval = new Retrieval();

    @Valid
    private final Synthesis synthesis = new Synthesis();

    @Valid
    private final Generation generation = new Generation();

    @Valid
    private final Sync sync = new Sync();

    @Valid
    private final Sessions sessions = new Sessions();

    public Ingest getIngest() {
        return ingest;
    }

    public Chunking getChunking() {
        return chunking;
    }

    public Embeddings getEmbeddings() {
        return embeddings;
    }

    public Retrieval getRetrieval() {
        return retrieval;
    }

    public Synthesis getSynthesis() {
        return synthesis;
    }

    public Generation getGeneration() {
        return generation;
    }

    public Sync getSync() {
        return sync;
    }

    public Sessions getSessions() {
        return sessions;
    }

    public static class Ingest {

        /**
         * Largest accepted document, in bytes of extracted text.
         */
        @Positive
        private long maxDocumentBytes = 50L * 1024 * 1024;

        public long getMaxDocumentBytes() {
            return maxDocumentBytes;
        }

        public void setMaxDocumentBytes(long maxDocumentBytes) {
            this.maxDocumentBytes = maxDocumentBytes;
        }
    }

    public static class Chunking {

        /**
         * Target chunk length in characters.
         */
        @Positive
        private int targetSize = 1000;

        /**
         * Characters shared between consecutive chunks.
         */
        @PositiveOrZero
        private int overlap = 200;

        public int getTargetSize() {
            return targetSize;
        }

        public void setTargetSize(int targetSize) {
            this.targetSize = targetSize;
        }

        public int getOverlap() {
            return overlap;
        }

        public void setOverlap(int overlap) {
            this.overlap = overlap;
        }

        @AssertTrue(message = "rag.chunking.overlap must be smaller than rag.chunking.target-size")
        public boolean isOverlapBelowTargetSize() {
            return overlap < targetSize;
        }
    }

    public static class Embeddings {

        @NotBlank
        private String baseUrl = "http://localhost:9000";

        /**
         * Maximum number of texts sent in one embedding request.
         */
        @Positive
        private int batchSize = 64;

        @NotNull
        private Duration timeout = Duration.ofSeconds(30);

        /**
         * Vector length of the offline hashing embedder used by the {@code template} profile.
         */
        @Positive
        private int hashingDimension = 256;

        @Valid
        private final RetryPolicy retry = new RetryPolicy();

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getHashingDimension() {
            return hashingDimension;
        }

        public void setHashingDimension(int hashingDimension) {
            this.hashingDimension = hashingDimension;
        }

        public RetryPolicy getRetry() {
            return retry;
        }
    }

    public static class Retrieval {

        public enum Strategy {
            SIMILARITY,
            MMR
        }

        @Positive
        private int topK = 5;

        /**
         * Hits scoring below this cosine similarity are discarded.
         */
        @DecimalMin("-1.0")
        @DecimalMax("1.0")
        private double scoreThreshold = 0.0;

        @NotNull
        private Strategy strategy = Strategy.SIMILARITY;

        /**
         * Candidates fetched before maximal marginal relevance selection.
         */
        @Positive
        private int fetchK = 10;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double mmrLambda = 0.5;

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }

        public double getScoreThreshold() {
            return scoreThreshold;
        }

        public void setScoreThreshold(double scoreThreshold) {
            this.scoreThreshold = scoreThreshold;
        }

        public Strategy getStrategy() {
            return strategy;
        }

        public void setStrategy(Strategy strategy) {
            this.strategy = strategy;
        }

        public int getFetchK() {
            return fetchK;
        }

        public void setFetchK(int fetchK) {
            this.fetchK = fetchK;
        }

        public double getMmrLambda() {
            return mmrLambda;
        }

        public void setMmrLambda(double mmrLambda) {
            this.mmrLambda = mmrLambda;
        }
    }

    public static class Synthesis {

        /**
         * Character budget for the passages placed in the prompt.
         */
        @Positive
        private int maxContextChars = 12_000;

        /**
         * A passage is truncated into the remaining budget only if at least this many characters fit.
         */
        @Positive
        private int minPassageChars = 200;

        @Positive
        private int maxCitations = 5;

        public int getMaxContextChars() {
            return maxContextChars;
        }

        public void setMaxContextChars(int maxContextChars) {
            this.maxContextChars = maxContextChars;
        }

        public int getMinPassageChars() {
            return minPassageChars;
        }

        public void setMinPassageChars(int minPassageChars) {
            this.minPassageChars = minPassageChars;
        }

        public int getMaxCitations() {
            return maxCitations;
        }

        public void setMaxCitations(int maxCitations) {
            this.maxCitations = maxCitations;
        }
    }

    public static class Generation {

        @NotBlank
        private String baseUrl = "http://localhost:1234";

        private String apiKey = "";

        @NotBlank
        private String model = "gemini-2.5-flash";

        @DecimalMin("0.0")
        @DecimalMax("2.0")
        private double temperature = 0.1;

        @Positive
        private int maxOutputTokens = 1024;

        @NotNull
        private Duration timeout = Duration.ofSeconds(60);

        @Valid
        private final RetryPolicy retry = new RetryPolicy();

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxOutputTokens() {
            return maxOutputTokens;
        }

        public void setMaxOutputTokens(int maxOutputTokens) {
            this.maxOutputTokens = maxOutputTokens;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public RetryPolicy getRetry() {
            return retry;
        }
    }

    public static class Sync {

        /**
         * Root directory of the file system blob store.
         */
        @NotBlank
        private String blobRoot = "./data/blobs";

        @NotNull
        private String keyPrefix = "collections/";

        /**
         * Age after which a cached collection is checked against the durable snapshot generation.
         */
        @NotNull
        private Duration revalidateAfter = Duration.ofSeconds(30);

        /**
         * Read-modify-write attempts an ingest makes when another writer persisted first.
         */
        @Min(1)
        private int maxConflictRetries = 3;

        @Valid
        private final RetryPolicy retry = new RetryPolicy();

        public String getBlobRoot() {
            return blobRoot;
        }

        public void setBlobRoot(String blobRoot) {
            this.blobRoot = blobRoot;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public Duration getRevalidateAfter() {
            return revalidateAfter;
        }

        public void setRevalidateAfter(Duration revalidateAfter) {
            this.revalidateAfter = revalidateAfter;
        }

        public int getMaxConflictRetries() {
            return maxConflictRetries;
        }

        public void setMaxConflictRetries(int maxConflictRetries) {
            this.maxConflictRetries = maxConflictRetries;
        }

        public RetryPolicy getRetry() {
            return retry;
        }
    }

    public static class Sessions {

        /**
         * Default number of sessions returned when listing a user's history.
         */
        @Positive
        private int listLimit = 10;

        /**
         * Attempts made when a concurrent append from another instance claims the same sequence index.
         */
        @Min(1)
        private int appendRetries = 3;

        public int getListLimit() {
            return listLimit;
        }

        public void setListLimit(int listLimit) {
            this.listLimit = listLimit;
        }

        public int getAppendRetries() {
            return appendRetries;
        }

        public void setAppendRetries(int appendRetries) {
            this.appendRetries = appendRetries;
        }
    }

    public static class RetryPolicy {

        /**
         * Total attempts including the first call.
         */
        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration initialBackoff = Duration.ofMillis(500);

        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(5);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }
    }
}
