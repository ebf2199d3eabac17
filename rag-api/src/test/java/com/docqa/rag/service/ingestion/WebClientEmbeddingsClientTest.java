package com.docqa.rag.service.ingestion;

import com.docqa.rag.config.RagProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientEmbeddingsClientTest {

    private RagProperties properties;

    @BeforeEach
    void setUp() {
        properties = new RagProperties();
        properties.getEmbeddings().setBatchSize(2);
        properties.getEmbeddings().getRetry().setInitialBackoff(Duration.ofMillis(1));
        properties.getEmbeddings().getRetry().setMaxBackoff(Duration.ofMillis(5));
    }

    private WebClientEmbeddingsClient client(ExchangeFunction exchange) {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://embeddings.test")
                .exchangeFunction(exchange)
                .build();
        return new WebClientEmbeddingsClient(webClient, properties);
    }

    private static Mono<ClientResponse> json(String body) {
        return Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }

    @Test
    void embedSplitsInputIntoBatchesAndKeepsOrder() {
        AtomicInteger calls = new AtomicInteger();
        WebClientEmbeddingsClient client = client(request -> {
            assertThat(request.url().getPath()).isEqualTo("/embed");
            return calls.incrementAndGet() == 1
                    ? json("{\"vectors\":[[1.0,0.0],[0.0,1.0]],\"model\":\"e5\",\"dimensions\":2}")
                    : json("{\"vectors\":[[0.5,0.5]],\"model\":\"e5\",\"dimensions\":2}");
        });

        EmbeddingsClient.EmbeddingBatch batch = client.embed(List.of("a", "b", "c"));

        assertThat(calls).hasValue(2);
        assertThat(batch.model()).isEqualTo("e5");
        assertThat(batch.dimensions()).isEqualTo(2);
        assertThat(batch.vectors()).hasSize(3);
        assertThat(batch.vectors().get(0)).containsExactly(1f, 0f);
        assertThat(batch.vectors().get(2)).containsExactly(0.5f, 0.5f);
    }

    @Test
    void transientFailureIsRetried() {
        AtomicInteger calls = new AtomicInteger();
        WebClientEmbeddingsClient client = client(request -> calls.incrementAndGet() == 1
                ? Mono.just(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build())
                : json("{\"vectors\":[[1.0]],\"model\":\"e5\",\"dimensions\":1}"));

        EmbeddingsClient.EmbeddingBatch batch = client.embed(List.of("only"));

        assertThat(calls).hasValue(2);
        assertThat(batch.size()).isEqualTo(1);
    }

    @Test
    void persistentFailureSurfacesAsUnavailable() {
        AtomicInteger calls = new AtomicInteger();
        WebClientEmbeddingsClient client = client(request -> {
            calls.incrementAndGet();
            return Mono.just(ClientResponse.create(HttpStatus.BAD_GATEWAY).build());
        });

        assertThatThrownBy(() -> client.embed(List.of("text")))
                .isInstanceOf(EmbeddingUnavailableException.class);
        assertThat(calls).hasValue(properties.getEmbeddings().getRetry().getMaxAttempts());
    }

    @Test
    void clientErrorIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        WebClientEmbeddingsClient client = client(request -> {
            calls.incrementAndGet();
            return Mono.just(ClientResponse.create(HttpStatus.BAD_REQUEST).build());
        });

        assertThatThrownBy(() -> client.embed(List.of("text")))
                .isInstanceOf(EmbeddingUnavailableException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void vectorCountMismatchIsRejected() {
        WebClientEmbeddingsClient client = client(request ->
                json("{\"vectors\":[[1.0]],\"model\":\"e5\",\"dimensions\":1}"));

        assertThatThrownBy(() -> client.embed(List.of("a", "b")))
                .isInstanceOf(EmbeddingUnavailableException.class)
                .hasMessageContaining("1 vectors for 2 texts");
    }

    @Test
    void emptyInputIsRejected() {
        WebClientEmbeddingsClient client = client(request -> json("{}"));

        assertThatThrownBy(() -> client.embed(List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
