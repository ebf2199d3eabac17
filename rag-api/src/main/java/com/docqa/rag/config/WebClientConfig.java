package com.docqa.rag.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient embeddingsWebClient(RagProperties properties) {
        RagProperties.Embeddings embeddings = properties.getEmbeddings();
        return baseClient(embeddings.getBaseUrl(), embeddings.getTimeout()).build();
    }

    @Bean
    public WebClient generationWebClient(RagProperties properties) {
        RagProperties.Generation generation = properties.getGeneration();
        WebClient.Builder builder = baseClient(generation.getBaseUrl(), generation.getTimeout());
        String apiKey = generation.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        builder.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        builder.defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        return builder.build();
    }

    private WebClient.Builder baseClient(String baseUrl, Duration responseTimeout) {
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(baseUrl)
                .exchangeStrategies(exchangeStrategies());
        if (responseTimeout != null && !responseTimeout.isZero() && !responseTimeout.isNegative()) {
            HttpClient httpClient = HttpClient.create().responseTimeout(responseTimeout);
            builder.clientConnector(new ReactorClientHttpConnector(httpClient));
        }
        return builder;
    }

    private ExchangeStrategies exchangeStrategies() {
        return ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();
    }
}
