package com.docqa.rag.service.synthesis.openai;

import com.docqa.rag.config.RagProperties;
import com.docqa.rag.config.Retries;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal client for OpenAI-compatible {@code /v1/chat/completions} endpoints.
 */
@Component
@Profile("!template")
public class OpenAiChatClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiChatClient.class);

    private final WebClient webClient;
    private final Duration timeout;
    private final RagProperties.RetryPolicy retryPolicy;

    public OpenAiChatClient(@Qualifier("generationWebClient") WebClient webClient, RagProperties properties) {
        this.webClient = webClient;
        this.timeout = properties.getGeneration().getTimeout();
        this.retryPolicy = properties.getGeneration().getRetry();
    }

    public ChatCompletionResponse complete(Request request) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("model", request.model());
        payload.put("messages", request.messages());
        payload.put("stream", Boolean.FALSE);
        if (request.temperature() != null) {
            payload.put("temperature", request.temperature());
        }
        if (request.maxTokens() != null) {
            payload.put("max_tokens", request.maxTokens());
        }

        try {
            return webClient.post()
                    .uri("/v1/chat/completions")
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(ChatCompletionResponse.class)
                    .timeout(timeout)
                    .retryWhen(Retries.backoff(retryPolicy, Retries::isTransientHttpFailure)
                            .doBeforeRetry(signal -> log.warn("Chat completion failed (attempt {}): {}",
                                    signal.totalRetries() + 1, signal.failure().getMessage())))
                    .block();
        } catch (WebClientResponseException ex) {
            HttpStatusCode status = ex.getStatusCode();
            log.warn("Chat completion returned {}: {}", status, ex.getResponseBodyAsString());
            throw new OpenAiChatException("Chat completion returned " + status.value(), ex);
        } catch (Exception ex) {
            log.warn("Chat completion failed: {}", ex.getMessage());
            throw new OpenAiChatException("Failed to invoke chat completion", ex);
        }
    }

    public record Request(String model,
                          List<Message> messages,
                          Double temperature,
                          Integer maxTokens) {
    }

    public record Message(String role, String content) {
    }

    public record ChatCompletionResponse(List<Choice> choices, Usage usage) {

        public Choice firstChoice() {
            return choices == null || choices.isEmpty() ? null : choices.get(0);
        }
    }

    public record Choice(Message message, @JsonProperty("finish_reason") String finishReason) {
    }

    public record Usage(@JsonProperty("total_tokens") int totalTokens,
                        @JsonProperty("prompt_tokens") int promptTokens,
                        @JsonProperty("completion_tokens") int completionTokens) {
    }
}
