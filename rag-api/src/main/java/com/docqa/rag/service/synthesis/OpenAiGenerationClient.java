package com.docqa.rag.service.synthesis;

import com.docqa.rag.config.RagProperties;
import com.docqa.rag.service.synthesis.openai.OpenAiChatClient;
import com.docqa.rag.service.synthesis.openai.OpenAiChatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Profile("!template")
public class OpenAiGenerationClient implements GenerationClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiGenerationClient.class);

    private final OpenAiChatClient chatClient;
    private final String model;
    private final double temperature;
    private final int maxOutputTokens;

    public OpenAiGenerationClient(OpenAiChatClient chatClient, RagProperties properties) {
        this.chatClient = chatClient;
        RagProperties.Generation generation = properties.getGeneration();
        this.model = generation.getModel();
        this.temperature = generation.getTemperature();
        this.maxOutputTokens = generation.getMaxOutputTokens();
    }

    @Override
    public GenerationResponse generate(GenerationRequest request) {
        List<OpenAiChatClient.Message> messages = List.of(
                new OpenAiChatClient.Message("system", request.systemPrompt()),
                new OpenAiChatClient.Message("user", request.userPrompt()));
        OpenAiChatClient.ChatCompletionResponse response;
        try {
            response = chatClient.complete(new OpenAiChatClient.Request(model, messages, temperature, maxOutputTokens));
        } catch (OpenAiChatException ex) {
            throw new GenerationUnavailableException("Generation service unavailable: " + ex.getMessage(), true, ex);
        }
        OpenAiChatClient.Choice choice = response == null ? null : response.firstChoice();
        if (choice == null) {
            log.warn("Chat completion returned no choices for model {}", model);
            return GenerationResponse.of("");
        }
        if ("content_filter".equals(choice.finishReason())) {
            log.warn("Chat completion refused by content filter for model {}", model);
            throw new GenerationUnavailableException("Generation refused by content filter", false);
        }
        String text = choice.message() == null ? "" : choice.message().content();
        if (response.usage() != null) {
            log.debug("Chat completion used {} tokens ({} prompt)", response.usage().totalTokens(),
                    response.usage().promptTokens());
        }
        return new GenerationResponse(text, List.of(), choice.finishReason());
    }
}
