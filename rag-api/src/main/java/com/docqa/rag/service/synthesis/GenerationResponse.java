package com.docqa.rag.service.synthesis;

import java.util.List;

/**
 * @param usedPassages passage numbers the service reports as used, empty when it does not say
 */
public record GenerationResponse(String text, List<Integer> usedPassages, String finishReason) {

    public GenerationResponse {
        usedPassages = usedPassages == null ? List.of() : List.copyOf(usedPassages);
    }

    public static GenerationResponse of(String text) {
        return new GenerationResponse(text, List.of(), "stop");
    }
}
