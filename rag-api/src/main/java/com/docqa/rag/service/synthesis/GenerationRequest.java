package com.docqa.rag.service.synthesis;

import java.util.List;

public record GenerationRequest(String systemPrompt,
                                String userPrompt,
                                String question,
                                String language,
                                List<ContextPassage> passages) {
}
