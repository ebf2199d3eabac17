package com.docqa.rag.service.synthesis;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Offline extractive stand-in for the generation service. Answers with the passage sentence sharing
 * the most terms with the question, or {@code NOT_FOUND} when no sentence shares any.
 */
@Component
@Profile("template")
public class TemplateGenerationClient implements GenerationClient {

    private static final Set<String> IGNORED = Set.of("what", "when", "where", "which", "who", "whom", "whose",
            "why", "how", "the", "is", "are", "was", "were", "does", "did", "a", "an", "of", "to", "in", "on",
            "for", "and", "or", "it", "this", "that", "do", "be", "by", "with", "as", "at", "from");

    @Override
    public GenerationResponse generate(GenerationRequest request) {
        Set<String> questionTerms = terms(request.question());
        String bestSentence = null;
        int bestPassage = -1;
        int bestScore = 0;
        for (ContextPassage passage : request.passages()) {
            for (String sentence : passage.text().split("(?<=[.!?])\\s+|\\n+")) {
                int score = 0;
                for (String term : terms(sentence)) {
                    if (questionTerms.contains(term)) {
                        score++;
                    }
                }
                if (score > bestScore) {
                    bestScore = score;
                    bestSentence = sentence.trim();
                    bestPassage = passage.number();
                }
            }
        }
        if (bestSentence == null) {
            return GenerationResponse.of(GroundedAnswerSynthesizer.NOT_FOUND_REPLY);
        }
        return new GenerationResponse(bestSentence + " [S" + bestPassage + "]", List.of(bestPassage), "stop");
    }

    private Set<String> terms(String text) {
        Set<String> terms = new HashSet<>();
        if (text == null) {
            return terms;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{Nd}]+")) {
            if (token.length() > 1 && !IGNORED.contains(token)) {
                terms.add(token);
            }
        }
        return terms;
    }
}
