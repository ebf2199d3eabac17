package com.docqa.rag.service.synthesis;

import com.docqa.rag.config.RagProperties;
import com.docqa.rag.model.Citation;
import com.docqa.rag.model.RetrievedChunk;
import com.docqa.rag.model.Turn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

@Service
public class GroundedAnswerSynthesizer implements AnswerSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(GroundedAnswerSynthesizer.class);

    static final String NOT_FOUND_REPLY = "NOT_FOUND";

    private static final String SYSTEM_PROMPT = "You answer questions about a document using only the numbered passages "
            + "supplied with the question. Never use outside knowledge and never guess. Cite every passage you rely "
            + "on inline as [S<number>], for example [S2]. If the passages do not contain the answer, reply with "
            + "exactly " + NOT_FOUND_REPLY + " and nothing else. Write the answer in %s.";

    private final GenerationClient generationClient;
    private final LanguageHintResolver languageResolver;
    private final ContextBudget contextBudget;
    private final CitationExtractor citationExtractor;

    public GroundedAnswerSynthesizer(GenerationClient generationClient,
                                     LanguageHintResolver languageResolver,
                                     RagProperties properties) {
        this.generationClient = generationClient;
        this.languageResolver = languageResolver;
        RagProperties.Synthesis synthesis = properties.getSynthesis();
        this.contextBudget = new ContextBudget(synthesis.getMaxContextChars(), synthesis.getMinPassageChars());
        this.citationExtractor = new CitationExtractor(synthesis.getMaxCitations());
    }

    @Override
    public SynthesizedAnswer synthesize(String question, List<RetrievedChunk> hits, String language) {
        String resolved = language == null || language.isBlank() ? languageResolver.detect(question) : language;
        if (hits == null || hits.isEmpty()) {
            return SynthesizedAnswer.notFound(languageResolver.notFoundMessage(resolved), resolved);
        }
        List<RetrievedChunk> ranked = hits.stream()
                .sorted(Comparator.comparingDouble(RetrievedChunk::score).reversed())
                .toList();
        ContextBudget.BudgetedContext context = contextBudget.enforce(ranked);
        if (context.passages().isEmpty()) {
            log.debug("No passage fitted the context budget for question of {} chars", question.length());
            return SynthesizedAnswer.notFound(languageResolver.notFoundMessage(resolved), resolved);
        }
        if (context.truncated()) {
            log.debug("Context truncated to {} passages", context.passages().size());
        }

        GenerationRequest request = new GenerationRequest(
                String.format(Locale.ROOT, SYSTEM_PROMPT, languageResolver.languageName(resolved)),
                buildUserPrompt(question, context.passages()),
                question,
                resolved,
                context.passages());
        GenerationResponse response = generationClient.generate(request);

        String text = response.text() == null ? "" : response.text().trim();
        if (text.isEmpty() || text.toUpperCase(Locale.ROOT).startsWith(NOT_FOUND_REPLY)) {
            return SynthesizedAnswer.notFound(languageResolver.notFoundMessage(resolved), resolved);
        }
        List<Citation> citations = citationExtractor.extract(text, context.passages(), response.usedPassages());
        return new SynthesizedAnswer(Turn.Status.ANSWERED, text, citations, resolved);
    }

    private String buildUserPrompt(String question, List<ContextPassage> passages) {
        StringBuilder builder = new StringBuilder("Passages:\n");
        for (ContextPassage passage : passages) {
            builder.append('[').append(passage.label()).append("] ")
                    .append(passage.text())
                    .append("\n\n");
        }
        builder.append("Question: ").append(question == null ? "" : question.trim());
        return builder.toString();
    }
}
