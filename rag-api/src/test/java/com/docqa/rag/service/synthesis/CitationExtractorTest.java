package com.docqa.rag.service.synthesis;

import com.docqa.rag.model.Chunk;
import com.docqa.rag.model.Citation;
import com.docqa.rag.model.RetrievedChunk;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CitationExtractorTest {

    private static ContextPassage passage(int number, String text) {
        Chunk chunk = new Chunk("doc#" + (number - 1), "doc", number - 1, text, (number - 1) * 100, (number - 1) * 100 + text.length());
        return new ContextPassage(number, new RetrievedChunk(chunk, 0.9 - number * 0.1), text, false);
    }

    private final List<ContextPassage> passages = List.of(
            passage(1, "Opening hours are nine to five."),
            passage(2, "The deadline is 30 September 2025."),
            passage(3, "Late submissions are not accepted."));

    @Test
    void markersAreResolvedInMentionOrderWithoutDuplicates() {
        CitationExtractor extractor = new CitationExtractor(5);

        List<Citation> citations = extractor.extract("Submit by 30 September 2025 [S2]. Late work is refused [S3, S2].",
                passages, List.of());

        assertThat(citations).extracting(Citation::chunkId).containsExactly("doc#1", "doc#2");
        assertThat(citations.get(0).snippet()).isEqualTo("The deadline is 30 September 2025.");
        assertThat(citations.get(0).charStart()).isEqualTo(100);
    }

    @Test
    void reportedPassagesTakePrecedenceOverMarkers() {
        CitationExtractor extractor = new CitationExtractor(5);

        List<Citation> citations = extractor.extract("Answer [S1]", passages, List.of(3));

        assertThat(citations).extracting(Citation::chunkId).containsExactly("doc#2");
    }

    @Test
    void unknownMarkersFallBackToTopPassage() {
        CitationExtractor extractor = new CitationExtractor(5);

        assertThat(extractor.extract("Answer [S9]", passages, List.of()))
                .extracting(Citation::chunkId).containsExactly("doc#0");
        assertThat(extractor.extract("No markers at all", passages, List.of()))
                .extracting(Citation::chunkId).containsExactly("doc#0");
    }

    @Test
    void citationCountIsCapped() {
        CitationExtractor extractor = new CitationExtractor(2);

        assertThat(extractor.extract("[S1][S2][S3]", passages, List.of())).hasSize(2);
    }

    @Test
    void longSnippetsAreShortened() {
        String longText = "word ".repeat(100);
        CitationExtractor extractor = new CitationExtractor(1);

        Citation citation = extractor.extract("[S1]", List.of(passage(1, longText)), List.of()).get(0);

        assertThat(citation.snippet()).hasSize(220).endsWith("...");
    }

    @Test
    void markersParsesGroupedLabels() {
        assertThat(CitationExtractor.markers("see [S1; S4] and [ S2 ] but not S3 or [X1]"))
                .containsExactly(1, 4, 2);
        assertThat(CitationExtractor.markers(null)).isEmpty();
    }
}
