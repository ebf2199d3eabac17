package com.docqa.rag.service.ingestion;

import com.docqa.rag.model.Chunk;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OverlappingTextChunkerTest {

    @Test
    void chunkSplitsLongTextOnParagraphBoundaryAndAppliesOverlap() {
        OverlappingTextChunker chunker = new OverlappingTextChunker(50, 10);
        String text = "Paragraph one providing context.\n\nParagraph two contains more detail about the process and should cause a split.";

        List<Chunk> chunks = chunker.chunk("doc", text);

        assertThat(chunks).hasSizeGreaterThanOrEqualTo(2);
        assertThat(chunks.get(0).text()).isEqualTo("Paragraph one providing context.\n\n");
        assertThat(chunks.get(chunks.size() - 1).text()).endsWith("split.");
        for (Chunk chunk : chunks) {
            assertThat(chunk.text().length()).isLessThanOrEqualTo(50);
            assertThat(text.substring(chunk.charStart(), chunk.charEnd())).isEqualTo(chunk.text());
        }
        for (int i = 1; i < chunks.size(); i++) {
            assertThat(chunks.get(i).charStart()).isLessThan(chunks.get(i - 1).charEnd());
            assertThat(chunks.get(i).charStart()).isGreaterThan(chunks.get(i - 1).charStart());
        }
    }

    @Test
    void chunkingTheSameTextTwiceGivesEqualChunks() {
        String text = "First section explains enrolment.\n\nSecond section lists the fees. Payment is due monthly.\n"
                + "Third line covers refunds and appeals in some detail so that a hard cut is needed somewhere.";

        List<Chunk> first = new OverlappingTextChunker(45, 12).chunk("guide", text);
        List<Chunk> second = new OverlappingTextChunker(45, 12).chunk("guide", text);

        assertThat(first).hasSizeGreaterThan(2);
        assertThat(second).isEqualTo(first);
    }

    @Test
    void chunksCoverWholeTextWithSequentialIds() {
        OverlappingTextChunker chunker = new OverlappingTextChunker(40, 8);
        String text = "alpha beta gamma delta epsilon zeta eta theta iota kappa lambda mu nu xi omicron pi rho sigma tau upsilon";

        List<Chunk> chunks = chunker.chunk("greek", text);

        assertThat(chunks.get(0).charStart()).isZero();
        assertThat(chunks.get(chunks.size() - 1).charEnd()).isEqualTo(text.length());
        for (int i = 0; i < chunks.size(); i++) {
            assertThat(chunks.get(i).sequenceIndex()).isEqualTo(i);
            assertThat(chunks.get(i).chunkId()).isEqualTo(Chunk.idFor("greek", i));
            assertThat(chunks.get(i).documentId()).isEqualTo("greek");
        }
        for (int i = 1; i < chunks.size(); i++) {
            assertThat(chunks.get(i).charStart()).isLessThanOrEqualTo(chunks.get(i - 1).charEnd());
        }
    }

    @Test
    void textWithoutSeparatorsIsCutAtChunkSize() {
        OverlappingTextChunker chunker = new OverlappingTextChunker(10, 2);

        List<Chunk> chunks = chunker.chunk("doc", "abcdefghijklmnopqrstuvwxyz");

        assertThat(chunks).extracting(Chunk::text)
                .containsExactly("abcdefghij", "ijklmnopqr", "qrstuvwxyz");
    }

    @Test
    void shortTextProducesSingleChunk() {
        OverlappingTextChunker chunker = new OverlappingTextChunker(1000, 200);

        List<Chunk> chunks = chunker.chunk("doc", "Just one line.");

        assertThat(chunks).singleElement().satisfies(chunk -> {
            assertThat(chunk.text()).isEqualTo("Just one line.");
            assertThat(chunk.charStart()).isZero();
            assertThat(chunk.charEnd()).isEqualTo(14);
        });
    }

    @Test
    void blankTextProducesNoChunks() {
        OverlappingTextChunker chunker = new OverlappingTextChunker(100, 10);

        assertThat(chunker.chunk("doc", "")).isEmpty();
        assertThat(chunker.chunk("doc", "   \n\n  ")).isEmpty();
        assertThat(chunker.chunk("doc", null)).isEmpty();
    }

    @Test
    void rejectsOverlapNotSmallerThanChunkSize() {
        assertThatThrownBy(() -> new OverlappingTextChunker(10, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new OverlappingTextChunker(0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
