package com.docqa.rag.service.synthesis;

import com.docqa.rag.model.RetrievedChunk;

/**
 * A retrieved chunk as placed in the prompt under label {@code [S<number>]}. {@code text} may be a
 * truncated prefix of the chunk text.
 */
public record ContextPassage(int number, RetrievedChunk hit, String text, boolean truncated) {

    public String label() {
        return "S" + number;
    }
}
