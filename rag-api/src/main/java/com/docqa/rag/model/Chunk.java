package com.docqa.rag.model;

/**
 * Contiguous passage of a document's extracted text. {@code charStart} is inclusive and
 * {@code charEnd} exclusive, both indexes into the extracted text.
 */
public record Chunk(String chunkId,
                    String documentId,
                    int sequenceIndex,
                    String text,
                    int charStart,
                    int charEnd) {

    public static String idFor(String documentId, int sequenceIndex) {
        return documentId + "#" + sequenceIndex;
    }
}
