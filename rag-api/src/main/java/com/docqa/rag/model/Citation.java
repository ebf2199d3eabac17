package com.docqa.rag.model;

public record Citation(String chunkId,
                       String documentId,
                       int sequenceIndex,
                       int charStart,
                       int charEnd,
                       String snippet) {
}
