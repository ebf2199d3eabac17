package com.docqa.rag.service.ingestion;

import com.docqa.rag.model.Chunk;

import java.util.List;

public interface TextChunker {

    /**
     * Splits extracted text into ordered, overlapping chunks. Identical input always yields identical
     * output, which keeps re-ingestion idempotent.
     */
    List<Chunk> chunk(String documentId, String text);
}
