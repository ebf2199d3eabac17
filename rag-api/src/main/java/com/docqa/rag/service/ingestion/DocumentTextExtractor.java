package com.docqa.rag.service.ingestion;

public interface DocumentTextExtractor {

    /**
     * Turns uploaded bytes into the text that chunk offsets refer to.
     *
     * @throws IngestionFailedException when the bytes are not readable text
     */
    String extract(String documentId, byte[] content);
}
