package com.docqa.rag.model;

public record IngestResult(String collectionId,
                           String documentId,
                           int chunks,
                           long version,
                           boolean deduplicated) {
}
