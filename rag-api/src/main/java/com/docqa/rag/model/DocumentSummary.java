package com.docqa.rag.model;

import java.time.OffsetDateTime;

public record DocumentSummary(String documentId,
                              String collectionId,
                              long sizeBytes,
                              int chunks,
                              long collectionVersion,
                              OffsetDateTime ingestedAt) {
}
