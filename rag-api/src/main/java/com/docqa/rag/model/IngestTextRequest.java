package com.docqa.rag.model;

import jakarta.validation.constraints.NotBlank;

public record IngestTextRequest(
        @NotBlank String documentId,
        String collectionId,
        String userId,
        @NotBlank String text
) {
}
