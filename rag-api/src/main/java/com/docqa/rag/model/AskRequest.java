package com.docqa.rag.model;

import jakarta.validation.constraints.NotBlank;

/**
 * {@code userId} may be omitted when the bearer token identifies the user.
 */
public record AskRequest(
        String sessionId,
        String userId,
        @NotBlank String question,
        String language
) {
}
