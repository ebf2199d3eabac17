package com.docqa.rag.model;

import java.time.OffsetDateTime;

public record ChatSession(String sessionId,
                          String userId,
                          String collectionId,
                          OffsetDateTime createdAt) {
}
