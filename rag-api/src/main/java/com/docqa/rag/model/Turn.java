package com.docqa.rag.model;

import java.time.OffsetDateTime;
import java.util.List;

public record Turn(String sessionId,
                   int sequenceIndex,
                   String question,
                   String answer,
                   List<String> citations,
                   Status status,
                   OffsetDateTime timestamp) {

    public enum Status {
        ANSWERED,
        NOT_FOUND
    }

    public Turn {
        citations = citations == null ? List.of() : List.copyOf(citations);
    }
}
