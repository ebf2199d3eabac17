package com.docqa.rag.model;

import java.util.List;

/**
 * Result of asking a question. {@link Status#NO_DOCUMENT} is a valid empty state for a collection that
 * was never ingested: it carries no session and no turn.
 */
public record AskOutcome(Status status,
                         String collectionId,
                         ChatSession session,
                         Turn turn,
                         List<Citation> citations,
                         String language) {

    public enum Status {
        ANSWERED,
        NOT_FOUND,
        NO_DOCUMENT
    }

    public static AskOutcome noDocument(String collectionId, String language) {
        return new AskOutcome(Status.NO_DOCUMENT, collectionId, null, null, List.of(), language);
    }

    public static AskOutcome of(ChatSession session, Turn turn, List<Citation> citations, String language) {
        Status status = turn.status() == Turn.Status.ANSWERED ? Status.ANSWERED : Status.NOT_FOUND;
        return new AskOutcome(status, session.collectionId(), session, turn, List.copyOf(citations), language);
    }
}
