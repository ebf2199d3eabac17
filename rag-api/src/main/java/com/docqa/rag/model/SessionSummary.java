package com.docqa.rag.model;

public record SessionSummary(ChatSession session, int turnCount) {
}
