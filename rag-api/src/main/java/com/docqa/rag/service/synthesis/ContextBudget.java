package com.docqa.rag.service.synthesis;

import com.docqa.rag.model.RetrievedChunk;

import java.util.ArrayList;
import java.util.List;

/**
 * Fits ranked chunks into a character budget. A chunk that does not fit whole is cut down to the
 * remaining budget if at least {@code minPassageChars} remain, otherwise selection stops.
 */
public class ContextBudget {

    private final int maxChars;
    private final int minPassageChars;

    public ContextBudget(int maxChars, int minPassageChars) {
        this.maxChars = maxChars;
        this.minPassageChars = minPassageChars;
    }

    public BudgetedContext enforce(List<RetrievedChunk> ranked) {
        if (ranked == null || ranked.isEmpty()) {
            return new BudgetedContext(List.of(), false);
        }
        int budget = maxChars;
        List<ContextPassage> passages = new ArrayList<>();
        boolean truncated = false;
        for (RetrievedChunk hit : ranked) {
            String text = hit.chunk().text() == null ? "" : hit.chunk().text().strip();
            if (text.isEmpty()) {
                continue;
            }
            if (text.length() <= budget) {
                passages.add(new ContextPassage(passages.size() + 1, hit, text, false));
                budget -= text.length();
                continue;
            }
            truncated = true;
            if (budget >= minPassageChars) {
                passages.add(new ContextPassage(passages.size() + 1, hit, text.substring(0, budget), true));
            }
            break;
        }
        return new BudgetedContext(List.copyOf(passages), truncated);
    }

    public record BudgetedContext(List<ContextPassage> passages, boolean truncated) {}
}
