package com.docqa.rag.service.synthesis;

import com.docqa.rag.model.Chunk;
import com.docqa.rag.model.Citation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves passage markers in an answer to citations. Only passages that were in the prompt can be
 * cited, so every citation points at a chunk of the queried collection.
 */
public class CitationExtractor {

    private static final Pattern MARKER_GROUP = Pattern.compile("\\[\\s*(S\\d+(?:\\s*[,;]\\s*S\\d+)*)\\s*]");
    private static final Pattern MARKER = Pattern.compile("S(\\d+)");
    private static final int SNIPPET_LENGTH = 220;

    private final int maxCitations;

    public CitationExtractor(int maxCitations) {
        this.maxCitations = Math.max(1, maxCitations);
    }

    /**
     * @param usedPassages passage numbers reported by the generation service; take precedence over
     *                     markers when not empty
     */
    public List<Citation> extract(String answer, List<ContextPassage> passages, List<Integer> usedPassages) {
        if (passages == null || passages.isEmpty()) {
            return List.of();
        }
        Set<Integer> numbers = new LinkedHashSet<>();
        if (usedPassages != null && !usedPassages.isEmpty()) {
            numbers.addAll(usedPassages);
        } else {
            numbers.addAll(markers(answer));
        }
        List<Citation> citations = new ArrayList<>();
        for (Integer number : numbers) {
            if (number == null || number < 1 || number > passages.size()) {
                continue;
            }
            citations.add(toCitation(passages.get(number - 1)));
            if (citations.size() == maxCitations) {
                break;
            }
        }
        if (citations.isEmpty()) {
            citations.add(toCitation(passages.get(0)));
        }
        return List.copyOf(citations);
    }

    static List<Integer> markers(String answer) {
        if (answer == null || answer.isBlank()) {
            return List.of();
        }
        List<Integer> numbers = new ArrayList<>();
        Matcher group = MARKER_GROUP.matcher(answer);
        while (group.find()) {
            Matcher marker = MARKER.matcher(group.group(1));
            while (marker.find()) {
                numbers.add(Integer.parseInt(marker.group(1)));
            }
        }
        return numbers;
    }

    private Citation toCitation(ContextPassage passage) {
        Chunk chunk = passage.hit().chunk();
        return new Citation(chunk.chunkId(), chunk.documentId(), chunk.sequenceIndex(),
                chunk.charStart(), chunk.charEnd(), createSnippet(chunk.text()));
    }

    private String createSnippet(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.replaceAll("\\s+", " ").trim();
        if (trimmed.length() <= SNIPPET_LENGTH) {
            return trimmed;
        }
        return trimmed.substring(0, SNIPPET_LENGTH - 3) + "...";
    }
}
