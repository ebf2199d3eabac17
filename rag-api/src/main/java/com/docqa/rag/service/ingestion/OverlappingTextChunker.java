package com.docqa.rag.service.ingestion;

import com.docqa.rag.config.RagProperties;
import com.docqa.rag.model.Chunk;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class OverlappingTextChunker implements TextChunker {

    private static final String[] SEPARATORS = {"\n\n", "\n", " "};

    private final int chunkSize;
    private final int overlap;

    @Autowired
    public OverlappingTextChunker(RagProperties properties) {
        this(properties.getChunking().getTargetSize(), properties.getChunking().getOverlap());
    }

    public OverlappingTextChunker(int chunkSize, int overlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive");
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException("Overlap must be in [0, chunk size)");
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    @Override
    public List<Chunk> chunk(String documentId, String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<Chunk> chunks = new ArrayList<>();
        int length = text.length();
        int start = 0;
        int sequence = 0;
        while (start < length) {
            int end = Math.min(length, start + chunkSize);
            if (end < length) {
                end = breakPoint(text, start, end);
            }
            chunks.add(new Chunk(Chunk.idFor(documentId, sequence), documentId, sequence, text.substring(start, end), start, end));
            if (end == length) {
                break;
            }
            start = Math.max(end - overlap, start + 1);
            sequence++;
        }
        return List.copyOf(chunks);
    }

    /**
     * Latest separator boundary inside the window, falling back to a hard cut. The boundary never
     * lands before the window midpoint, and always past the overlap so the next window moves forward.
     */
    private int breakPoint(String text, int start, int hardEnd) {
        int earliest = start + Math.max(chunkSize / 2, overlap + 1);
        for (String separator : SEPARATORS) {
            int index = text.lastIndexOf(separator, hardEnd - separator.length());
            if (index >= start) {
                int candidate = index + separator.length();
                if (candidate >= earliest && candidate <= hardEnd) {
                    return candidate;
                }
            }
        }
        return hardEnd;
    }
}
