package com.docqa.rag.service.synthesis;

import com.docqa.rag.model.Citation;
import com.docqa.rag.model.Turn;

import java.util.List;

public record SynthesizedAnswer(Turn.Status status, String text, List<Citation> citations, String language) {

    public SynthesizedAnswer {
        citations = citations == null ? List.of() : List.copyOf(citations);
    }

    public static SynthesizedAnswer notFound(String text, String language) {
        return new SynthesizedAnswer(Turn.Status.NOT_FOUND, text, List.of(), language);
    }

    public boolean answered() {
        return status == Turn.Status.ANSWERED;
    }
}
