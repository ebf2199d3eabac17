package com.docqa.rag.service.synthesis;

import com.docqa.rag.model.RetrievedChunk;

import java.util.List;

public interface AnswerSynthesizer {

    SynthesizedAnswer synthesize(String question, List<RetrievedChunk> hits, String language);
}
