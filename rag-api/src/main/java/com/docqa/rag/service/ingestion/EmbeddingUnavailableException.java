package com.docqa.rag.service.ingestion;

import com.docqa.rag.service.RagException;
import org.springframework.http.HttpStatus;

public class EmbeddingUnavailableException extends RagException {

    public EmbeddingUnavailableException(String message) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message, cause);
    }

    @Override
    public String errorCode() {
        return "EMBEDDING_UNAVAILABLE";
    }
}
