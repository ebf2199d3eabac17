package com.docqa.rag.service.ingestion;

import com.docqa.rag.service.RagException;
import org.springframework.http.HttpStatus;

public class IngestionFailedException extends RagException {

    public IngestionFailedException(HttpStatus status, String message) {
        super(status, message);
    }

    public IngestionFailedException(HttpStatus status, String message, Throwable cause) {
        super(status, message, cause);
    }

    @Override
    public String errorCode() {
        return "INGESTION_FAILED";
    }
}
