package com.docqa.rag.service.synthesis;

import com.docqa.rag.service.RagException;
import org.springframework.http.HttpStatus;

public class GenerationUnavailableException extends RagException {

    private final boolean retryable;

    public GenerationUnavailableException(String message, boolean retryable) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message);
        this.retryable = retryable;
    }

    public GenerationUnavailableException(String message, boolean retryable, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message, cause);
        this.retryable = retryable;
    }

    /**
     * False for refusals such as content filtering, which repeat identically on retry.
     */
    public boolean retryable() {
        return retryable;
    }

    @Override
    public String errorCode() {
        return "GENERATION_UNAVAILABLE";
    }
}
