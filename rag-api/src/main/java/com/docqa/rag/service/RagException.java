package com.docqa.rag.service;

import org.springframework.http.HttpStatus;

/**
 * Base type for failures surfaced to callers of the engine. Each failure carries the HTTP status the
 * web layer answers with and a stable error code.
 */
public abstract class RagException extends RuntimeException {

    private final HttpStatus status;

    protected RagException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    protected RagException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }

    public abstract String errorCode();
}
