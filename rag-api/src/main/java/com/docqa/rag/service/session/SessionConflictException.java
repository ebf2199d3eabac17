package com.docqa.rag.service.session;

import com.docqa.rag.service.RagException;
import org.springframework.http.HttpStatus;

public class SessionConflictException extends RagException {

    public SessionConflictException(String message) {
        super(HttpStatus.CONFLICT, message);
    }

    public SessionConflictException(String message, Throwable cause) {
        super(HttpStatus.CONFLICT, message, cause);
    }

    @Override
    public String errorCode() {
        return "SESSION_CONFLICT";
    }
}
