package com.docqa.rag.service.session;

import com.docqa.rag.service.RagException;
import org.springframework.http.HttpStatus;

public class SessionNotFoundException extends RagException {

    public SessionNotFoundException(String sessionId) {
        super(HttpStatus.NOT_FOUND, "Chat session " + sessionId + " does not exist");
    }

    @Override
    public String errorCode() {
        return "SESSION_NOT_FOUND";
    }
}
