package com.docqa.rag.service.synthesis.openai;

public class OpenAiChatException extends RuntimeException {

    public OpenAiChatException(String message, Throwable cause) {
        super(message, cause);
    }
}
