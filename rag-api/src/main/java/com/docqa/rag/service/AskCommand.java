package com.docqa.rag.service;

/**
 * @param sessionId existing session to continue, a new session is started when absent
 * @param language  answer language, detected from the question when absent
 */
public record AskCommand(String collectionId, String sessionId, String userId, String question, String language) {
}
