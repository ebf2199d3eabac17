package com.docqa.rag.service.session;

import com.docqa.rag.model.ChatSession;
import com.docqa.rag.model.Turn;

import java.util.List;
import java.util.Optional;

/**
 * Append-only question/answer history per chat session.
 */
public interface SessionStore {

    /**
     * Returns the session, creating it on first use.
     *
     * @throws SessionConflictException when the id already belongs to another user or collection
     */
    ChatSession openSession(String sessionId, String userId, String collectionId);

    Optional<ChatSession> findSession(String sessionId);

    /**
     * Appends a turn with the next sequence index of the session.
     *
     * @throws SessionNotFoundException when the session does not exist
     */
    Turn appendTurn(String sessionId, String question, String answer, List<String> citations, Turn.Status status);

    List<Turn> listTurns(String sessionId);

    /**
     * Sessions of the user, newest first.
     */
    List<ChatSession> listSessions(String userId, int limit);

    int countTurns(String sessionId);

    /**
     * Removes the session and all of its turns.
     *
     * @return whether the session existed
     */
    boolean deleteSession(String sessionId);
}
