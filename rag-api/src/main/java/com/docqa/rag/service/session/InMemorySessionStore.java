package com.docqa.rag.service.session;

import com.docqa.rag.model.ChatSession;
import com.docqa.rag.model.Turn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
@Profile("inmemory")
public class InMemorySessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

    private final Map<String, SessionLog> sessions = new ConcurrentHashMap<>();

    @Override
    public ChatSession openSession(String sessionId, String userId, String collectionId) {
        SessionLog sessionLog = sessions.computeIfAbsent(sessionId,
                id -> new SessionLog(new ChatSession(id, userId, collectionId, OffsetDateTime.now())));
        ChatSession session = sessionLog.session;
        if (!session.userId().equals(userId) || !session.collectionId().equals(collectionId)) {
            throw new SessionConflictException("Session " + sessionId + " belongs to another user or collection");
        }
        return session;
    }

    @Override
    public Optional<ChatSession> findSession(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId)).map(sessionLog -> sessionLog.session);
    }

    @Override
    public Turn appendTurn(String sessionId, String question, String answer, List<String> citations, Turn.Status status) {
        SessionLog sessionLog = sessions.get(sessionId);
        if (sessionLog == null) {
            throw new SessionNotFoundException(sessionId);
        }
        synchronized (sessionLog) {
            if (sessions.get(sessionId) != sessionLog) {
                throw new SessionNotFoundException(sessionId);
            }
            Turn turn = new Turn(sessionId, sessionLog.turns.size(), question, answer, citations, status, OffsetDateTime.now());
            sessionLog.turns.add(turn);
            log.debug("Appended turn {} to session {}", turn.sequenceIndex(), sessionId);
            return turn;
        }
    }

    @Override
    public List<Turn> listTurns(String sessionId) {
        SessionLog sessionLog = sessions.get(sessionId);
        if (sessionLog == null) {
            return List.of();
        }
        synchronized (sessionLog) {
            return List.copyOf(sessionLog.turns);
        }
    }

    @Override
    public List<ChatSession> listSessions(String userId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return sessions.values().stream()
                .map(sessionLog -> sessionLog.session)
                .filter(session -> session.userId().equals(userId))
                .sorted(Comparator.comparing(ChatSession::createdAt).reversed()
                        .thenComparing(ChatSession::sessionId))
                .limit(limit)
                .toList();
    }

    @Override
    public int countTurns(String sessionId) {
        return listTurns(sessionId).size();
    }

    @Override
    public boolean deleteSession(String sessionId) {
        SessionLog removed = sessions.remove(sessionId);
        if (removed == null) {
            return false;
        }
        synchronized (removed) {
            removed.turns.clear();
        }
        return true;
    }

    private static final class SessionLog {

        private final ChatSession session;
        private final List<Turn> turns = new ArrayList<>();

        private SessionLog(ChatSession session) {
            this.session = session;
        }
    }
}
