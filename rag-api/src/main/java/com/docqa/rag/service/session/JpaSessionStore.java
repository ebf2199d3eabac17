package com.docqa.rag.service.session;

import com.docqa.rag.config.KeyedLocks;
import com.docqa.rag.config.RagProperties;
import com.docqa.rag.model.ChatSession;
import com.docqa.rag.model.Turn;
import com.docqa.rag.persistence.entity.ChatSessionEntity;
import com.docqa.rag.persistence.entity.ChatTurnEntity;
import com.docqa.rag.persistence.repository.ChatSessionRepository;
import com.docqa.rag.persistence.repository.ChatTurnRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Appends are serialized per session inside the instance; across instances the unique
 * (session_id, sequence_index) constraint rejects a duplicate index and the append is retried.
 */
@Service
@Profile("!inmemory")
public class JpaSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(JpaSessionStore.class);

    private final ChatSessionRepository sessionRepository;
    private final ChatTurnRepository turnRepository;
    private final TransactionTemplate transactionTemplate;
    private final int appendRetries;
    private final KeyedLocks<String> sessionLocks = new KeyedLocks<>();

    public JpaSessionStore(ChatSessionRepository sessionRepository,
                           ChatTurnRepository turnRepository,
                           PlatformTransactionManager transactionManager,
                           RagProperties properties) {
        this.sessionRepository = sessionRepository;
        this.turnRepository = turnRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.appendRetries = properties.getSessions().getAppendRetries();
    }

    @Override
    public ChatSession openSession(String sessionId, String userId, String collectionId) {
        try {
            return transactionTemplate.execute(status -> sessionRepository.findById(sessionId)
                    .map(existing -> requireOwner(existing, userId, collectionId))
                    .orElseGet(() -> toSession(sessionRepository.saveAndFlush(
                            new ChatSessionEntity(sessionId, userId, collectionId, OffsetDateTime.now())))));
        } catch (DataIntegrityViolationException e) {
            log.debug("Session {} was created concurrently, re-reading", sessionId);
            ChatSessionEntity existing = sessionRepository.findById(sessionId)
                    .orElseThrow(() -> new SessionConflictException("Failed to create session " + sessionId, e));
            return requireOwner(existing, userId, collectionId);
        }
    }

    @Override
    public Optional<ChatSession> findSession(String sessionId) {
        return sessionRepository.findById(sessionId).map(JpaSessionStore::toSession);
    }

    @Override
    public Turn appendTurn(String sessionId, String question, String answer, List<String> citations, Turn.Status status) {
        try (KeyedLocks.Held ignored = sessionLocks.acquire(sessionId)) {
            DataIntegrityViolationException last = null;
            for (int attempt = 1; attempt <= appendRetries; attempt++) {
                try {
                    return transactionTemplate.execute(tx -> {
                        if (!sessionRepository.existsById(sessionId)) {
                            throw new SessionNotFoundException(sessionId);
                        }
                        int sequence = turnRepository.findMaxSequence(sessionId) + 1;
                        ChatTurnEntity saved = turnRepository.saveAndFlush(new ChatTurnEntity(
                                sessionId, sequence, question, answer, citations, status, OffsetDateTime.now()));
                        return saved.toTurn();
                    });
                } catch (DataIntegrityViolationException e) {
                    last = e;
                    log.warn("Sequence collision appending to session {} (attempt {}/{})", sessionId, attempt, appendRetries);
                }
            }
            throw new SessionConflictException("Could not append to session " + sessionId + " after "
                    + appendRetries + " attempts", last);
        }
    }

    @Override
    public List<Turn> listTurns(String sessionId) {
        return turnRepository.findBySessionIdOrderBySequenceIndexAsc(sessionId).stream()
                .map(ChatTurnEntity::toTurn)
                .toList();
    }

    @Override
    public List<ChatSession> listSessions(String userId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return sessionRepository.findByUserIdOrderByCreatedAtDesc(userId, PageRequest.of(0, limit)).stream()
                .map(JpaSessionStore::toSession)
                .toList();
    }

    @Override
    public int countTurns(String sessionId) {
        return (int) turnRepository.countBySessionId(sessionId);
    }

    @Override
    public boolean deleteSession(String sessionId) {
        try (KeyedLocks.Held ignored = sessionLocks.acquire(sessionId)) {
            Boolean deleted = transactionTemplate.execute(tx -> {
                if (!sessionRepository.existsById(sessionId)) {
                    return false;
                }
                long turns = turnRepository.deleteBySessionId(sessionId);
                sessionRepository.deleteById(sessionId);
                log.info("Deleted session {} with {} turns", sessionId, turns);
                return true;
            });
            return Boolean.TRUE.equals(deleted);
        }
    }

    int lockCount() {
        return sessionLocks.size();
    }

    private static ChatSession requireOwner(ChatSessionEntity entity, String userId, String collectionId) {
        if (!entity.getUserId().equals(userId) || !entity.getCollectionId().equals(collectionId)) {
            throw new SessionConflictException("Session " + entity.getSessionId()
                    + " belongs to another user or collection");
        }
        return toSession(entity);
    }

    private static ChatSession toSession(ChatSessionEntity entity) {
        return new ChatSession(entity.getSessionId(), entity.getUserId(), entity.getCollectionId(), entity.getCreatedAt());
    }
}
