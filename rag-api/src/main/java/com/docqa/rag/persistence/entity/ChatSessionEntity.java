package com.docqa.rag.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;

@Entity
@Table(name = "chat_sessions", indexes = @Index(name = "idx_chat_sessions_user", columnList = "user_id, created_at"))
public class ChatSessionEntity {

    @Id
    @Column(name = "session_id", nullable = false, updatable = false, length = 64)
    private String sessionId;

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Column(name = "collection_id", nullable = false, length = 128)
    private String collectionId;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    protected ChatSessionEntity() {
    }

    public ChatSessionEntity(String sessionId, String userId, String collectionId, OffsetDateTime createdAt) {
        this.sessionId = sessionId;
        this.userId = userId;
        this.collectionId = collectionId;
        this.createdAt = createdAt;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getUserId() {
        return userId;
    }

    public String getCollectionId() {
        return collectionId;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
