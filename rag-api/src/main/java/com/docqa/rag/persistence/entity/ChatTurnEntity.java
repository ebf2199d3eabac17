package com.docqa.rag.persistence.entity;

import com.docqa.rag.model.Turn;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "chat_turns",
        uniqueConstraints = @UniqueConstraint(name = "uk_chat_turns_session_sequence",
                columnNames = {"session_id", "sequence_index"}))
public class ChatTurnEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, length = 64)
    private String sessionId;

    @Column(name = "sequence_index", nullable = false)
    private int sequenceIndex;

    @Column(name = "question", columnDefinition = "text", nullable = false)
    private String question;

    @Column(name = "answer", columnDefinition = "text")
    private String answer;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private Turn.Status status;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "chat_turn_citations", joinColumns = @JoinColumn(name = "turn_id"))
    @OrderColumn(name = "citation_order")
    @Column(name = "chunk_id", nullable = false)
    private List<String> citations = new ArrayList<>();

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    protected ChatTurnEntity() {
    }

    public ChatTurnEntity(String sessionId,
                          int sequenceIndex,
                          String question,
                          String answer,
                          List<String> citations,
                          Turn.Status status,
                          OffsetDateTime createdAt) {
        this.sessionId = sessionId;
        this.sequenceIndex = sequenceIndex;
        this.question = question;
        this.answer = answer;
        this.citations = new ArrayList<>(citations);
        this.status = status;
        this.createdAt = createdAt;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }

    public Turn toTurn() {
        return new Turn(sessionId, sequenceIndex, question, answer, citations, status, createdAt);
    }

    public Long getId() {
        return id;
    }

    public String getSessionId() {
        return sessionId;
    }

    public int getSequenceIndex() {
        return sequenceIndex;
    }

    public String getQuestion() {
        return question;
    }

    public String getAnswer() {
        return answer;
    }

    public Turn.Status getStatus() {
        return status;
    }

    public List<String> getCitations() {
        return citations;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
