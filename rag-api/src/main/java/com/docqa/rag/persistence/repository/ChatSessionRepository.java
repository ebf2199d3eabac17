package com.docqa.rag.persistence.repository;

import com.docqa.rag.persistence.entity.ChatSessionEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ChatSessionRepository extends JpaRepository<ChatSessionEntity, String> {

    List<ChatSessionEntity> findByUserIdOrderByCreatedAtDesc(String userId, Pageable pageable);
}
