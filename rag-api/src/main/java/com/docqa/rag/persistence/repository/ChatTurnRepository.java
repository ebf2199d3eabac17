package com.docqa.rag.persistence.repository;

import com.docqa.rag.persistence.entity.ChatTurnEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ChatTurnRepository extends JpaRepository<ChatTurnEntity, Long> {

    @Query("select coalesce(max(t.sequenceIndex), -1) from ChatTurnEntity t where t.sessionId = :sessionId")
    int findMaxSequence(@Param("sessionId") String sessionId);

    List<ChatTurnEntity> findBySessionIdOrderBySequenceIndexAsc(String sessionId);

    long countBySessionId(String sessionId);

    long deleteBySessionId(String sessionId);
}
