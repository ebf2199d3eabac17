package com.docqa.rag.persistence.repository;

import com.docqa.rag.persistence.entity.DocumentRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

public interface DocumentRecordRepository extends JpaRepository<DocumentRecordEntity, Long> {

    Optional<DocumentRecordEntity> findByCollectionIdAndDocumentId(String collectionId, String documentId);

    List<DocumentRecordEntity> findByUserIdOrderByIngestedAtDesc(String userId);

    List<DocumentRecordEntity> findByCollectionId(String collectionId);

    @Transactional
    long deleteByCollectionId(String collectionId);
}
