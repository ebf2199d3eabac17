package com.docqa.rag.service;

import com.docqa.rag.model.AskOutcome;
import com.docqa.rag.model.DocumentSummary;
import com.docqa.rag.model.IngestResult;
import com.docqa.rag.model.SessionSummary;
import com.docqa.rag.model.Turn;

import java.util.List;

public interface RagOrchestrator {

    /**
     * Chunks, embeds and indexes a document, replacing any earlier version of it in the collection.
     *
     * @throws com.docqa.rag.service.ingestion.IngestionFailedException when the collection could not be
     *                                                                  updated; it keeps its last version
     */
    IngestResult ingest(IngestCommand command);

    AskOutcome ask(AskCommand command);

    List<SessionSummary> listSessions(String userId);

    List<SessionSummary> listSessions(String userId, int limit);

    List<Turn> listTurns(String sessionId);

    boolean deleteSession(String sessionId);

    /**
     * Deletes the collection snapshot and its document records. Chat sessions are kept as history.
     */
    boolean deleteCollection(String collectionId);

    List<DocumentSummary> listDocuments(String userId);
}
