package com.docqa.rag.service;

import com.docqa.rag.config.RagProperties;
import com.docqa.rag.model.AskOutcome;
import com.docqa.rag.model.ChatSession;
import com.docqa.rag.model.Chunk;
import com.docqa.rag.model.Citation;
import com.docqa.rag.model.DocumentSummary;
import com.docqa.rag.model.IngestResult;
import com.docqa.rag.model.SessionSummary;
import com.docqa.rag.model.Turn;
import com.docqa.rag.persistence.entity.DocumentRecordEntity;
import com.docqa.rag.persistence.repository.DocumentRecordRepository;
import com.docqa.rag.service.index.VectorIndex;
import com.docqa.rag.service.ingestion.DocumentTextExtractor;
import com.docqa.rag.service.ingestion.EmbeddingUnavailableException;
import com.docqa.rag.service.ingestion.EmbeddingsClient;
import com.docqa.rag.service.ingestion.IngestionFailedException;
import com.docqa.rag.service.ingestion.TextChunker;
import com.docqa.rag.service.retrieval.RetrievalResult;
import com.docqa.rag.service.retrieval.Retriever;
import com.docqa.rag.service.session.SessionNotFoundException;
import com.docqa.rag.service.session.SessionStore;
import com.docqa.rag.service.sync.CollectionCache;
import com.docqa.rag.service.sync.IndexSyncManager;
import com.docqa.rag.service.sync.LoadedCollection;
import com.docqa.rag.service.sync.StaleVersionException;
import com.docqa.rag.service.synthesis.AnswerSynthesizer;
import com.docqa.rag.service.synthesis.LanguageHintResolver;
import com.docqa.rag.service.synthesis.SynthesizedAnswer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.security.MessageDigest;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

@Service
public class DefaultRagOrchestrator implements RagOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DefaultRagOrchestrator.class);

    // Ids end up in blob keys, so no path separators and no "..".
    private static final Pattern IDENTIFIER = Pattern.compile("^(?!.*\\.\\.)[A-Za-z0-9._-]{1,128}$");

    private final DocumentTextExtractor textExtractor;
    private final TextChunker textChunker;
    private final EmbeddingsClient embeddingsClient;
    private final CollectionCache collectionCache;
    private final IndexSyncManager syncManager;
    private final Retriever retriever;
    private final AnswerSynthesizer answerSynthesizer;
    private final LanguageHintResolver languageResolver;
    private final SessionStore sessionStore;
    private final DocumentRecordRepository documentRepository;
    private final MeterRegistry meterRegistry;
    private final long maxDocumentBytes;
    private final int maxConflictRetries;
    private final int sessionListLimit;

    private final Counter ingestAccepted;
    private final Counter ingestDeduplicated;
    private final Counter ingestFailed;
    private final Timer ingestTimer;
    private final Counter askAnswered;
    private final Counter askNotFound;
    private final Counter askNoDocument;
    private final Counter askFailed;
    private final Timer askTimer;
    private final Counter syncConflicts;

    public DefaultRagOrchestrator(DocumentTextExtractor textExtractor,
                                  TextChunker textChunker,
                                  EmbeddingsClient embeddingsClient,
                                  CollectionCache collectionCache,
                                  IndexSyncManager syncManager,
                                  Retriever retriever,
                                  AnswerSynthesizer answerSynthesizer,
                                  LanguageHintResolver languageResolver,
                                  SessionStore sessionStore,
                                  DocumentRecordRepository documentRepository,
                                  MeterRegistry meterRegistry,
                                  RagProperties properties) {
        this.textExtractor = textExtractor;
        this.textChunker = textChunker;
        this.embeddingsClient = embeddingsClient;
        this.collectionCache = collectionCache;
        this.syncManager = syncManager;
        this.retriever = retriever;
        this.answerSynthesizer = answerSynthesizer;
        this.languageResolver = languageResolver;
        this.sessionStore = sessionStore;
        this.documentRepository = documentRepository;
        this.meterRegistry = meterRegistry;
        this.maxDocumentBytes = properties.getIngest().getMaxDocumentBytes();
        this.maxConflictRetries = properties.getSync().getMaxConflictRetries();
        this.sessionListLimit = properties.getSessions().getListLimit();
        this.ingestAccepted = meterRegistry.counter("rag.ingest.events", "outcome", "accepted");
        this.ingestDeduplicated = meterRegistry.counter("rag.ingest.events", "outcome", "deduplicated");
        this.ingestFailed = meterRegistry.counter("rag.ingest.events", "outcome", "failed");
        this.ingestTimer = meterRegistry.timer("rag.ingest.duration");
        this.askAnswered = meterRegistry.counter("rag.ask.events", "outcome", "answered");
        this.askNotFound = meterRegistry.counter("rag.ask.events", "outcome", "not_found");
        this.askNoDocument = meterRegistry.counter("rag.ask.events", "outcome", "no_document");
        this.askFailed = meterRegistry.counter("rag.ask.events", "outcome", "failed");
        this.askTimer = meterRegistry.timer("rag.ask.duration");
        this.syncConflicts = meterRegistry.counter("rag.sync.conflicts");
    }

    @Override
    public IngestResult ingest(IngestCommand command) {
        validate(command);
        String documentId = command.documentId();
        String collectionId = command.collectionId() == null || command.collectionId().isBlank()
                ? documentId
                : command.collectionId();
        requireIdentifier("collectionId", collectionId);

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            String text = textExtractor.extract(documentId, command.bytes());
            if (text.isBlank()) {
                throw new IngestionFailedException(HttpStatus.UNPROCESSABLE_ENTITY,
                        "No text was extracted from document " + documentId);
            }
            String hash = sha256(command.bytes());

            Optional<IngestResult> unchanged = findUnchanged(collectionId, documentId, hash);
            if (unchanged.isPresent()) {
                ingestDeduplicated.increment();
                log.info("Skipped re-embedding of document {} in collection {} due to matching content hash",
                        documentId, collectionId);
                return unchanged.get();
            }

            List<Chunk> chunks = textChunker.chunk(documentId, text);
            if (chunks.isEmpty()) {
                throw new IngestionFailedException(HttpStatus.UNPROCESSABLE_ENTITY,
                        "No content chunks were produced for document " + documentId);
            }
            EmbeddingsClient.EmbeddingBatch embeddings = embed(chunks.stream().map(Chunk::text).toList());
            if (embeddings.size() != chunks.size()) {
                throw new IngestionFailedException(HttpStatus.BAD_GATEWAY, "Embeddings response size did not match chunks");
            }

            IngestResult result = collectionCache.withWriteLock(collectionId,
                    () -> applyWithConflictRetries(collectionId, documentId, chunks, embeddings));
            saveRecord(collectionId, documentId, command.userId(), hash, command.bytes().length, result);
            ingestAccepted.increment();
            log.info("Ingested document {} into collection {} with {} chunks (version {})",
                    documentId, collectionId, result.chunks(), result.version());
            return result;
        } catch (IngestionFailedException ex) {
            ingestFailed.increment();
            throw ex;
        } catch (RagException ex) {
            ingestFailed.increment();
            throw new IngestionFailedException(HttpStatus.BAD_GATEWAY,
                    "Failed to ingest document " + documentId + ": " + ex.getMessage(), ex);
        } finally {
            sample.stop(ingestTimer);
        }
    }

    private IngestResult applyWithConflictRetries(String collectionId,
                                                  String documentId,
                                                  List<Chunk> chunks,
                                                  EmbeddingsClient.EmbeddingBatch embeddings) {
        StaleVersionException lastConflict = null;
        for (int attempt = 1; attempt <= maxConflictRetries; attempt++) {
            LoadedCollection base = attempt == 1
                    ? collectionCache.get(collectionId)
                    : collectionCache.reload(collectionId);
            VectorIndex next = prepareIndex(collectionId, documentId, base.index(), embeddings);
            next.removeDocument(documentId);
            for (int i = 0; i < chunks.size(); i++) {
                next.add(chunks.get(i), embeddings.vectors().get(i), embeddings.model());
            }
            long version = base.version() + 1;
            try {
                long generation = syncManager.persist(collectionId, next, version);
                collectionCache.publish(collectionId, next, version, generation);
                return new IngestResult(collectionId, documentId, chunks.size(), version, false);
            } catch (StaleVersionException ex) {
                syncConflicts.increment();
                lastConflict = ex;
                log.warn("Version conflict on collection {} (attempt {}/{}): {}",
                        collectionId, attempt, maxConflictRetries, ex.getMessage());
            }
        }
        throw new IngestionFailedException(HttpStatus.CONFLICT, "Collection " + collectionId
                + " kept changing concurrently, gave up after " + maxConflictRetries + " attempts", lastConflict);
    }

    /**
     * Copy of the current index ready to receive the new chunks. When the embedding model changed, the
     * other documents are re-embedded so the collection never mixes models.
     */
    private VectorIndex prepareIndex(String collectionId,
                                     String documentId,
                                     VectorIndex current,
                                     EmbeddingsClient.EmbeddingBatch embeddings) {
        boolean sameModel = current.isEmpty()
                || (Objects.equals(current.modelVersion(), embeddings.model())
                && current.dimension() == embeddings.dimensions());
        if (sameModel) {
            return current.copy();
        }
        List<Chunk> others = current.entries().stream()
                .map(VectorIndex.IndexedChunk::chunk)
                .filter(chunk -> !chunk.documentId().equals(documentId))
                .toList();
        log.info("Collection {} switches embedding model from {} to {}, re-embedding {} chunks",
                collectionId, current.modelVersion(), embeddings.model(), others.size());
        VectorIndex rebuilt = new VectorIndex(embeddings.model(), embeddings.dimensions());
        if (others.isEmpty()) {
            return rebuilt;
        }
        EmbeddingsClient.EmbeddingBatch reembedded = embed(others.stream().map(Chunk::text).toList());
        if (!Objects.equals(reembedded.model(), embeddings.model()) || reembedded.size() != others.size()) {
            throw new IngestionFailedException(HttpStatus.BAD_GATEWAY,
                    "Embedding model changed again while re-embedding collection " + collectionId);
        }
        for (int i = 0; i < others.size(); i++) {
            rebuilt.add(others.get(i), reembedded.vectors().get(i), reembedded.model());
        }
        return rebuilt;
    }

    private Optional<IngestResult> findUnchanged(String collectionId, String documentId, String hash) {
        Optional<DocumentRecordEntity> record;
        try {
            record = documentRepository.findByCollectionIdAndDocumentId(collectionId, documentId);
        } catch (DataAccessException ex) {
            log.warn("Could not read the record of document {} in collection {}, ingesting without dedupe: {}",
                    documentId, collectionId, ex.getMessage());
            return Optional.empty();
        }
        if (record.isEmpty() || !hash.equals(record.get().getContentHash())) {
            return Optional.empty();
        }
        LoadedCollection collection = collectionCache.get(collectionId);
        int indexed = collection.index().chunksOf(documentId).size();
        if (indexed == 0 || indexed != record.get().getChunkCount()) {
            return Optional.empty();
        }
        return Optional.of(new IngestResult(collectionId, documentId, indexed, collection.version(), true));
    }

    private EmbeddingsClient.EmbeddingBatch embed(List<String> texts) {
        try {
            return embeddingsClient.embed(texts);
        } catch (EmbeddingUnavailableException ex) {
            throw new IngestionFailedException(HttpStatus.BAD_GATEWAY, "Embedding service unavailable, re-upload the document later", ex);
        }
    }

    /**
     * Bookkeeping for dedupe and document listings. The snapshot is already durable at this point, so a
     * failure is logged and the ingest still reports the persisted version.
     */
    private void saveRecord(String collectionId, String documentId, String userId, String hash, long size, IngestResult result) {
        try {
            writeRecord(collectionId, documentId, userId, hash, size, result);
        } catch (DataAccessException ex) {
            log.warn("Collection {} is at version {} but the record of document {} could not be saved: {}",
                    collectionId, result.version(), documentId, ex.getMessage());
        }
    }

    private void writeRecord(String collectionId, String documentId, String userId, String hash, long size, IngestResult result) {
        DocumentRecordEntity entity = documentRepository.findByCollectionIdAndDocumentId(collectionId, documentId)
                .orElseGet(DocumentRecordEntity::new);
        entity.setCollectionId(collectionId);
        entity.setDocumentId(documentId);
        if (userId != null && !userId.isBlank()) {
            entity.setUserId(userId);
        }
        entity.setContentHash(hash);
        entity.setSizeBytes(size);
        entity.setChunkCount(result.chunks());
        entity.setCollectionVersion(result.version());
        entity.setIngestedAt(OffsetDateTime.now());
        documentRepository.save(entity);
    }

    @Override
    public AskOutcome ask(AskCommand command) {
        if (command == null || command.question() == null || command.question().isBlank()) {
            throw new IllegalArgumentException("Question must not be empty");
        }
        requireIdentifier("collectionId", command.collectionId());
        if (command.userId() == null || command.userId().isBlank()) {
            throw new IllegalArgumentException("User ID is required");
        }
        String language = languageResolver.resolve(command.question(), command.language());

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            RetrievalResult retrieval = retriever.retrieve(command.collectionId(), command.question());
            if (retrieval.status() == RetrievalResult.Status.NO_DOCUMENT) {
                askNoDocument.increment();
                log.debug("Question on collection {} without any ingested document", command.collectionId());
                return AskOutcome.noDocument(command.collectionId(), language);
            }
            String sessionId = command.sessionId() == null || command.sessionId().isBlank()
                    ? UUID.randomUUID().toString()
                    : command.sessionId();
            SynthesizedAnswer answer = answerSynthesizer.synthesize(command.question(), retrieval.chunks(), language);
            ChatSession session = sessionStore.openSession(sessionId, command.userId(), command.collectionId());
            List<String> citationIds = answer.citations().stream().map(Citation::chunkId).toList();
            Turn turn = sessionStore.appendTurn(sessionId, command.question(), answer.text(), citationIds, answer.status());
            (answer.answered() ? askAnswered : askNotFound).increment();
            log.debug("Answered turn {} of session {} with status {} and {} citations",
                    turn.sequenceIndex(), sessionId, turn.status(), citationIds.size());
            return AskOutcome.of(session, turn, answer.citations(), language);
        } catch (RuntimeException ex) {
            askFailed.increment();
            throw ex;
        } finally {
            sample.stop(askTimer);
        }
    }

    @Override
    public List<SessionSummary> listSessions(String userId) {
        return listSessions(userId, sessionListLimit);
    }

    @Override
    public List<SessionSummary> listSessions(String userId, int limit) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID is required");
        }
        return sessionStore.listSessions(userId, limit).stream()
                .map(session -> new SessionSummary(session, sessionStore.countTurns(session.sessionId())))
                .toList();
    }

    @Override
    public List<Turn> listTurns(String sessionId) {
        if (sessionStore.findSession(sessionId).isEmpty()) {
            throw new SessionNotFoundException(sessionId);
        }
        return sessionStore.listTurns(sessionId);
    }

    @Override
    public boolean deleteSession(String sessionId) {
        return sessionStore.deleteSession(sessionId);
    }

    @Override
    public boolean deleteCollection(String collectionId) {
        requireIdentifier("collectionId", collectionId);
        return collectionCache.withWriteLock(collectionId, () -> {
            boolean snapshotDeleted = syncManager.delete(collectionId);
            collectionCache.evict(collectionId);
            long records = documentRepository.deleteByCollectionId(collectionId);
            log.info("Deleted collection {} (snapshot {}, {} document records)",
                    collectionId, snapshotDeleted ? "removed" : "absent", records);
            return snapshotDeleted || records > 0;
        });
    }

    @Override
    public List<DocumentSummary> listDocuments(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID is required");
        }
        return documentRepository.findByUserIdOrderByIngestedAtDesc(userId).stream()
                .map(entity -> new DocumentSummary(entity.getDocumentId(), entity.getCollectionId(),
                        entity.getSizeBytes(), entity.getChunkCount(), entity.getCollectionVersion(),
                        entity.getIngestedAt()))
                .toList();
    }

    private void validate(IngestCommand command) {
        if (command == null || command.bytes() == null || command.bytes().length == 0) {
            throw new IngestionFailedException(HttpStatus.BAD_REQUEST, "Uploaded document is empty");
        }
        if (command.documentId() == null || !IDENTIFIER.matcher(command.documentId()).matches()) {
            throw new IngestionFailedException(HttpStatus.BAD_REQUEST,
                    "Document ID must be 1-128 letters, digits, '.', '_' or '-'");
        }
        if (command.bytes().length > maxDocumentBytes) {
            throw new IngestionFailedException(HttpStatus.PAYLOAD_TOO_LARGE,
                    "Document exceeds the limit of " + maxDocumentBytes + " bytes");
        }
    }

    private void requireIdentifier(String name, String value) {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException(name + " must be 1-128 letters, digits, '.', '_' or '-'");
        }
    }

    private String sha256(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content);
            StringBuilder builder = new StringBuilder();
            for (byte b : hash) {
                builder.append(String.format("%02x", b));
            }
            return builder.toString();
        } catch (Exception e) {
            throw new IngestionFailedException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to hash document", e);
        }
    }
}
