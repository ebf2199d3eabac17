package com.docqa.rag.service;

import com.docqa.rag.config.RagProperties;
import com.docqa.rag.model.AskOutcome;
import com.docqa.rag.model.Chunk;
import com.docqa.rag.model.Citation;
import com.docqa.rag.model.IngestResult;
import com.docqa.rag.model.RetrievedChunk;
import com.docqa.rag.model.Turn;
import com.docqa.rag.persistence.entity.DocumentRecordEntity;
import com.docqa.rag.persistence.repository.DocumentRecordRepository;
import com.docqa.rag.service.index.VectorIndex;
import com.docqa.rag.service.ingestion.EmbeddingUnavailableException;
import com.docqa.rag.service.ingestion.EmbeddingsClient;
import com.docqa.rag.service.ingestion.IngestionFailedException;
import com.docqa.rag.service.ingestion.OverlappingTextChunker;
import com.docqa.rag.service.ingestion.PlainTextDocumentExtractor;
import com.docqa.rag.service.retrieval.RetrievalResult;
import com.docqa.rag.service.retrieval.Retriever;
import com.docqa.rag.service.session.InMemorySessionStore;
import com.docqa.rag.service.session.SessionNotFoundException;
import com.docqa.rag.service.sync.CollectionCache;
import com.docqa.rag.service.sync.IndexSnapshotCodec;
import com.docqa.rag.service.sync.IndexSyncManager;
import com.docqa.rag.service.sync.RestoredCollection;
import com.docqa.rag.service.sync.blob.InMemoryBlobStore;
import com.docqa.rag.service.synthesis.AnswerSynthesizer;
import com.docqa.rag.service.synthesis.GenerationUnavailableException;
import com.docqa.rag.service.synthesis.LanguageHintResolver;
import com.docqa.rag.service.synthesis.SynthesizedAnswer;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DefaultRagOrchestratorTest {

    @Mock
    private EmbeddingsClient embeddingsClient;

    @Mock
    private Retriever retriever;

    @Mock
    private AnswerSynthesizer answerSynthesizer;

    @Mock
    private DocumentRecordRepository documentRepository;

    private final Map<String, DocumentRecordEntity> records = new HashMap<>();
    private final List<String> embeddedTexts = new ArrayList<>();
    private String embeddingModel = "m1";

    private SimpleMeterRegistry meterRegistry;
    private IndexSyncManager syncManager;
    private CollectionCache collectionCache;
    private InMemorySessionStore sessionStore;
    private DefaultRagOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        RagProperties properties = new RagProperties();
        properties.getIngest().setMaxDocumentBytes(1024);
        properties.getSync().getRetry().setInitialBackoff(Duration.ofMillis(1));
        meterRegistry = new SimpleMeterRegistry();
        syncManager = new IndexSyncManager(new InMemoryBlobStore(),
                new IndexSnapshotCodec(new ObjectMapper().findAndRegisterModules()), properties);
        collectionCache = new CollectionCache(syncManager, Duration.ofHours(1), Clock.systemUTC());
        sessionStore = new InMemorySessionStore();
        orchestrator = new DefaultRagOrchestrator(new PlainTextDocumentExtractor(), new OverlappingTextChunker(1000, 100),
                embeddingsClient, collectionCache, syncManager, retriever, answerSynthesizer, new LanguageHintResolver(),
                sessionStore, documentRepository, meterRegistry, properties);

        lenient().when(embeddingsClient.embed(anyList())).thenAnswer(invocation -> {
            List<String> texts = invocation.getArgument(0);
            embeddedTexts.addAll(texts);
            List<float[]> vectors = new ArrayList<>();
            for (String text : texts) {
                vectors.add(new float[]{text.length(), 1f});
            }
            return new EmbeddingsClient.EmbeddingBatch(vectors, embeddingModel, 2);
        });
        lenient().when(documentRepository.findByCollectionIdAndDocumentId(anyString(), anyString()))
                .thenAnswer(invocation -> Optional.ofNullable(records.get(
                        invocation.getArgument(0) + "/" + invocation.getArgument(1))));
        lenient().when(documentRepository.save(any(DocumentRecordEntity.class))).thenAnswer(invocation -> {
            DocumentRecordEntity entity = invocation.getArgument(0);
            records.put(entity.getCollectionId() + "/" + entity.getDocumentId(), entity);
            return entity;
        });
    }

    private static IngestCommand command(String documentId, String text, String collectionId) {
        return new IngestCommand(documentId, text.getBytes(StandardCharsets.UTF_8), collectionId, "user-1");
    }

    private double counter(String name, String outcome) {
        return meterRegistry.counter(name, "outcome", outcome).count();
    }

    @Test
    void ingestPersistsNewVersionsPerDocument() {
        IngestResult first = orchestrator.ingest(command("intro", "Welcome to the programme.", "kb"));
        IngestResult second = orchestrator.ingest(command("rules", "Submissions close on 30 September 2025.", "kb"));

        assertThat(first.version()).isEqualTo(1);
        assertThat(first.chunks()).isEqualTo(1);
        assertThat(first.deduplicated()).isFalse();
        assertThat(second.version()).isEqualTo(2);
        RestoredCollection stored = syncManager.restore("kb");
        assertThat(stored.version()).isEqualTo(2);
        assertThat(stored.index().documentIds()).containsExactly("intro", "rules");
        assertThat(records.get("kb/rules").getCollectionVersion()).isEqualTo(2);
        assertThat(records.get("kb/rules").getUserId()).isEqualTo("user-1");
        assertThat(counter("rag.ingest.events", "accepted")).isEqualTo(2.0);
        assertThat(meterRegistry.timer("rag.ingest.duration").count()).isEqualTo(2);
    }

    @Test
    void collectionDefaultsToDocumentId() {
        IngestResult result = orchestrator.ingest(command("handbook", "Some text.", null));

        assertThat(result.collectionId()).isEqualTo("handbook");
        assertThat(syncManager.restore("handbook").exists()).isTrue();
    }

    @Test
    void reingestingIdenticalContentIsIdempotent() {
        IngestResult first = orchestrator.ingest(command("rules", "Submissions close on 30 September 2025.", "kb"));
        int embeddedAfterFirst = embeddedTexts.size();

        IngestResult again = orchestrator.ingest(command("rules", "Submissions close on 30 September 2025.", "kb"));

        assertThat(again.deduplicated()).isTrue();
        assertThat(again.version()).isEqualTo(first.version());
        assertThat(again.chunks()).isEqualTo(first.chunks());
        assertThat(embeddedTexts).hasSize(embeddedAfterFirst);
        assertThat(syncManager.restore("kb").version()).isEqualTo(1);
        assertThat(counter("rag.ingest.events", "deduplicated")).isEqualTo(1.0);
    }

    @Test
    void changedContentReplacesEarlierChunks() {
        orchestrator.ingest(command("rules", "Old rules text that is replaced.", "kb"));

        IngestResult updated = orchestrator.ingest(command("rules", "New rules.", "kb"));

        assertThat(updated.version()).isEqualTo(2);
        assertThat(syncManager.restore("kb").index().chunksOf("rules"))
                .extracting(Chunk::text)
                .containsExactly("New rules.");
    }

    @Test
    void concurrentWriterConflictIsRetriedOnFreshState() {
        orchestrator.ingest(command("intro", "Welcome to the programme.", "kb"));
        RestoredCollection current = syncManager.restore("kb");
        VectorIndex external = current.index().copy();
        external.add(new Chunk("faq#0", "faq", 0, "Questions and answers.", 0, 22), new float[]{22f, 1f}, "m1");
        syncManager.persist("kb", external, current.version() + 1);

        IngestResult result = orchestrator.ingest(command("rules", "Submissions close on 30 September 2025.", "kb"));

        assertThat(result.version()).isEqualTo(3);
        assertThat(syncManager.restore("kb").index().documentIds()).containsExactly("faq", "intro", "rules");
        assertThat(meterRegistry.counter("rag.sync.conflicts").count()).isEqualTo(1.0);
    }

    @Test
    void failedEmbeddingLeavesCollectionUnchanged() {
        orchestrator.ingest(command("intro", "Welcome to the programme.", "kb"));
        doThrow(new EmbeddingUnavailableException("down")).when(embeddingsClient).embed(anyList());

        assertThatThrownBy(() -> orchestrator.ingest(command("rules", "Submissions close soon.", "kb")))
                .isInstanceOfSatisfying(IngestionFailedException.class,
                        ex -> assertThat(ex.status()).isEqualTo(HttpStatus.BAD_GATEWAY));

        RestoredCollection stored = syncManager.restore("kb");
        assertThat(stored.version()).isEqualTo(1);
        assertThat(stored.index().documentIds()).containsExactly("intro");
        assertThat(records).doesNotContainKey("kb/rules");
        assertThat(counter("rag.ingest.events", "failed")).isEqualTo(1.0);
    }

    @Test
    void recordStoreFailureAfterPersistKeepsPersistedVersion() {
        doThrow(new DataAccessResourceFailureException("database unavailable"))
                .when(documentRepository).save(any(DocumentRecordEntity.class));

        IngestResult result = orchestrator.ingest(command("intro", "Welcome to the programme.", "kb"));

        assertThat(result.version()).isEqualTo(1);
        assertThat(syncManager.restore("kb").version()).isEqualTo(1);
        assertThat(collectionCache.get("kb").version()).isEqualTo(1);
        assertThat(counter("rag.ingest.events", "accepted")).isEqualTo(1.0);
        assertThat(counter("rag.ingest.events", "failed")).isZero();
    }

    @Test
    void recordLookupFailureFallsBackToFullIngest() {
        orchestrator.ingest(command("intro", "Welcome to the programme.", "kb"));
        doThrow(new DataAccessResourceFailureException("database unavailable"))
                .when(documentRepository).findByCollectionIdAndDocumentId(anyString(), anyString());

        IngestResult again = orchestrator.ingest(command("intro", "Welcome to the programme.", "kb"));

        assertThat(again.deduplicated()).isFalse();
        assertThat(again.version()).isEqualTo(2);
    }

    @Test
    void modelChangeReembedsOtherDocuments() {
        orchestrator.ingest(command("intro", "Welcome to the programme.", "kb"));
        embeddingModel = "m2";

        orchestrator.ingest(command("rules", "Submissions close on 30 September 2025.", "kb"));

        VectorIndex index = syncManager.restore("kb").index();
        assertThat(index.modelVersion()).isEqualTo("m2");
        assertThat(index.documentIds()).containsExactly("intro", "rules");
        assertThat(embeddedTexts).filteredOn(text -> text.startsWith("Welcome")).hasSize(2);
    }

    @Test
    void invalidUploadsAreRejected() {
        assertThatThrownBy(() -> orchestrator.ingest(new IngestCommand("doc", new byte[0], null, null)))
                .isInstanceOfSatisfying(IngestionFailedException.class,
                        ex -> assertThat(ex.status()).isEqualTo(HttpStatus.BAD_REQUEST));
        assertThatThrownBy(() -> orchestrator.ingest(command("../etc", "text", null)))
                .isInstanceOfSatisfying(IngestionFailedException.class,
                        ex -> assertThat(ex.status()).isEqualTo(HttpStatus.BAD_REQUEST));
        assertThatThrownBy(() -> orchestrator.ingest(command("big", "x".repeat(2048), null)))
                .isInstanceOfSatisfying(IngestionFailedException.class,
                        ex -> assertThat(ex.status()).isEqualTo(HttpStatus.PAYLOAD_TOO_LARGE));
        verifyNoInteractions(embeddingsClient);
    }

    @Test
    void askOnUnknownCollectionReportsNoDocument() {
        when(retriever.retrieve("kb", "What is the deadline?")).thenReturn(RetrievalResult.noDocument());

        AskOutcome outcome = orchestrator.ask(new AskCommand("kb", null, "user-1", "What is the deadline?", null));

        assertThat(outcome.status()).isEqualTo(AskOutcome.Status.NO_DOCUMENT);
        assertThat(outcome.session()).isNull();
        assertThat(outcome.language()).isEqualTo("en");
        assertThat(sessionStore.listSessions("user-1", 10)).isEmpty();
        verifyNoInteractions(answerSynthesizer);
        assertThat(counter("rag.ask.events", "no_document")).isEqualTo(1.0);
    }

    @Test
    void askRecordsTurnWithCitedChunks() {
        Chunk chunk = new Chunk("rules#0", "rules", 0, "Submissions close on 30 September 2025.", 0, 39);
        List<RetrievedChunk> hits = List.of(new RetrievedChunk(chunk, 0.9));
        when(retriever.retrieve("kb", "What is the deadline?")).thenReturn(RetrievalResult.of(hits));
        Citation citation = new Citation("rules#0", "rules", 0, 0, 39, chunk.text());
        when(answerSynthesizer.synthesize(eq("What is the deadline?"), eq(hits), eq("en")))
                .thenReturn(new SynthesizedAnswer(Turn.Status.ANSWERED, "30 September 2025 [S1]", List.of(citation), "en"));

        AskOutcome first = orchestrator.ask(new AskCommand("kb", null, "user-1", "What is the deadline?", null));
        AskOutcome second = orchestrator.ask(new AskCommand("kb", first.session().sessionId(), "user-1",
                "What is the deadline?", null));

        assertThat(first.status()).isEqualTo(AskOutcome.Status.ANSWERED);
        assertThat(first.turn().sequenceIndex()).isZero();
        assertThat(second.turn().sequenceIndex()).isEqualTo(1);
        assertThat(first.citations()).containsExactly(citation);
        assertThat(orchestrator.listTurns(first.session().sessionId()))
                .extracting(Turn::citations)
                .containsOnly(List.of("rules#0"));
        assertThat(orchestrator.listSessions("user-1"))
                .singleElement()
                .satisfies(summary -> assertThat(summary.turnCount()).isEqualTo(2));
        assertThat(counter("rag.ask.events", "answered")).isEqualTo(2.0);
    }

    @Test
    void notFoundAnswerIsStillRecorded() {
        when(retriever.retrieve("kb", "Who is the chair?")).thenReturn(RetrievalResult.empty());
        when(answerSynthesizer.synthesize(eq("Who is the chair?"), eq(List.of()), eq("en")))
                .thenReturn(SynthesizedAnswer.notFound("The answer could not be found in the document.", "en"));

        AskOutcome outcome = orchestrator.ask(new AskCommand("kb", "s-1", "user-1", "Who is the chair?", null));

        assertThat(outcome.status()).isEqualTo(AskOutcome.Status.NOT_FOUND);
        assertThat(outcome.turn().citations()).isEmpty();
        assertThat(sessionStore.countTurns("s-1")).isEqualTo(1);
    }

    @Test
    void generationFailureCreatesNoSession() {
        Chunk chunk = new Chunk("rules#0", "rules", 0, "Submissions close on 30 September 2025.", 0, 39);
        List<RetrievedChunk> hits = List.of(new RetrievedChunk(chunk, 0.9));
        when(retriever.retrieve("kb", "What is the deadline?")).thenReturn(RetrievalResult.of(hits));
        when(answerSynthesizer.synthesize(anyString(), anyList(), anyString()))
                .thenThrow(new GenerationUnavailableException("generation timed out", true));

        assertThatThrownBy(() -> orchestrator.ask(new AskCommand("kb", "s-2", "user-1", "What is the deadline?", null)))
                .isInstanceOf(GenerationUnavailableException.class);

        assertThat(sessionStore.listSessions("user-1", 10)).isEmpty();
        assertThat(sessionStore.findSession("s-2")).isEmpty();
        assertThat(counter("rag.ask.events", "failed")).isEqualTo(1.0);
    }

    @Test
    void askValidatesInput() {
        assertThatThrownBy(() -> orchestrator.ask(new AskCommand("kb", null, "user-1", " ", null)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> orchestrator.ask(new AskCommand("a/b", null, "user-1", "Why?", null)))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(retriever);
    }

    @Test
    void listTurnsOfUnknownSessionFails() {
        assertThatThrownBy(() -> orchestrator.listTurns("missing")).isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void deleteCollectionRemovesSnapshotAndRecords() {
        orchestrator.ingest(command("intro", "Welcome to the programme.", "kb"));
        when(documentRepository.deleteByCollectionId("kb")).thenReturn(1L);

        assertThat(orchestrator.deleteCollection("kb")).isTrue();

        assertThat(syncManager.restore("kb").exists()).isFalse();
        verify(documentRepository, times(1)).deleteByCollectionId("kb");
        verify(documentRepository, never()).deleteAll();
    }
}
