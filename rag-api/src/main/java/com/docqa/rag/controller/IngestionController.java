package com.docqa.rag.controller;

import com.docqa.rag.config.RagProperties;
import com.docqa.rag.model.DocumentSummary;
import com.docqa.rag.model.IngestResult;
import com.docqa.rag.model.IngestTextRequest;
import com.docqa.rag.security.CallerIdentity;
import com.docqa.rag.service.IngestCommand;
import com.docqa.rag.service.RagOrchestrator;
import com.docqa.rag.service.ingestion.IngestionFailedException;
import jakarta.validation.Valid;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/api")
@Validated
public class IngestionController {

    private final RagOrchestrator orchestrator;
    private final long maxDocumentBytes;

    public IngestionController(RagOrchestrator orchestrator, RagProperties properties) {
        this.orchestrator = orchestrator;
        this.maxDocumentBytes = properties.getIngest().getMaxDocumentBytes();
    }

    @PostMapping(value = "/collections/ingest", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<IngestResult> upload(@RequestPart("file") FilePart file,
                                     @RequestPart(value = "documentId", required = false) String documentId,
                                     @RequestPart(value = "collectionId", required = false) String collectionId,
                                     @RequestPart(value = "userId", required = false) String userId) {
        String resolvedId = documentId == null || documentId.isBlank() ? fromFilename(file.filename()) : documentId.trim();
        int limit = (int) Math.min(Integer.MAX_VALUE, maxDocumentBytes + 1);
        return DataBufferUtils.join(file.content(), limit)
                .map(this::toBytes)
                .onErrorMap(DataBufferLimitException.class, ex -> new IngestionFailedException(HttpStatus.PAYLOAD_TOO_LARGE,
                        "Document exceeds the limit of " + maxDocumentBytes + " bytes", ex))
                .switchIfEmpty(Mono.error(() -> new IngestionFailedException(HttpStatus.BAD_REQUEST, "File payload is required")))
                .zipWith(owner(userId))
                .publishOn(Schedulers.boundedElastic())
                .map(upload -> orchestrator.ingest(new IngestCommand(resolvedId, upload.getT1(), trimToNull(collectionId),
                        upload.getT2().orElse(null))));
    }

    @PostMapping(value = "/collections/ingest/text", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<IngestResult> ingestText(@Valid @RequestBody IngestTextRequest request) {
        byte[] bytes = request.text().getBytes(StandardCharsets.UTF_8);
        return owner(request.userId())
                .publishOn(Schedulers.boundedElastic())
                .map(userId -> orchestrator.ingest(new IngestCommand(request.documentId(), bytes,
                        trimToNull(request.collectionId()), userId.orElse(null))));
    }

    @GetMapping(value = "/documents", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<DocumentSummary>> documents(@RequestParam(value = "userId", required = false) String userId) {
        return CallerIdentity.requireUserId(userId)
                .publishOn(Schedulers.boundedElastic())
                .map(orchestrator::listDocuments);
    }

    // Uploads without any user are allowed; they are not listed under anyone.
    private static Mono<Optional<String>> owner(String requested) {
        return CallerIdentity.resolveUserId(requested)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
    }

    private byte[] toBytes(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    private String fromFilename(String filename) {
        if (filename == null || filename.isBlank()) {
            throw new IngestionFailedException(HttpStatus.BAD_REQUEST, "documentId is required");
        }
        return filename.trim().replaceAll("[^A-Za-z0-9._-]", "_").replace("..", "_");
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
