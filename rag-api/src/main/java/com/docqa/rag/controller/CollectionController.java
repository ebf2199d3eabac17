package com.docqa.rag.controller;

import com.docqa.rag.service.RagOrchestrator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/collections")
public class CollectionController {

    private final RagOrchestrator orchestrator;

    public CollectionController(RagOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @DeleteMapping("/{collectionId}")
    public Mono<ResponseEntity<Void>> delete(@PathVariable String collectionId) {
        return Mono.fromCallable(() -> orchestrator.deleteCollection(collectionId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(deleted -> deleted
                        ? ResponseEntity.noContent().<Void>build()
                        : ResponseEntity.notFound().<Void>build());
    }
}
