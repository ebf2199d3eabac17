package com.docqa.rag.controller;

import com.docqa.rag.model.SessionSummary;
import com.docqa.rag.model.Turn;
import com.docqa.rag.security.CallerIdentity;
import com.docqa.rag.service.RagOrchestrator;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final RagOrchestrator orchestrator;

    public SessionController(RagOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<SessionSummary>> sessions(@RequestParam(value = "userId", required = false) String userId,
                                               @RequestParam(value = "limit", required = false) Integer limit) {
        return CallerIdentity.requireUserId(userId)
                .publishOn(Schedulers.boundedElastic())
                .map(user -> limit == null
                        ? orchestrator.listSessions(user)
                        : orchestrator.listSessions(user, limit));
    }

    @GetMapping(path = "/{sessionId}/turns", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<Turn>> turns(@PathVariable String sessionId) {
        return Mono.fromCallable(() -> orchestrator.listTurns(sessionId))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/{sessionId}")
    public Mono<ResponseEntity<Void>> delete(@PathVariable String sessionId) {
        return Mono.fromCallable(() -> orchestrator.deleteSession(sessionId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(deleted -> deleted
                        ? ResponseEntity.noContent().<Void>build()
                        : ResponseEntity.notFound().<Void>build());
    }
}
