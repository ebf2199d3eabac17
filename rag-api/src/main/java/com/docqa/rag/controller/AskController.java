package com.docqa.rag.controller;

import com.docqa.rag.model.AskOutcome;
import com.docqa.rag.model.AskRequest;
import com.docqa.rag.security.CallerIdentity;
import com.docqa.rag.service.AskCommand;
import com.docqa.rag.service.RagOrchestrator;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/collections")
public class AskController {

    private final RagOrchestrator orchestrator;

    public AskController(RagOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping(path = "/{collectionId}/ask", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<AskOutcome> ask(@PathVariable String collectionId, @Valid @RequestBody AskRequest request) {
        return CallerIdentity.requireUserId(request.userId())
                .publishOn(Schedulers.boundedElastic())
                .map(userId -> orchestrator.ask(new AskCommand(collectionId, request.sessionId(), userId,
                        request.question(), request.language())));
    }
}
