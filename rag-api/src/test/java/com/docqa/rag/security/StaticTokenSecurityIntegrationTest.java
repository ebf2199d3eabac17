package com.docqa.rag.security;

import com.docqa.rag.controller.IngestionController;
import com.docqa.rag.model.IngestResult;
import com.docqa.rag.model.IngestTextRequest;
import com.docqa.rag.service.RagOrchestrator;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;

import java.nio.charset.StandardCharsets;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.springframework.http.MediaType.MULTIPART_FORM_DATA;

@WebFluxTest(controllers = IngestionController.class)
@Import(SecurityConfig.class)
@TestPropertySource(properties = "rag.security.static-token=test-token")
class StaticTokenSecurityIntegrationTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private RagOrchestrator orchestrator;

    @Test
    void rejectsTextIngestionWithoutToken() {
        webTestClient.post()
                .uri("/api/collections/ingest/text")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(sampleTextRequest())
                .exchange()
                .expectStatus().isUnauthorized();
    }

    @Test
    void rejectsTextIngestionWithWrongToken() {
        webTestClient.post()
                .uri("/api/collections/ingest/text")
                .header(HttpHeaders.AUTHORIZATION, "Bearer wrong")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(sampleTextRequest())
                .exchange()
                .expectStatus().isUnauthorized();
    }

    @Test
    void allowsTextIngestionWithConfiguredToken() {
        Mockito.when(orchestrator.ingest(any()))
                .thenReturn(sampleResult());

        webTestClient.post()
                .uri("/api/collections/ingest/text")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-token")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(sampleTextRequest())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.collectionId").isEqualTo("handbook")
                .jsonPath("$.version").isEqualTo(1);
    }

    @Test
    void rejectsUploadWithoutToken() {
        webTestClient.post()
                .uri("/api/collections/ingest")
                .contentType(MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(sampleMultipart()))
                .exchange()
                .expectStatus().isUnauthorized();
    }

    @Test
    void allowsUploadWithConfiguredToken() {
        Mockito.when(orchestrator.ingest(argThat(command -> "handbook_2025.txt".equals(command.documentId())
                        && "handbook".equals(command.collectionId()))))
                .thenReturn(sampleResult());

        webTestClient.post()
                .uri("/api/collections/ingest")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-token")
                .contentType(MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(sampleMultipart()))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.documentId").isEqualTo("handbook_2025.txt");
    }

    @Test
    void staticTokenActsForTheNamedUserOrItself() {
        Mockito.when(orchestrator.ingest(any())).thenReturn(sampleResult());

        webTestClient.post()
                .uri("/api/collections/ingest/text")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-token")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new IngestTextRequest("handbook", null, null, "The deadline is 30 September 2025."))
                .exchange()
                .expectStatus().isOk();
        webTestClient.post()
                .uri("/api/collections/ingest/text")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-token")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(sampleTextRequest())
                .exchange()
                .expectStatus().isOk();

        Mockito.verify(orchestrator).ingest(argThat(command -> "rag-service".equals(command.userId())));
        Mockito.verify(orchestrator).ingest(argThat(command -> "user-1".equals(command.userId())));
    }

    @Test
    void invalidRequestIsReportedAsValidationFailure() {
        webTestClient.post()
                .uri("/api/collections/ingest/text")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-token")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new IngestTextRequest("handbook", null, "user-1", ""))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("VALIDATION_FAILED");
    }

    private IngestTextRequest sampleTextRequest() {
        return new IngestTextRequest("handbook", null, "user-1", "The deadline is 30 September 2025.");
    }

    private IngestResult sampleResult() {
        return new IngestResult("handbook", "handbook_2025.txt", 1, 1, false);
    }

    private MultiValueMap<String, Object> sampleMultipart() {
        ByteArrayResource file = new ByteArrayResource("The deadline is 30 September 2025.".getBytes(StandardCharsets.UTF_8)) {
            @Override
            public String getFilename() {
                return "handbook 2025.txt";
            }
        };

        LinkedMultiValueMap<String, Object> data = new LinkedMultiValueMap<>();
        data.add("collectionId", "handbook");
        data.add("userId", "user-1");
        data.add("file", file);
        return data;
    }
}
