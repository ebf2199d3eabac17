package com.docqa.rag.service.ingestion;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlainTextDocumentExtractorTest {

    private final PlainTextDocumentExtractor extractor = new PlainTextDocumentExtractor();

    @Test
    void decodesUtf8AndDropsByteOrderMark() {
        byte[] content = "\uFEFFZürich office".getBytes(StandardCharsets.UTF_8);

        assertThat(extractor.extract("doc", content)).isEqualTo("Zürich office");
    }

    @Test
    void rejectsEmptyContent() {
        assertThatThrownBy(() -> extractor.extract("doc", new byte[0]))
                .isInstanceOfSatisfying(IngestionFailedException.class,
                        ex -> assertThat(ex.status()).isEqualTo(HttpStatus.BAD_REQUEST));
    }

    @Test
    void rejectsInvalidUtf8() {
        byte[] content = {(byte) 0xC3, (byte) 0x28, 0x41};

        assertThatThrownBy(() -> extractor.extract("doc", content))
                .isInstanceOfSatisfying(IngestionFailedException.class,
                        ex -> assertThat(ex.status()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY));
    }
}
