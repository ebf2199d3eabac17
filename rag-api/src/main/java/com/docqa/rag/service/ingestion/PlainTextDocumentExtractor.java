package com.docqa.rag.service.ingestion;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Accepts text that an upstream extractor already produced. Bytes must be valid UTF-8; a leading
 * byte order mark is dropped.
 */
@Component
public class PlainTextDocumentExtractor implements DocumentTextExtractor {

    private static final char BOM = '\uFEFF';

    @Override
    public String extract(String documentId, byte[] content) {
        if (content == null || content.length == 0) {
            throw new IngestionFailedException(HttpStatus.BAD_REQUEST, "Document " + documentId + " is empty");
        }
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        String text;
        try {
            text = decoder.decode(ByteBuffer.wrap(content)).toString();
        } catch (CharacterCodingException e) {
            throw new IngestionFailedException(HttpStatus.UNPROCESSABLE_ENTITY,
                    "Document " + documentId + " is not UTF-8 encoded text", e);
        }
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            text = text.substring(1);
        }
        return text;
    }
}
