package com.docqa.rag.service.sync;

import com.docqa.rag.model.Chunk;
import com.docqa.rag.service.index.VectorIndex;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.List;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Gzip-compressed JSON snapshot of a collection. {@code collectionId} and {@code version} are written
 * first so the version can be read without parsing the chunks.
 */
@Component
public class IndexSnapshotCodec {

    private final ObjectMapper objectMapper;

    public IndexSnapshotCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] encode(String collectionId, VectorIndex index, long version, Instant createdAt) {
        List<SnapshotChunk> chunks = index.entries().stream()
                .map(entry -> SnapshotChunk.of(entry.chunk(), entry.vector()))
                .toList();
        IndexSnapshot snapshot = new IndexSnapshot(collectionId, version, index.modelVersion(), index.dimension(),
                createdAt, chunks);
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (OutputStream out = new GZIPOutputStream(buffer)) {
            objectMapper.writeValue(out, snapshot);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode snapshot of " + collectionId, e);
        }
        return buffer.toByteArray();
    }

    /**
     * @throws SnapshotFormatException when the bytes are not a readable snapshot
     */
    public IndexSnapshot decode(byte[] bytes) {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(bytes))) {
            IndexSnapshot snapshot = objectMapper.readValue(in, IndexSnapshot.class);
            if (snapshot.collectionId() == null || snapshot.version() < 0) {
                throw new SnapshotFormatException("Snapshot is missing its collection id or version", null);
            }
            return snapshot;
        } catch (IOException e) {
            throw new SnapshotFormatException("Unreadable collection snapshot", e);
        }
    }

    public long readVersion(byte[] bytes) {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(bytes));
             JsonParser parser = objectMapper.getFactory().createParser(in)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new SnapshotFormatException("Snapshot is not a JSON object", null);
            }
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String field = parser.getCurrentName();
                parser.nextToken();
                if ("version".equals(field)) {
                    return parser.getLongValue();
                }
                parser.skipChildren();
            }
            throw new SnapshotFormatException("Snapshot has no version", null);
        } catch (IOException e) {
            throw new SnapshotFormatException("Unreadable collection snapshot", e);
        }
    }

    @JsonPropertyOrder({"collectionId", "version", "modelVersion", "dimension", "createdAt", "chunks"})
    public record IndexSnapshot(String collectionId,
                                long version,
                                String modelVersion,
                                int dimension,
                                Instant createdAt,
                                List<SnapshotChunk> chunks) {

        public IndexSnapshot {
            chunks = chunks == null ? List.of() : List.copyOf(chunks);
        }

        public VectorIndex toIndex() {
            VectorIndex index = modelVersion == null ? new VectorIndex() : new VectorIndex(modelVersion, dimension);
            for (SnapshotChunk chunk : chunks) {
                index.add(chunk.toChunk(), chunk.vector(), modelVersion);
            }
            return index;
        }
    }

    @JsonPropertyOrder({"chunkId", "documentId", "sequenceIndex", "text", "charStart", "charEnd", "vector"})
    public record SnapshotChunk(String chunkId,
                                String documentId,
                                int sequenceIndex,
                                String text,
                                int charStart,
                                int charEnd,
                                float[] vector) {

        static SnapshotChunk of(Chunk chunk, float[] vector) {
            return new SnapshotChunk(chunk.chunkId(), chunk.documentId(), chunk.sequenceIndex(), chunk.text(),
                    chunk.charStart(), chunk.charEnd(), vector);
        }

        Chunk toChunk() {
            return new Chunk(chunkId, documentId, sequenceIndex, text, charStart, charEnd);
        }
    }
}
