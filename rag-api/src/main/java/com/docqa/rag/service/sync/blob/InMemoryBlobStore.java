package com.docqa.rag.service.sync.blob;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Component
@Profile("inmemory")
public class InMemoryBlobStore implements BlobStore {

    private final Map<String, Blob> blobs = new ConcurrentHashMap<>();
    private final AtomicLong generations = new AtomicLong();

    @Override
    public Optional<Blob> get(String key) {
        Blob blob = blobs.get(key);
        if (blob == null) {
            return Optional.empty();
        }
        return Optional.of(new Blob(key, Arrays.copyOf(blob.content(), blob.content().length), blob.generation()));
    }

    @Override
    public Optional<Long> head(String key) {
        return Optional.ofNullable(blobs.get(key)).map(Blob::generation);
    }

    @Override
    public long put(String key, byte[] content, Precondition precondition) {
        byte[] stored = Arrays.copyOf(content, content.length);
        Blob written = blobs.compute(key, (k, current) -> {
            Long currentGeneration = current == null ? null : current.generation();
            if (!precondition.isSatisfiedBy(currentGeneration)) {
                throw new PreconditionFailedException(key, precondition, currentGeneration);
            }
            return new Blob(k, stored, generations.incrementAndGet());
        });
        return written.generation();
    }

    @Override
    public boolean delete(String key) {
        return blobs.remove(key) != null;
    }
}
