package com.docqa.rag.service.sync.blob;

public class PreconditionFailedException extends RuntimeException {

    private final String key;

    public PreconditionFailedException(String key, Precondition precondition, Long actualGeneration) {
        super("Precondition " + precondition + " failed for blob " + key + " (generation " + actualGeneration + ")");
        this.key = key;
    }

    public String key() {
        return key;
    }
}
