package com.docqa.rag.service.sync.blob;

public record Blob(String key, byte[] content, long generation) {
}
