package com.docqa.rag.service;

/**
 * @param collectionId target collection, the document id when absent
 * @param userId       owner recorded with the document, may be absent
 */
public record IngestCommand(String documentId, byte[] bytes, String collectionId, String userId) {
}
