package com.docqa.rag.service.sync.blob;

import com.docqa.rag.service.RagException;
import org.springframework.http.HttpStatus;

/**
 * Transient storage failure. Retried by the sync manager before it reaches a caller.
 */
public class BlobStorageException extends RagException {

    public BlobStorageException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message, cause);
    }

    @Override
    public String errorCode() {
        return "BLOB_STORAGE_UNAVAILABLE";
    }
}
