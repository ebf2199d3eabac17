package com.docqa.rag.service.sync;

import com.docqa.rag.service.RagException;
import org.springframework.http.HttpStatus;

/**
 * Raised when a snapshot write loses against the durably stored version. The caller has to restore
 * the collection again and re-apply its change.
 */
public class StaleVersionException extends RagException {

    private final String collectionId;
    private final long attemptedVersion;
    private final long storedVersion;

    public StaleVersionException(String collectionId, long attemptedVersion, long storedVersion) {
        super(HttpStatus.CONFLICT, "Collection " + collectionId + " is at version " + storedVersion
                + ", cannot persist version " + attemptedVersion);
        this.collectionId = collectionId;
        this.attemptedVersion = attemptedVersion;
        this.storedVersion = storedVersion;
    }

    public StaleVersionException(String collectionId, long attemptedVersion, Throwable cause) {
        super(HttpStatus.CONFLICT, "Collection " + collectionId + " was written concurrently, cannot persist version "
                + attemptedVersion, cause);
        this.collectionId = collectionId;
        this.attemptedVersion = attemptedVersion;
        this.storedVersion = -1;
    }

    public String collectionId() {
        return collectionId;
    }

    public long attemptedVersion() {
        return attemptedVersion;
    }

    /**
     * Version found in storage, or -1 when the conflict was detected by the write precondition.
     */
    public long storedVersion() {
        return storedVersion;
    }

    @Override
    public String errorCode() {
        return "STALE_VERSION";
    }
}
