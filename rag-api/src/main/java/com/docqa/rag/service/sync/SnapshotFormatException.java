package com.docqa.rag.service.sync;

import com.docqa.rag.service.RagException;
import org.springframework.http.HttpStatus;

public class SnapshotFormatException extends RagException {

    public SnapshotFormatException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }

    @Override
    public String errorCode() {
        return "SNAPSHOT_UNREADABLE";
    }
}
