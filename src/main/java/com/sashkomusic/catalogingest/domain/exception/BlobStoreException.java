package com.sashkomusic.catalogingest.domain.exception;

import com.sashkomusic.catalogingest.domain.model.RemoteErrorCode;

public class BlobStoreException extends RuntimeException {

    private final RemoteErrorCode errorCode;

    public BlobStoreException(RemoteErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BlobStoreException(RemoteErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public RemoteErrorCode getErrorCode() {
        return errorCode;
    }
}
