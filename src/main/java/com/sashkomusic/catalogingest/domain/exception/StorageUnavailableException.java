package com.sashkomusic.catalogingest.domain.exception;

/**
 * No storage tier accepted the write.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
