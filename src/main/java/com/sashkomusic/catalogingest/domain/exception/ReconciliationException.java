package com.sashkomusic.catalogingest.domain.exception;

public class ReconciliationException extends RuntimeException {

    public ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
