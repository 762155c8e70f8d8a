package com.sashkomusic.catalogingest.domain.exception;

public class CatalogPersistenceException extends RuntimeException {

    public CatalogPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
