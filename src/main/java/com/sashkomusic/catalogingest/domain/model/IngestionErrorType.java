package com.sashkomusic.catalogingest.domain.model;

public enum IngestionErrorType {
    INVALID_INPUT,
    DUPLICATE_CONFLICT,
    STORAGE_UNAVAILABLE,
    PERSISTENCE_ERROR
}
