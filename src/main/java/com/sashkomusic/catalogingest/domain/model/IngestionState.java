package com.sashkomusic.catalogingest.domain.model;

public enum IngestionState {
    VALIDATING,
    FINGERPRINTING,
    DUPLICATE_CHECKING,
    METADATA_RESOLVING,
    STORAGE_WRITING,
    PERSISTING,
    COMMITTED,
    FAILED
}
