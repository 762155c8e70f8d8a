package com.sashkomusic.catalogingest.domain.model;

public record IngestionError(
        IngestionErrorType type,
        String code,
        String message,
        DuplicateMatch match,
        IngestionState failedAt
) {
    public static IngestionError invalidInput(ValidationResult validation) {
        return new IngestionError(IngestionErrorType.INVALID_INPUT, validation.getCode().code(),
                validation.getReason(), null, IngestionState.VALIDATING);
    }

    public static IngestionError duplicate(DuplicateMatch match) {
        String message = match.matchType() == MatchType.EXACT_CONTENT
                ? "This file has already been uploaded"
                : "A similar track already exists in the catalog";
        return new IngestionError(IngestionErrorType.DUPLICATE_CONFLICT, "duplicate_track", message, match,
                IngestionState.DUPLICATE_CHECKING);
    }

    public static IngestionError storedLocationTaken() {
        return new IngestionError(IngestionErrorType.DUPLICATE_CONFLICT, "duplicate_track",
                "A track with the same storage location was committed concurrently", null,
                IngestionState.PERSISTING);
    }

    public static IngestionError storageUnavailable(String message) {
        return new IngestionError(IngestionErrorType.STORAGE_UNAVAILABLE, "storage_unavailable", message, null,
                IngestionState.STORAGE_WRITING);
    }

    public static IngestionError persistence(String message) {
        return new IngestionError(IngestionErrorType.PERSISTENCE_ERROR, "persistence_error", message, null,
                IngestionState.PERSISTING);
    }
}
