package com.sashkomusic.catalogingest.domain.model;

public enum ValidationErrorCode {
    EMPTY_FILE("empty_file"),
    FILE_TOO_LARGE("file_too_large"),
    UNSUPPORTED_TYPE("unsupported_file_type"),
    INVALID_OR_CORRUPTED("invalid_or_corrupted");

    private final String code;

    ValidationErrorCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
