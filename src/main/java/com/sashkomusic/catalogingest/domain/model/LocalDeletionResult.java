package com.sashkomusic.catalogingest.domain.model;

public record LocalDeletionResult(
        Long trackId,
        String title,
        String resolvedPath,
        boolean fileDeleted,
        boolean catalogCleaned
) {
}
