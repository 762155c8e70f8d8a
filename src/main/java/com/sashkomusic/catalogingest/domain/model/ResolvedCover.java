package com.sashkomusic.catalogingest.domain.model;

public record ResolvedCover(
        byte[] content,
        String extension,
        String contentType,
        String source
) {
}
