package com.sashkomusic.catalogingest.domain.model;

public record BlobMetadata(
        String key,
        long contentLength,
        String contentType,
        String cacheControl
) {
}
