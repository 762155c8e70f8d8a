package com.sashkomusic.catalogingest.domain.model;

public record SubmittedAsset(
        byte[] content,
        String declaredFilename,
        String declaredContentType,
        long sizeBytes
) {
    public static SubmittedAsset of(byte[] content, String declaredFilename, String declaredContentType) {
        return new SubmittedAsset(content, declaredFilename, declaredContentType, content == null ? 0 : content.length);
    }
}
