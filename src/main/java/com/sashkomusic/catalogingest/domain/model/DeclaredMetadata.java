package com.sashkomusic.catalogingest.domain.model;

public record DeclaredMetadata(
        String title,
        String artistName,
        String album,
        Integer year,
        String genre,
        String tags,
        String description,
        byte[] coverArt,
        String coverArtFilename
) {
    public static DeclaredMetadata of(String title, String artistName) {
        return new DeclaredMetadata(title, artistName, null, null, null, null, null, null, null);
    }

    public boolean hasCoverArt() {
        return coverArt != null && coverArt.length > 0;
    }
}
