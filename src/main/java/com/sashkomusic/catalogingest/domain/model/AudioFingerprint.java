package com.sashkomusic.catalogingest.domain.model;

public record AudioFingerprint(
        String contentHash,
        String title,
        String artist,
        String album,
        String genre,
        Integer year,
        Integer durationSeconds,
        Integer bitrateKbps,
        long sizeBytes,
        byte[] artwork
) {
    public double sizeMb() {
        return sizeBytes / (1024.0 * 1024.0);
    }

    /**
     * Declared values take precedence over what the file's tags say.
     */
    public AudioFingerprint withDeclared(String declaredTitle, String declaredArtist, String declaredAlbum) {
        return new AudioFingerprint(contentHash,
                prefer(declaredTitle, title),
                prefer(declaredArtist, artist),
                prefer(declaredAlbum, album),
                genre, year, durationSeconds, bitrateKbps, sizeBytes, artwork);
    }

    private static String prefer(String declared, String extracted) {
        return declared != null && !declared.isBlank() ? declared.trim() : extracted;
    }

    public boolean hasArtwork() {
        return artwork != null && artwork.length > 0;
    }
}
