package com.sashkomusic.catalogingest.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MetadataPreview(
        String title,
        String artist,
        String album,
        Integer year,
        String genre,
        @JsonProperty("duration_seconds") int durationSeconds,
        int bitrate,
        @JsonProperty("file_size_mb") double fileSizeMb,
        @JsonProperty("cover_art") String coverArt
) {
}
