package com.sashkomusic.catalogingest.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sashkomusic.catalogingest.domain.entity.Track;
import com.sashkomusic.catalogingest.domain.model.StorageOutcome;

import java.time.LocalDateTime;
import java.util.Locale;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UploadResponse(
        Long id,
        String title,
        String artist,
        String album,
        String genre,
        Integer year,
        String tags,
        String description,
        @JsonProperty("duration_seconds") Integer durationSeconds,
        @JsonProperty("file_size_mb") Double fileSizeMb,
        @JsonProperty("quality_kbps") Integer qualityKbps,
        @JsonProperty("content_hash") String contentHash,
        @JsonProperty("cover_art_url") String coverArtUrl,
        @JsonProperty("created_at") LocalDateTime createdAt,
        String storage,
        String location,
        @JsonProperty("fallback_from_remote") Boolean fallbackFromRemote
) {
    public static UploadResponse of(Track track, StorageOutcome storage) {
        return new UploadResponse(
                track.getId(),
                track.getTitle(),
                track.getArtistName(),
                track.getAlbum(),
                track.getGenre(),
                track.getYear(),
                track.getTags(),
                track.getDescription(),
                track.getDurationSeconds(),
                track.getFileSizeMb(),
                track.getQualityKbps(),
                track.getContentHash(),
                track.getCoverArtLocation(),
                track.getCreatedAt(),
                storage.tier().name().toLowerCase(Locale.ROOT),
                storage.location(),
                storage.fellBackFromRemote() ? Boolean.TRUE : null);
    }
}
