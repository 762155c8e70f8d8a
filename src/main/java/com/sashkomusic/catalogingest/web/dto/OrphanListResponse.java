package com.sashkomusic.catalogingest.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sashkomusic.catalogingest.domain.model.OrphanedTrack;

import java.time.LocalDateTime;
import java.util.List;

public record OrphanListResponse(
        int count,
        List<Entry> tracks
) {
    public record Entry(
            Long id,
            String title,
            String artist,
            @JsonProperty("file_path") String filePath,
            @JsonProperty("created_at") LocalDateTime createdAt,
            @JsonProperty("tried_paths") List<String> triedPaths
    ) {
    }

    public static OrphanListResponse of(List<OrphanedTrack> orphaned) {
        List<Entry> entries = orphaned.stream()
                .map(track -> new Entry(track.id(), track.title(), track.artist(), track.storedLocation(),
                        track.createdAt(), track.triedPaths()))
                .toList();
        return new OrphanListResponse(entries.size(), entries);
    }
}
