package com.sashkomusic.catalogingest.domain.model;

import com.sashkomusic.catalogingest.domain.entity.Track;

import java.time.LocalDateTime;
import java.util.List;

public record OrphanedTrack(
        Long id,
        String title,
        String artist,
        String storedLocation,
        LocalDateTime createdAt,
        List<String> triedPaths
) {
    public static OrphanedTrack of(Track track, List<String> triedPaths) {
        return new OrphanedTrack(track.getId(), track.getTitle(), track.getArtistName(),
                track.getStoredLocation(), track.getCreatedAt(), triedPaths);
    }
}
