package com.sashkomusic.catalogingest.messaging.producer.dto;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.sashkomusic.catalogingest.domain.entity.Track;
import com.sashkomusic.catalogingest.domain.model.StorageOutcome;

@JsonTypeName("track_ingested")
public record TrackIngestedDto(
        long trackId,
        String title,
        String artist,
        String album,
        String contentHash,
        String storageTier,
        String location,
        boolean fallbackFromRemote
) {
    public static TrackIngestedDto of(Track track, StorageOutcome storage) {
        return new TrackIngestedDto(track.getId(), track.getTitle(), track.getArtistName(), track.getAlbum(),
                track.getContentHash(), storage.tier().name(), storage.location(), storage.fellBackFromRemote());
    }
}
