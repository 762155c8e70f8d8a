package com.sashkomusic.catalogingest.domain.model;

import com.sashkomusic.catalogingest.domain.entity.Track;

public record IngestionResult(
        boolean committed,
        Track track,
        StorageOutcome storage,
        IngestionError error
) {
    public static IngestionResult committed(Track track, StorageOutcome storage) {
        return new IngestionResult(true, track, storage, null);
    }

    public static IngestionResult failed(IngestionError error) {
        return new IngestionResult(false, null, null, error);
    }

    public IngestionState state() {
        return committed ? IngestionState.COMMITTED : IngestionState.FAILED;
    }
}
