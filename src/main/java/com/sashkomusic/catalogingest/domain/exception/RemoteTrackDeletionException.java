package com.sashkomusic.catalogingest.domain.exception;

public class RemoteTrackDeletionException extends RuntimeException {

    public RemoteTrackDeletionException(Long trackId) {
        super("Track " + trackId + " uses remote storage. Cannot delete local file.");
    }
}
