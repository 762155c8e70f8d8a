package com.sashkomusic.catalogingest.domain.exception;

public class TrackNotFoundException extends RuntimeException {

    public TrackNotFoundException(Long trackId) {
        super("Track with id " + trackId + " not found");
    }
}
