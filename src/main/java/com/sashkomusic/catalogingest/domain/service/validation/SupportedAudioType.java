package com.sashkomusic.catalogingest.domain.service.validation;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

public enum SupportedAudioType {
    MP3("audio/mpeg", "mp3"),
    WAV("audio/wav", "wav"),
    AIFF("audio/aiff", "aiff", "aif"),
    FLAC("audio/flac", "flac"),
    M4A("audio/mp4", "m4a"),
    OGG("audio/ogg", "ogg"),
    WMA("audio/x-ms-wma", "wma");

    private final String mimeType;
    private final Set<String> extensions;

    SupportedAudioType(String mimeType, String... extensions) {
        this.mimeType = mimeType;
        this.extensions = Set.of(extensions);
    }

    public String mimeType() {
        return mimeType;
    }

    public static Optional<SupportedAudioType> fromExtension(String extension) {
        if (extension == null) {
            return Optional.empty();
        }
        String normalized = extension.toLowerCase().replaceFirst("^\\.", "");
        return Arrays.stream(values())
                .filter(type -> type.extensions.contains(normalized))
                .findFirst();
    }
}
