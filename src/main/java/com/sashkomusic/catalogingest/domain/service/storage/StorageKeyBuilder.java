package com.sashkomusic.catalogingest.domain.service.storage;

import com.sashkomusic.catalogingest.domain.service.utils.FileNames;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class StorageKeyBuilder {

    static final String AUDIO_PREFIX = "audio/";
    static final String COVER_PREFIX = "covers/";

    /**
     * {@code audio/<artist> - <title>.<ext>}; salted keys get a random suffix so that an intentional
     * re-upload never lands on an existing object.
     */
    public String audioKey(String artist, String title, String extension, boolean salted) {
        String stem = FileNames.sanitize(artist) + " - " + FileNames.sanitize(title);
        if (salted) {
            stem = stem + "-" + salt();
        }
        return AUDIO_PREFIX + stem + dotted(extension);
    }

    public String coverKey(String audioKey, String extension) {
        return COVER_PREFIX + FileNames.stem(audioKey) + dotted(extension);
    }

    private String dotted(String extension) {
        return extension == null || extension.isEmpty() ? "" : "." + extension;
    }

    private String salt() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
