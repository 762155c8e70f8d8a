package com.sashkomusic.catalogingest.domain.service.fingerprint;

import java.util.Map;

public record AudioTags(
        Map<TagField, String> values,
        Integer durationSeconds,
        Integer bitrateKbps,
        byte[] artwork
) {
    public static AudioTags empty() {
        return new AudioTags(Map.of(), null, null, null);
    }

    public String get(TagField field) {
        return values.get(field);
    }
}
