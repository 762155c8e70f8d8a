package com.sashkomusic.catalogingest.domain.service.fingerprint;

import org.jaudiotagger.tag.FieldKey;

import java.util.List;

/**
 * Logical tag fields with the keys they appear under across containers, in lookup order:
 * the generic jaudiotagger key first, then ID3v2, Vorbis comment and MP4 atom ids.
 */
public enum TagField {
    TITLE(FieldKey.TITLE, "TIT2", "TITLE", "\u00A9nam"),
    ARTIST(FieldKey.ARTIST, "TPE1", "ARTIST", "\u00A9ART", "TPE2"),
    ALBUM(FieldKey.ALBUM, "TALB", "ALBUM", "\u00A9alb"),
    YEAR(FieldKey.YEAR, "TDRC", "DATE", "\u00A9day", "TYER"),
    GENRE(FieldKey.GENRE, "TCON", "GENRE", "\u00A9gen");

    private final FieldKey fieldKey;
    private final List<String> rawKeys;

    TagField(FieldKey fieldKey, String... rawKeys) {
        this.fieldKey = fieldKey;
        this.rawKeys = List.of(rawKeys);
    }

    public FieldKey fieldKey() {
        return fieldKey;
    }

    public List<String> rawKeys() {
        return rawKeys;
    }
}
