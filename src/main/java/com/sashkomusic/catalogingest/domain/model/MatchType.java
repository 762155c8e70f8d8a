package com.sashkomusic.catalogingest.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MatchType {
    EXACT_CONTENT("exact"),
    METADATA_SIMILARITY("metadata");

    private final String wireName;

    MatchType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
