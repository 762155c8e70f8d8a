package com.sashkomusic.catalogingest.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record DuplicateMatch(
        @JsonProperty("matched_track_id") Long matchedTrackId,
        @JsonProperty("match_type") MatchType matchType,
        double confidence,
        List<String> reasons
) {
    public static DuplicateMatch exact(Long trackId) {
        return new DuplicateMatch(trackId, MatchType.EXACT_CONTENT, 1.0, List.of("identical file content"));
    }
}
