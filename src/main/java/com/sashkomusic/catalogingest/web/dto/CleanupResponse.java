package com.sashkomusic.catalogingest.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sashkomusic.catalogingest.domain.model.CleanupReport;

import java.util.List;

public record CleanupResponse(
        boolean success,
        @JsonProperty("deleted_count") int deletedCount,
        @JsonProperty("dry_run") boolean dryRun,
        @JsonProperty("track_ids") List<Long> trackIds,
        String message
) {
    public static CleanupResponse of(CleanupReport report) {
        String verb = report.dryRun() ? "Would delete" : "Deleted";
        return new CleanupResponse(true, report.count(), report.dryRun(), report.trackIds(),
                verb + " " + report.count() + " orphaned tracks");
    }
}
