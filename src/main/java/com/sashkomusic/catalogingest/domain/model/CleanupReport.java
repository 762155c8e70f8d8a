package com.sashkomusic.catalogingest.domain.model;

import java.util.List;

public record CleanupReport(
        int count,
        boolean dryRun,
        List<Long> trackIds
) {
    public static CleanupReport empty(boolean dryRun) {
        return new CleanupReport(0, dryRun, List.of());
    }
}
