package com.sashkomusic.catalogingest.messaging.producer.dto;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

@JsonTypeName("orphan_cleanup_complete")
public record OrphanCleanupResultDto(
        String trigger,
        boolean dryRun,
        int count,
        List<Long> trackIds
) {
}
