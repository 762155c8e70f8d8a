package com.sashkomusic.catalogingest.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sashkomusic.catalogingest.domain.model.LocalDeletionResult;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LocalDeletionResponse(
        boolean success,
        String message,
        @JsonProperty("track_id") Long trackId,
        @JsonProperty("file_path") String filePath,
        @JsonProperty("file_deleted") boolean fileDeleted,
        @JsonProperty("db_cleaned") boolean dbCleaned
) {
    public static LocalDeletionResponse of(LocalDeletionResult result) {
        String message = result.fileDeleted()
                ? "Deleted local file and catalog entry for '" + result.title() + "'"
                : "Catalog entry for '" + result.title() + "' was cleaned up (file was already missing)";
        return new LocalDeletionResponse(true, message, result.trackId(), result.resolvedPath(),
                result.fileDeleted(), result.catalogCleaned());
    }
}
