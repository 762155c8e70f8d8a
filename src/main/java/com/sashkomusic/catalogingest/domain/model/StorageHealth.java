package com.sashkomusic.catalogingest.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

public record StorageHealth(
        String status,
        Remote remote
) {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Remote(
            boolean configured,
            boolean ok,
            String endpoint,
            String bucket,
            @JsonProperty("error_code") String errorCode,
            String detail
    ) {
    }

    public static StorageHealth of(Remote remote) {
        String status;
        if (!remote.configured()) {
            status = "disabled";
        } else {
            status = remote.ok() ? "ok" : "degraded";
        }
        return new StorageHealth(status, remote);
    }
}
