package com.sashkomusic.catalogingest.domain.model;

public record RemoteWriteResult(
        boolean ok,
        String url,
        RemoteErrorCode errorCode,
        String detail
) {
    public static RemoteWriteResult success(String url) {
        return new RemoteWriteResult(true, url, null, null);
    }

    public static RemoteWriteResult failure(RemoteErrorCode errorCode, String detail) {
        return new RemoteWriteResult(false, null, errorCode, detail);
    }

    public static RemoteWriteResult notConfigured() {
        return failure(RemoteErrorCode.NOT_CONFIGURED, "Remote storage is not configured");
    }

    public boolean wasAttempted() {
        return ok || errorCode != RemoteErrorCode.NOT_CONFIGURED;
    }
}
