package com.sashkomusic.catalogingest.domain.model;

public enum RemoteErrorCode {
    AUTH_ERROR("auth_error"),
    BUCKET_NOT_FOUND("bucket_not_found"),
    TIMEOUT("timeout"),
    RATE_LIMITED("rate_limited"),
    CLIENT_ERROR("client_error"),
    NOT_CONFIGURED("not_configured");

    private final String code;

    RemoteErrorCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
