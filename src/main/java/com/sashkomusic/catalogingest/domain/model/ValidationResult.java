package com.sashkomusic.catalogingest.domain.model;

public class ValidationResult {
    private final boolean valid;
    private final String mimeType;
    private final String extension;
    private final long sizeBytes;
    private final Integer durationSeconds;
    private final Integer bitrateKbps;
    private final String reason;
    private final ValidationErrorCode code;

    private ValidationResult(boolean valid, String mimeType, String extension, long sizeBytes,
                             Integer durationSeconds, Integer bitrateKbps,
                             String reason, ValidationErrorCode code) {
        this.valid = valid;
        this.mimeType = mimeType;
        this.extension = extension;
        this.sizeBytes = sizeBytes;
        this.durationSeconds = durationSeconds;
        this.bitrateKbps = bitrateKbps;
        this.reason = reason;
        this.code = code;
    }

    public static ValidationResult valid(String mimeType, String extension, long sizeBytes) {
        return new ValidationResult(true, mimeType, extension, sizeBytes, null, null, null, null);
    }

    public static ValidationResult valid(String mimeType, String extension, long sizeBytes,
                                         Integer durationSeconds, Integer bitrateKbps) {
        return new ValidationResult(true, mimeType, extension, sizeBytes, durationSeconds, bitrateKbps, null, null);
    }

    public static ValidationResult invalid(String reason, ValidationErrorCode code) {
        return new ValidationResult(false, null, null, 0, null, null, reason, code);
    }

    public boolean isValid() {
        return valid;
    }

    public String getMimeType() {
        return mimeType;
    }

    public String getExtension() {
        return extension;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public Integer getDurationSeconds() {
        return durationSeconds;
    }

    public Integer getBitrateKbps() {
        return bitrateKbps;
    }

    public String getReason() {
        return reason;
    }

    public ValidationErrorCode getCode() {
        return code;
    }
}
