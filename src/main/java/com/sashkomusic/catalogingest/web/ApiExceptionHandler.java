package com.sashkomusic.catalogingest.web;

import com.sashkomusic.catalogingest.domain.exception.InvalidAudioException;
import com.sashkomusic.catalogingest.domain.exception.ReconciliationException;
import com.sashkomusic.catalogingest.domain.exception.RemoteTrackDeletionException;
import com.sashkomusic.catalogingest.domain.exception.StorageUnavailableException;
import com.sashkomusic.catalogingest.domain.exception.TrackNotFoundException;
import com.sashkomusic.catalogingest.web.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidAudioException.class)
    public ResponseEntity<ErrorResponse> handleInvalidAudio(InvalidAudioException ex) {
        log.warn("[API] Invalid audio: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getValidation().getCode().code(), ex.getValidation().getReason());
    }

    @ExceptionHandler(TrackNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(TrackNotFoundException ex) {
        log.warn("[API] Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "track_not_found", ex.getMessage());
    }

    @ExceptionHandler(RemoteTrackDeletionException.class)
    public ResponseEntity<ErrorResponse> handleRemoteTrack(RemoteTrackDeletionException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "remote_track", ex.getMessage());
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MissingServletRequestPartException.class})
    public ResponseEntity<ErrorResponse> handleMissingField(Exception ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "missing_field", ex.getMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleTooLarge(MaxUploadSizeExceededException ex) {
        log.warn("[API] Upload too large: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "file_too_large", "File exceeds the maximum upload size");
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStorageUnavailable(StorageUnavailableException ex) {
        log.error("[API] Storage unavailable: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "storage_unavailable", ex.getMessage());
    }

    @ExceptionHandler(ReconciliationException.class)
    public ResponseEntity<ErrorResponse> handleReconciliation(ReconciliationException ex) {
        log.error("[API] Reconciliation failed: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "reconciliation_failed", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Internal server error");
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.of(code, message));
    }
}
