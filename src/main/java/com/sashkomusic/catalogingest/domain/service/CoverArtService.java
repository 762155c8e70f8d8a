package com.sashkomusic.catalogingest.domain.service;

import com.sashkomusic.catalogingest.domain.model.AudioFingerprint;
import com.sashkomusic.catalogingest.domain.model.DeclaredMetadata;
import com.sashkomusic.catalogingest.domain.model.ResolvedCover;
import com.sashkomusic.catalogingest.domain.port.CoverArtGenerator;
import com.sashkomusic.catalogingest.domain.service.utils.FileNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Picks the cover for a new track: the uploaded image, else the artwork embedded in the audio
 * file, else a generated one. Failures only cost the cover, never the upload.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CoverArtService {

    private final CoverArtGenerator coverArtGenerator;

    public Optional<ResolvedCover> resolve(DeclaredMetadata metadata, AudioFingerprint fingerprint) {
        try {
            if (metadata.hasCoverArt()) {
                String extension = FileNames.extension(metadata.coverArtFilename());
                if (extension.isEmpty()) {
                    extension = detectExtension(metadata.coverArt());
                }
                log.info("Using uploaded cover art ({} bytes)", metadata.coverArt().length);
                return Optional.of(new ResolvedCover(metadata.coverArt(), extension, contentType(extension), "upload"));
            }

            if (fingerprint.hasArtwork()) {
                String extension = detectExtension(fingerprint.artwork());
                log.info("Using embedded cover art ({} bytes)", fingerprint.artwork().length);
                return Optional.of(new ResolvedCover(fingerprint.artwork(), extension, contentType(extension), "embedded"));
            }

            Optional<byte[]> generated = coverArtGenerator.generate(
                    metadata.title(), metadata.artistName(), metadata.genre() != null ? metadata.genre() : fingerprint.genre());
            if (generated.isPresent() && isValidImageData(generated.get())) {
                String extension = detectExtension(generated.get());
                log.info("Using generated cover art ({} bytes)", generated.get().length);
                return Optional.of(new ResolvedCover(generated.get(), extension, contentType(extension), "generated"));
            }
        } catch (Exception ex) {
            log.warn("Cover art resolution failed, continuing without cover: {}", ex.getMessage());
            log.debug("Cover art error details", ex);
        }
        return Optional.empty();
    }

    static boolean isValidImageData(byte[] data) {
        if (data == null || data.length < 4) {
            return false;
        }
        return isJpeg(data) || isPng(data);
    }

    private static String detectExtension(byte[] data) {
        return data != null && data.length >= 4 && isPng(data) ? "png" : "jpg";
    }

    // JPEG: FF D8 FF
    private static boolean isJpeg(byte[] data) {
        return data[0] == (byte) 0xFF && data[1] == (byte) 0xD8 && data[2] == (byte) 0xFF;
    }

    // PNG: 89 50 4E 47
    private static boolean isPng(byte[] data) {
        return data[0] == (byte) 0x89 && data[1] == (byte) 0x50 && data[2] == (byte) 0x4E && data[3] == (byte) 0x47;
    }

    private static String contentType(String extension) {
        return switch (extension) {
            case "png" -> "image/png";
            case "webp" -> "image/webp";
            case "gif" -> "image/gif";
            default -> "image/jpeg";
        };
    }
}
