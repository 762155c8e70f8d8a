package com.sashkomusic.catalogingest.domain.service.validation;

import com.sashkomusic.catalogingest.config.CatalogConfig;
import com.sashkomusic.catalogingest.domain.model.ValidationErrorCode;
import com.sashkomusic.catalogingest.domain.model.ValidationMode;
import com.sashkomusic.catalogingest.domain.model.ValidationResult;
import com.sashkomusic.catalogingest.domain.service.utils.FileNames;
import com.sashkomusic.catalogingest.domain.service.utils.TempAudioFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.AudioHeader;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class AudioFileValidator {

    private final CatalogConfig catalogConfig;
    private final AudioHeaderProbe headerProbe;

    public ValidationResult validate(byte[] content, String declaredName, ValidationMode mode) {
        if (content == null || content.length == 0) {
            log.warn("Rejected empty upload: {}", declaredName);
            return ValidationResult.invalid("File is empty", ValidationErrorCode.EMPTY_FILE);
        }

        long maxBytes = catalogConfig.getUpload().getMaxFileSize().toBytes();
        if (content.length > maxBytes) {
            log.warn("Rejected oversized upload {}: {} bytes (max {})", declaredName, content.length, maxBytes);
            return ValidationResult.invalid(
                    String.format("File too large: %d bytes exceeds the %d byte limit", content.length, maxBytes),
                    ValidationErrorCode.FILE_TOO_LARGE);
        }

        String extension = FileNames.extension(declaredName);
        Optional<SupportedAudioType> type = SupportedAudioType.fromExtension(extension);
        if (type.isEmpty()) {
            log.warn("Rejected unsupported file type '{}' for {}", extension, declaredName);
            return ValidationResult.invalid("Unsupported file type: ." + extension,
                    ValidationErrorCode.UNSUPPORTED_TYPE);
        }

        String mimeType = type.get().mimeType();
        if (mode == ValidationMode.LIGHTWEIGHT) {
            return ValidationResult.valid(mimeType, extension, content.length);
        }

        if (headerProbe.looksValid(content, type.get())) {
            log.debug("In-memory header probe accepted {}", declaredName);
            return ValidationResult.valid(mimeType, extension, content.length);
        }

        log.debug("In-memory probe inconclusive for {}, parsing from temp file", declaredName);
        return parseFromDisk(content, declaredName, extension, mimeType);
    }

    private ValidationResult parseFromDisk(byte[] content, String declaredName, String extension, String mimeType) {
        try (TempAudioFile temp = TempAudioFile.of(content, extension)) {
            AudioFile audio = AudioFileIO.read(temp.file());
            AudioHeader header = audio.getAudioHeader();
            if (header == null) {
                return corrupted(declaredName, "no audio header");
            }
            Integer duration = header.getTrackLength();
            Integer bitrate = (int) header.getBitRateAsNumber();
            log.debug("Parsed {} from disk: duration={}s bitrate={}kbps", declaredName, duration, bitrate);
            return ValidationResult.valid(mimeType, extension, content.length, duration, bitrate);
        } catch (Exception e) {
            return corrupted(declaredName, e.getMessage());
        }
    }

    private ValidationResult corrupted(String declaredName, String detail) {
        log.warn("Rejected invalid or corrupted audio {}: {}", declaredName, detail);
        return ValidationResult.invalid("Invalid or corrupted audio file", ValidationErrorCode.INVALID_OR_CORRUPTED);
    }
}
