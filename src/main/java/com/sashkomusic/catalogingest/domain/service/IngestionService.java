package com.sashkomusic.catalogingest.domain.service;

import com.sashkomusic.catalogingest.domain.entity.Artist;
import com.sashkomusic.catalogingest.domain.entity.Track;
import com.sashkomusic.catalogingest.domain.exception.CatalogPersistenceException;
import com.sashkomusic.catalogingest.domain.exception.InvalidAudioException;
import com.sashkomusic.catalogingest.domain.exception.StorageUnavailableException;
import com.sashkomusic.catalogingest.domain.exception.StoredLocationConflictException;
import com.sashkomusic.catalogingest.domain.model.AudioFingerprint;
import com.sashkomusic.catalogingest.domain.model.DeclaredMetadata;
import com.sashkomusic.catalogingest.domain.model.DuplicateMatch;
import com.sashkomusic.catalogingest.domain.model.IngestionError;
import com.sashkomusic.catalogingest.domain.model.IngestionResult;
import com.sashkomusic.catalogingest.domain.model.IngestionState;
import com.sashkomusic.catalogingest.domain.model.MetadataPreview;
import com.sashkomusic.catalogingest.domain.model.ResolvedCover;
import com.sashkomusic.catalogingest.domain.model.StorageOutcome;
import com.sashkomusic.catalogingest.domain.model.SubmittedAsset;
import com.sashkomusic.catalogingest.domain.model.ValidationMode;
import com.sashkomusic.catalogingest.domain.model.ValidationResult;
import com.sashkomusic.catalogingest.domain.service.duplicate.DuplicateDetector;
import com.sashkomusic.catalogingest.domain.service.fingerprint.AudioFingerprinter;
import com.sashkomusic.catalogingest.domain.service.storage.LocalPathResolver;
import com.sashkomusic.catalogingest.domain.service.storage.StorageKeyBuilder;
import com.sashkomusic.catalogingest.domain.service.storage.TieredStorageWriter;
import com.sashkomusic.catalogingest.domain.service.validation.AudioFileValidator;
import com.sashkomusic.catalogingest.messaging.producer.TrackIngestedProducer;
import com.sashkomusic.catalogingest.messaging.producer.dto.TrackIngestedDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * Runs one upload through validation, fingerprinting, duplicate detection, storage and persistence.
 *
 * <p>
 * Validation and duplicate failures happen before any write. Once a blob has been written, every
 * failure path removes it again before the error is returned, except remote objects that the
 * winner of a stored location race also references.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {

    static final String UNKNOWN_ARTIST = "Unknown Artist";

    private final AudioFileValidator validator;
    private final AudioFingerprinter fingerprinter;
    private final DuplicateDetector duplicateDetector;
    private final CatalogService catalogService;
    private final CoverArtService coverArtService;
    private final TieredStorageWriter storageWriter;
    private final StorageKeyBuilder keyBuilder;
    private final TrackIngestedProducer trackIngestedProducer;

    public IngestionResult ingest(SubmittedAsset asset, DeclaredMetadata metadata, boolean skipDuplicateCheck) {
        String filename = asset.declaredFilename();
        log.info("Ingesting upload {} ({} bytes)", filename, asset.sizeBytes());

        step(IngestionState.VALIDATING, filename);
        ValidationResult validation = validator.validate(asset.content(), filename, ValidationMode.FULL);
        if (!validation.isValid()) {
            return fail(IngestionError.invalidInput(validation));
        }

        step(IngestionState.FINGERPRINTING, filename);
        AudioFingerprint fingerprint = fingerprinter.fingerprint(asset.content(), filename)
                .withDeclared(metadata.title(), metadata.artistName(), metadata.album());

        if (skipDuplicateCheck) {
            log.info("Duplicate check skipped for {}", filename);
        } else {
            step(IngestionState.DUPLICATE_CHECKING, filename);
            Optional<DuplicateMatch> match = duplicateDetector.findDuplicate(fingerprint, catalogService.snapshot());
            if (match.isPresent()) {
                return fail(IngestionError.duplicate(match.get()));
            }
        }

        step(IngestionState.METADATA_RESOLVING, filename);
        String artistName = isBlank(fingerprint.artist()) ? UNKNOWN_ARTIST : fingerprint.artist();
        Artist artist;
        try {
            artist = catalogService.findOrCreateArtist(artistName);
        } catch (CatalogPersistenceException e) {
            log.error("Failed to resolve artist '{}': {}", artistName, e.getMessage(), e);
            return fail(IngestionError.persistence("Failed to resolve artist"));
        }
        Optional<ResolvedCover> cover = coverArtService.resolve(metadata, fingerprint);

        step(IngestionState.STORAGE_WRITING, filename);
        List<String> written = new ArrayList<>();
        String audioKey = keyBuilder.audioKey(artistName, fingerprint.title(), validation.getExtension(), skipDuplicateCheck);
        StorageOutcome audioOutcome;
        try {
            audioOutcome = storageWriter.write(audioKey, asset.content(), validation.getMimeType());
            written.add(audioOutcome.location());
        } catch (StorageUnavailableException e) {
            log.error("No storage tier accepted {}: {}", audioKey, e.getMessage());
            return fail(IngestionError.storageUnavailable(e.getMessage()));
        }

        String coverLocation = null;
        if (cover.isPresent()) {
            String coverKey = keyBuilder.coverKey(audioKey, cover.get().extension());
            try {
                coverLocation = storageWriter.write(coverKey, cover.get().content(), cover.get().contentType()).location();
                written.add(coverLocation);
            } catch (StorageUnavailableException e) {
                log.warn("Cover art not stored for {}: {}", audioKey, e.getMessage());
            }
        }

        step(IngestionState.PERSISTING, filename);
        Track track = buildTrack(fingerprint, validation, metadata, artist, asset, audioOutcome, coverLocation);
        Track saved;
        try {
            saved = catalogService.saveTrack(track);
        } catch (StoredLocationConflictException e) {
            log.warn("Lost the race for {}, removing written local blobs", e.getStoredLocation());
            compensate(ownedAfterConflict(written));
            return fail(IngestionError.storedLocationTaken());
        } catch (CatalogPersistenceException e) {
            log.error("Failed to persist track {}: {}", track.getTitle(), e.getMessage(), e);
            compensate(written);
            return fail(IngestionError.persistence("Failed to save track to the catalog"));
        }

        log.info("Committed track {} '{}' by '{}' on {} tier", saved.getId(), saved.getTitle(), artistName,
                audioOutcome.tier());
        trackIngestedProducer.send(TrackIngestedDto.of(saved, audioOutcome));
        return IngestionResult.committed(saved, audioOutcome);
    }

    /**
     * Extracts what the catalog would learn from the file without storing anything.
     *
     * @throws InvalidAudioException when the file fails lightweight validation
     */
    public MetadataPreview previewMetadata(byte[] content, String filename) {
        ValidationResult validation = validator.validate(content, filename, ValidationMode.LIGHTWEIGHT);
        if (!validation.isValid()) {
            throw new InvalidAudioException(validation);
        }

        AudioFingerprint fingerprint = fingerprinter.fingerprint(content, filename);
        String coverArt = fingerprint.hasArtwork()
                ? Base64.getEncoder().encodeToString(fingerprint.artwork())
                : null;

        return new MetadataPreview(
                fingerprint.title(),
                fingerprint.artist(),
                fingerprint.album(),
                fingerprint.year(),
                fingerprint.genre(),
                fingerprint.durationSeconds() != null ? fingerprint.durationSeconds() : 0,
                fingerprint.bitrateKbps() != null ? fingerprint.bitrateKbps() : 0,
                roundMb(fingerprint.sizeMb()),
                coverArt);
    }

    private Track buildTrack(AudioFingerprint fingerprint, ValidationResult validation, DeclaredMetadata metadata,
                             Artist artist, SubmittedAsset asset, StorageOutcome audioOutcome, String coverLocation) {
        Track track = new Track(fingerprint.title(), artist);
        track.setAlbum(fingerprint.album());
        track.setGenre(!isBlank(metadata.genre()) ? metadata.genre() : fingerprint.genre());
        track.setYear(metadata.year() != null ? metadata.year() : fingerprint.year());
        track.setDescription(metadata.description());
        track.setTags(metadata.tags());
        track.setOriginalFilename(asset.declaredFilename());
        track.setDurationSeconds(fingerprint.durationSeconds() != null
                ? fingerprint.durationSeconds() : validation.getDurationSeconds());
        track.setQualityKbps(fingerprint.bitrateKbps() != null
                ? fingerprint.bitrateKbps() : validation.getBitrateKbps());
        track.setFileSizeMb(roundMb(fingerprint.sizeMb()));
        track.setContentHash(fingerprint.contentHash());
        track.setStoredLocation(audioOutcome.location());
        track.setStorageTier(audioOutcome.tier());
        track.setCoverArtLocation(coverLocation);
        return track;
    }

    /**
     * Remote keys derive from artist and title only, so a concurrent upload that won the
     * stored location wrote the same objects. Only local files, which never share a name,
     * belong to this upload alone.
     */
    private List<String> ownedAfterConflict(List<String> written) {
        List<String> owned = new ArrayList<>();
        for (String location : written) {
            if (LocalPathResolver.isRemoteUrl(location)) {
                log.info("Keeping {}, it is shared with the committed track", location);
            } else {
                owned.add(location);
            }
        }
        return owned;
    }

    private void compensate(List<String> locations) {
        for (String location : locations) {
            try {
                if (!storageWriter.delete(location)) {
                    log.warn("Compensating delete did not remove {}", location);
                }
            } catch (Exception e) {
                log.error("Compensating delete failed for {}: {}", location, e.getMessage(), e);
            }
        }
    }

    private IngestionResult fail(IngestionError error) {
        log.warn("Ingestion failed at {}: {} ({})", error.failedAt(), error.code(), error.message());
        return IngestionResult.failed(error);
    }

    private void step(IngestionState state, String filename) {
        log.debug("[{}] {}", state, filename);
    }

    private static double roundMb(double mb) {
        return Math.round(mb * 100.0) / 100.0;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
