package com.sashkomusic.catalogingest.domain.service.reconciliation;

import com.sashkomusic.catalogingest.domain.entity.Track;
import com.sashkomusic.catalogingest.domain.exception.ReconciliationException;
import com.sashkomusic.catalogingest.domain.exception.RemoteTrackDeletionException;
import com.sashkomusic.catalogingest.domain.exception.TrackNotFoundException;
import com.sashkomusic.catalogingest.domain.model.CleanupReport;
import com.sashkomusic.catalogingest.domain.model.LocalDeletionResult;
import com.sashkomusic.catalogingest.domain.model.OrphanedTrack;
import com.sashkomusic.catalogingest.domain.repository.TrackRepository;
import com.sashkomusic.catalogingest.domain.service.storage.LocalFileStore;
import com.sashkomusic.catalogingest.domain.service.storage.LocalPathResolver;
import com.sashkomusic.catalogingest.messaging.producer.OrphanCleanupResultProducer;
import com.sashkomusic.catalogingest.messaging.producer.dto.OrphanCleanupResultDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Keeps catalog rows and local files in step: finds tracks whose local file is gone and removes
 * them, in bulk or per deleted file.
 *
 * <p>
 * Remote tracks are never considered orphaned.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrphanReconciliationService {

    static final String TRIGGER_MANUAL = "manual";

    private final TrackRepository trackRepository;
    private final LocalPathResolver pathResolver;
    private final LocalFileStore localFileStore;
    private final OrphanCleanupResultProducer cleanupResultProducer;

    @Transactional(readOnly = true)
    public List<OrphanedTrack> findOrphaned() {
        List<OrphanedTrack> orphaned = trackRepository.findAllLocal().stream()
                .filter(track -> !isBlank(track.getStoredLocation()))
                .filter(track -> !LocalPathResolver.isRemoteUrl(track.getStoredLocation()))
                .filter(track -> pathResolver.resolve(track.getStoredLocation()).isEmpty())
                .map(track -> OrphanedTrack.of(track, triedPaths(track.getStoredLocation())))
                .toList();

        log.info("Found {} orphaned track(s)", orphaned.size());
        return orphaned;
    }

    @Transactional
    public CleanupReport cleanup(boolean dryRun) {
        return cleanup(dryRun, TRIGGER_MANUAL);
    }

    /**
     * Deletes every track found orphaned by this scan in one transaction. A dry run only reports.
     *
     * @throws ReconciliationException when the deletion fails; nothing is deleted in that case
     */
    @Transactional
    public CleanupReport cleanup(boolean dryRun, String trigger) {
        List<OrphanedTrack> orphaned = findOrphaned();
        List<Long> ids = orphaned.stream().map(OrphanedTrack::id).toList();

        if (ids.isEmpty()) {
            CleanupReport report = CleanupReport.empty(dryRun);
            publish(trigger, report);
            return report;
        }

        if (dryRun) {
            log.info("Dry run: would delete {} orphaned track(s): {}", ids.size(), ids);
        } else {
            try {
                trackRepository.deleteAllByIdInBatch(ids);
                trackRepository.flush();
            } catch (DataAccessException e) {
                log.error("Orphan cleanup failed, rolling back: {}", e.getMessage(), e);
                throw new ReconciliationException("Failed to delete orphaned tracks", e);
            }
            log.info("Deleted {} orphaned track(s): {}", ids.size(), ids);
        }

        CleanupReport report = new CleanupReport(ids.size(), dryRun, ids);
        publish(trigger, report);
        return report;
    }

    /**
     * Removes the tracks stored at a file that was just deleted from the upload root.
     *
     * <p>
     * A track whose location still resolves to an existing file is kept, even when one of its
     * fallback candidates names the deleted path.
     *
     * @return true when at least one track was removed
     */
    @Transactional
    public boolean onFileDeleted(Path deletedPath) {
        Path target = deletedPath.toAbsolutePath().normalize();
        List<Track> affected = trackRepository.findAllLocal().stream()
                .filter(track -> !isBlank(track.getStoredLocation()))
                .filter(track -> !LocalPathResolver.isRemoteUrl(track.getStoredLocation()))
                .filter(track -> pathResolver.candidates(track.getStoredLocation()).stream()
                        .map(candidate -> candidate.toAbsolutePath().normalize())
                        .anyMatch(target::equals))
                .filter(track -> pathResolver.resolve(track.getStoredLocation()).isEmpty())
                .toList();

        if (affected.isEmpty()) {
            log.debug("No catalog entry for deleted file {}", target);
            return false;
        }

        try {
            trackRepository.deleteAllInBatch(affected);
        } catch (DataAccessException e) {
            throw new ReconciliationException("Failed to remove tracks for deleted file " + target, e);
        }
        log.info("Removed {} track(s) for deleted file {}", affected.size(), target);
        return true;
    }

    /**
     * Deletes a local track's file if it is still there and its catalog row in any case.
     *
     * @throws TrackNotFoundException when no such track exists
     * @throws RemoteTrackDeletionException when the track lives on the remote tier
     */
    @Transactional
    public LocalDeletionResult deleteLocalFile(Long trackId) {
        Track track = trackRepository.findById(trackId)
                .orElseThrow(() -> new TrackNotFoundException(trackId));

        if (track.isRemote()) {
            throw new RemoteTrackDeletionException(trackId);
        }

        Optional<Path> resolved = isBlank(track.getStoredLocation())
                ? Optional.empty()
                : pathResolver.resolve(track.getStoredLocation());

        boolean fileDeleted = false;
        if (resolved.isPresent()) {
            try {
                fileDeleted = localFileStore.delete(resolved.get());
            } catch (IOException e) {
                log.error("Failed to delete local file {} for track {}: {}", resolved.get(), trackId, e.getMessage());
            }
        } else {
            log.info("Local file for track {} already absent: {}", trackId, track.getStoredLocation());
        }

        try {
            trackRepository.delete(track);
            trackRepository.flush();
        } catch (DataAccessException e) {
            throw new ReconciliationException("Failed to remove track " + trackId, e);
        }
        log.info("Removed track {} '{}' from the catalog", trackId, track.getTitle());

        return new LocalDeletionResult(trackId, track.getTitle(),
                resolved.map(Path::toString).orElse(null), fileDeleted, true);
    }

    private List<String> triedPaths(String storedLocation) {
        return pathResolver.candidates(storedLocation).stream()
                .map(Path::toString)
                .toList();
    }

    private void publish(String trigger, CleanupReport report) {
        cleanupResultProducer.send(new OrphanCleanupResultDto(trigger, report.dryRun(), report.count(), report.trackIds()));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
