package com.sashkomusic.catalogingest.domain.service;

import com.sashkomusic.catalogingest.domain.entity.Artist;
import com.sashkomusic.catalogingest.domain.entity.Track;
import com.sashkomusic.catalogingest.domain.exception.CatalogPersistenceException;
import com.sashkomusic.catalogingest.domain.exception.StoredLocationConflictException;
import com.sashkomusic.catalogingest.domain.repository.ArtistRepository;
import com.sashkomusic.catalogingest.domain.repository.TrackRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;

@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogService {

    private final TrackRepository trackRepository;
    private final ArtistRepository artistRepository;

    @Transactional(readOnly = true)
    public List<Track> snapshot() {
        return trackRepository.findAllWithArtist();
    }

    @Transactional
    public Artist findOrCreateArtist(String name) {
        try {
            return artistRepository.findByName(name)
                    .orElseGet(() -> {
                        log.info("Creating artist '{}'", name);
                        return artistRepository.save(new Artist(name));
                    });
        } catch (DataAccessException e) {
            throw new CatalogPersistenceException("Failed to resolve artist " + name, e);
        }
    }

    /**
     * Inserts the track and flushes, so constraint violations surface here rather than at commit.
     *
     * @throws StoredLocationConflictException when another track already owns the stored location
     * @throws CatalogPersistenceException on any other persistence failure
     */
    @Transactional
    public Track saveTrack(Track track) {
        try {
            Track saved = trackRepository.saveAndFlush(track);
            log.info("Saved track with ID: {}", saved.getId());
            return saved;
        } catch (DataIntegrityViolationException e) {
            if (isStoredLocationViolation(e)) {
                log.warn("Stored location already taken: {}", track.getStoredLocation());
                throw new StoredLocationConflictException(track.getStoredLocation(), e);
            }
            throw new CatalogPersistenceException("Failed to save track " + track.getTitle(), e);
        } catch (DataAccessException e) {
            throw new CatalogPersistenceException("Failed to save track " + track.getTitle(), e);
        }
    }

    static boolean isStoredLocationViolation(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof ConstraintViolationException) {
                String constraint = ((ConstraintViolationException) current).getConstraintName();
                if (constraint != null && constraint.toLowerCase(Locale.ROOT).contains("stored_location")) {
                    return true;
                }
            }
            String message = current.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains("stored_location")) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }
}
