package com.sashkomusic.catalogingest.domain.service;

import com.sashkomusic.catalogingest.domain.entity.Artist;
import com.sashkomusic.catalogingest.domain.entity.Track;
import com.sashkomusic.catalogingest.domain.exception.CatalogPersistenceException;
import com.sashkomusic.catalogingest.domain.exception.StoredLocationConflictException;
import com.sashkomusic.catalogingest.domain.repository.ArtistRepository;
import com.sashkomusic.catalogingest.domain.repository.TrackRepository;
import org.hibernate.exception.ConstraintViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

import java.sql.SQLException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CatalogServiceTest {

    private TrackRepository trackRepository;
    private ArtistRepository artistRepository;
    private CatalogService catalogService;

    @BeforeEach
    void setUp() {
        trackRepository = mock(TrackRepository.class);
        artistRepository = mock(ArtistRepository.class);
        catalogService = new CatalogService(trackRepository, artistRepository);
    }

    @Test
    void existingArtistIsReused() {
        Artist artist = new Artist("Calvin Fallo");
        when(artistRepository.findByName("Calvin Fallo")).thenReturn(Optional.of(artist));

        assertSame(artist, catalogService.findOrCreateArtist("Calvin Fallo"));
        verify(artistRepository, never()).save(any());
    }

    @Test
    void missingArtistIsCreated() {
        when(artistRepository.findByName("Calvin Fallo")).thenReturn(Optional.empty());
        when(artistRepository.save(any(Artist.class))).thenAnswer(invocation -> invocation.getArgument(0));

        assertEquals("Calvin Fallo", catalogService.findOrCreateArtist("Calvin Fallo").getName());
    }

    @Test
    void storedLocationViolationBecomesConflict() {
        Track track = track("uploads/audio/a.mp3");
        ConstraintViolationException cause = new ConstraintViolationException(
                "duplicate key", new SQLException("duplicate key"), Track.STORED_LOCATION_CONSTRAINT);
        when(trackRepository.saveAndFlush(track)).thenThrow(new DataIntegrityViolationException("insert failed", cause));

        StoredLocationConflictException error = assertThrows(StoredLocationConflictException.class,
                () -> catalogService.saveTrack(track));
        assertEquals("uploads/audio/a.mp3", error.getStoredLocation());
    }

    @Test
    void otherIntegrityViolationIsPersistenceError() {
        Track track = track("uploads/audio/a.mp3");
        ConstraintViolationException cause = new ConstraintViolationException(
                "null value", new SQLException("null value in column title"), "tracks_title_not_null");
        when(trackRepository.saveAndFlush(track)).thenThrow(new DataIntegrityViolationException("insert failed", cause));

        CatalogPersistenceException error = assertThrows(CatalogPersistenceException.class,
                () -> catalogService.saveTrack(track));
        assertFalse(error instanceof StoredLocationConflictException);
    }

    @Test
    void dataAccessFailureIsPersistenceError() {
        Track track = track("uploads/audio/a.mp3");
        when(trackRepository.saveAndFlush(track)).thenThrow(new DataAccessResourceFailureException("connection lost"));

        assertThrows(CatalogPersistenceException.class, () -> catalogService.saveTrack(track));
    }

    @Test
    void violationIsDetectedFromMessageWhenConstraintNameIsMissing() {
        assertTrue(CatalogService.isStoredLocationViolation(new RuntimeException(
                "ERROR: duplicate key value violates unique constraint \"uk_tracks_stored_location\"")));
        assertFalse(CatalogService.isStoredLocationViolation(new RuntimeException("deadlock detected")));
    }

    private Track track(String location) {
        Track track = new Track("Ithemba", new Artist("Calvin Fallo"));
        track.setStoredLocation(location);
        return track;
    }
}
