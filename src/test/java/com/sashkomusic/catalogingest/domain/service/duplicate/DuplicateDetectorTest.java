package com.sashkomusic.catalogingest.domain.service.duplicate;

import com.sashkomusic.catalogingest.domain.entity.Artist;
import com.sashkomusic.catalogingest.domain.entity.Track;
import com.sashkomusic.catalogingest.domain.model.AudioFingerprint;
import com.sashkomusic.catalogingest.domain.model.DuplicateMatch;
import com.sashkomusic.catalogingest.domain.model.MatchType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DuplicateDetectorTest {

    private static final long TEN_MB = 10L * 1024 * 1024;

    private final DuplicateDetector detector = new DuplicateDetector();

    @Test
    void emptyCatalogNeverMatches() {
        assertTrue(detector.findDuplicate(fingerprint("h1", "Song", "Artist", "Album", 200, TEN_MB), List.of()).isEmpty());
    }

    @Test
    void identicalHashIsExactMatchRegardlessOfMetadata() {
        Track existing = track(7L, "dd", "Completely", "Different", "Thing", 10, 1.0);

        Optional<DuplicateMatch> match = detector.findDuplicate(
                fingerprint("DD", "Song", "Artist", "Album", 200, TEN_MB), List.of(existing));

        assertTrue(match.isPresent());
        assertEquals(7L, match.get().matchedTrackId());
        assertEquals(MatchType.EXACT_CONTENT, match.get().matchType());
        assertEquals(1.0, match.get().confidence());
    }

    @Test
    void scoreExactlyAtThresholdMatches() {
        Track existing = track(1L, "other", "Night Drive", "abc", "Neon", 240, 10.0);

        Optional<DuplicateMatch> match = detector.findDuplicate(
                fingerprint("hash", "Night Drive", "xyz", "Neon", 240, TEN_MB), List.of(existing));

        assertTrue(match.isPresent());
        assertEquals(0.70, match.get().confidence(), 1e-9);
        assertEquals(MatchType.METADATA_SIMILARITY, match.get().matchType());
    }

    @Test
    void scoreJustBelowThresholdDoesNotMatch() {
        Track existing = track(1L, "other", "Night Drive", "abc", "Neon", 240, 9.98);
        AudioFingerprint fingerprint = fingerprint("hash", "Night Drive", "xyz", "Neon", 240, TEN_MB);

        assertEquals(0.699, detector.score(fingerprint, existing, new ArrayList<>()), 1e-9);
        assertTrue(detector.findDuplicate(fingerprint, List.of(existing)).isEmpty());
    }

    @Test
    void nearDuplicateIsReportedAsMetadataMatch() {
        // re-tagged copy: album tag dropped, file 2% smaller
        Track existing = track(42L, "other", "Ithemba", "Calvin Fallo", "Amapiano Sessions", 372, 10.0);
        AudioFingerprint fingerprint = fingerprint("new", "Ithemba", "Calvin Fallo", null, 372,
                (long) (TEN_MB * 0.98));

        Optional<DuplicateMatch> match = detector.findDuplicate(fingerprint, List.of(existing));

        assertTrue(match.isPresent());
        assertEquals(42L, match.get().matchedTrackId());
        assertEquals("metadata", match.get().matchType().wireName());
        assertEquals(0.85, match.get().confidence(), 0.05);
        assertEquals(0.89, match.get().confidence(), 1e-9);
        assertFalse(match.get().reasons().isEmpty());
    }

    @Test
    void bestScoringCandidateWins() {
        Track weak = track(1L, "a", "Ithemba", "Calvin Fallo", null, null, null);
        Track strong = track(2L, "b", "Ithemba", "Calvin Fallo", "Amapiano Sessions", 372, 10.0);

        Optional<DuplicateMatch> match = detector.findDuplicate(
                fingerprint("new", "Ithemba", "Calvin Fallo", "Amapiano Sessions", 372, TEN_MB), List.of(weak, strong));

        assertTrue(match.isPresent());
        assertEquals(2L, match.get().matchedTrackId());
    }

    @Test
    void missingFieldsContributeNothing() {
        Track existing = track(1L, "x", "Ithemba", "Calvin Fallo", null, null, null);

        double score = detector.score(fingerprint("y", "Ithemba", "Calvin Fallo", null, null, TEN_MB),
                existing, new ArrayList<>());

        assertEquals(0.70, score, 1e-9);
    }

    @Test
    void durationSimilarityDecaysOverFiveSeconds() {
        assertEquals(1.0, detector.durationSimilarity(200, 200));
        assertEquals(0.6, detector.durationSimilarity(200, 202), 1e-9);
        assertEquals(0.0, detector.durationSimilarity(200, 206));
        assertEquals(0.0, detector.durationSimilarity(null, 200));
    }

    @Test
    void sizeSimilarityDecaysOverTenPercent() {
        assertEquals(1.0, detector.sizeSimilarity(10.0, 10.0));
        assertEquals(0.5, detector.sizeSimilarity(10.0, 9.5), 1e-9);
        assertEquals(0.0, detector.sizeSimilarity(10.0, 8.0));
        assertEquals(0.0, detector.sizeSimilarity(10.0, null));
    }

    @Test
    void textSimilarityIgnoresCaseAndPunctuation() {
        assertEquals(1.0, detector.textSimilarity("Ithemba!", "ithemba"));
        assertEquals(0.0, detector.textSimilarity("", "ithemba"));
    }

    private AudioFingerprint fingerprint(String hash, String title, String artist, String album,
                                         Integer duration, long sizeBytes) {
        return new AudioFingerprint(hash, title, artist, album, null, null, duration, null, sizeBytes, null);
    }

    private Track track(Long id, String hash, String title, String artist, String album,
                        Integer duration, Double sizeMb) {
        Track track = new Track(title, new Artist(artist));
        track.setId(id);
        track.setContentHash(hash);
        track.setAlbum(album);
        track.setDurationSeconds(duration);
        track.setFileSizeMb(sizeMb);
        return track;
    }
}
