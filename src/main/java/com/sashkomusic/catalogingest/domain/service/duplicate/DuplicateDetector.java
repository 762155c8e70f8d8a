package com.sashkomusic.catalogingest.domain.service.duplicate;

import com.sashkomusic.catalogingest.domain.entity.Track;
import com.sashkomusic.catalogingest.domain.model.AudioFingerprint;
import com.sashkomusic.catalogingest.domain.model.DuplicateMatch;
import com.sashkomusic.catalogingest.domain.model.MatchType;
import com.sashkomusic.catalogingest.domain.service.utils.StringSimilarity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a submission duplicates an existing catalog entry.
 *
 * <p>
 * Identical content hashes win outright. Otherwise every candidate gets a weighted metadata score;
 * fields missing on either side contribute nothing, the weights are not renormalized.
 */
@Slf4j
@Service
public class DuplicateDetector {

    static final double TITLE_WEIGHT = 0.40;
    static final double ARTIST_WEIGHT = 0.30;
    static final double DURATION_WEIGHT = 0.15;
    static final double ALBUM_WEIGHT = 0.10;
    static final double SIZE_WEIGHT = 0.05;

    static final double MATCH_THRESHOLD = 0.70;
    static final double DURATION_WINDOW_SECONDS = 5.0;
    static final double SIZE_WINDOW_RATIO = 0.10;

    public Optional<DuplicateMatch> findDuplicate(AudioFingerprint fingerprint, List<Track> catalogSnapshot) {
        if (fingerprint == null || catalogSnapshot == null || catalogSnapshot.isEmpty()) {
            return Optional.empty();
        }

        if (fingerprint.contentHash() != null) {
            for (Track track : catalogSnapshot) {
                if (fingerprint.contentHash().equalsIgnoreCase(track.getContentHash())) {
                    log.info("Exact content match with track {} ('{}')", track.getId(), track.getTitle());
                    return Optional.of(DuplicateMatch.exact(track.getId()));
                }
            }
        }

        DuplicateMatch best = null;
        double bestScore = 0.0;
        for (Track track : catalogSnapshot) {
            List<String> reasons = new ArrayList<>();
            double score = score(fingerprint, track, reasons);
            if (score > bestScore && score >= MATCH_THRESHOLD) {
                bestScore = score;
                best = new DuplicateMatch(track.getId(), MatchType.METADATA_SIMILARITY, score, List.copyOf(reasons));
            }
        }

        if (best != null) {
            log.info("Metadata similarity match with track {} (confidence {})", best.matchedTrackId(), best.confidence());
        }
        return Optional.ofNullable(best);
    }

    double score(AudioFingerprint fingerprint, Track track, List<String> reasons) {
        double title = textSimilarity(fingerprint.title(), track.getTitle());
        double artist = textSimilarity(fingerprint.artist(), track.getArtistName());
        double album = textSimilarity(fingerprint.album(), track.getAlbum());
        double duration = durationSimilarity(fingerprint.durationSeconds(), track.getDurationSeconds());
        double size = sizeSimilarity(fingerprint.sizeMb(), track.getFileSizeMb());

        addReason(reasons, "title", title);
        addReason(reasons, "artist", artist);
        addReason(reasons, "duration", duration);
        addReason(reasons, "album", album);
        addReason(reasons, "size", size);

        double weighted = TITLE_WEIGHT * title
                + ARTIST_WEIGHT * artist
                + DURATION_WEIGHT * duration
                + ALBUM_WEIGHT * album
                + SIZE_WEIGHT * size;
        return round(weighted);
    }

    double textSimilarity(String left, String right) {
        String a = StringSimilarity.normalize(left);
        String b = StringSimilarity.normalize(right);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        return StringSimilarity.ratio(a, b);
    }

    double durationSimilarity(Integer left, Integer right) {
        if (left == null || right == null || left <= 0 || right <= 0) {
            return 0.0;
        }
        double delta = Math.abs(left - right);
        return clamp(1.0 - delta / DURATION_WINDOW_SECONDS);
    }

    double sizeSimilarity(double left, Double right) {
        if (right == null || left <= 0 || right <= 0) {
            return 0.0;
        }
        double relative = Math.abs(left - right) / Math.max(left, right);
        return clamp(1.0 - relative / SIZE_WINDOW_RATIO);
    }

    private void addReason(List<String> reasons, String field, double similarity) {
        if (similarity > 0) {
            reasons.add(String.format("%s similarity %.2f", field, similarity));
        }
    }

    private double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    // four decimals keep the threshold comparison stable against floating point noise
    private double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
