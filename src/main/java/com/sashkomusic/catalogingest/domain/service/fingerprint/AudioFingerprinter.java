package com.sashkomusic.catalogingest.domain.service.fingerprint;

import com.sashkomusic.catalogingest.domain.model.AudioFingerprint;
import com.sashkomusic.catalogingest.domain.service.utils.FileNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class AudioFingerprinter {

    private static final Pattern ARTIST_TITLE_SEPARATOR = Pattern.compile("\\s*[-\u2013|\u2022]\\s*");
    private static final Pattern YEAR = Pattern.compile("(\\d{4})");

    private final AudioTagReader tagReader;

    public AudioFingerprint fingerprint(byte[] content, String declaredName) {
        String hash = sha256(content);
        AudioTags tags = tagReader.read(content, declaredName);

        String title = tags.get(TagField.TITLE);
        String artist = tags.get(TagField.ARTIST);

        if (title == null || artist == null) {
            String stem = FileNames.stem(declaredName).trim();
            String[] split = splitArtistTitle(stem);
            if (artist == null && split != null) {
                artist = split[0];
                if (title == null) {
                    title = split[1];
                }
            }
            if (title == null && !stem.isEmpty()) {
                title = stem;
            }
        }

        AudioFingerprint fingerprint = new AudioFingerprint(
                hash,
                title,
                artist,
                tags.get(TagField.ALBUM),
                tags.get(TagField.GENRE),
                parseYear(tags.get(TagField.YEAR)),
                tags.durationSeconds(),
                tags.bitrateKbps(),
                content.length,
                tags.artwork()
        );

        log.debug("Fingerprint for {}: hash={}, title='{}', artist='{}', duration={}s",
                declaredName, hash, fingerprint.title(), fingerprint.artist(), fingerprint.durationSeconds());
        return fingerprint;
    }

    /**
     * Splits "Artist - Title" style stems on the first separator.
     *
     * @return {artist, title}, or null when there is no separator or the artist part is empty
     */
    String[] splitArtistTitle(String stem) {
        Matcher matcher = ARTIST_TITLE_SEPARATOR.matcher(stem);
        if (!matcher.find()) {
            return null;
        }
        String left = stem.substring(0, matcher.start()).trim();
        String right = stem.substring(matcher.end()).trim();
        if (left.isEmpty()) {
            return null;
        }
        return new String[]{left, right.isEmpty() ? stem : right};
    }

    private Integer parseYear(String value) {
        if (value == null) {
            return null;
        }
        Matcher matcher = YEAR.matcher(value);
        if (matcher.find()) {
            return Integer.parseInt(matcher.group(1));
        }
        return null;
    }

    static String sha256(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
