package com.sashkomusic.catalogingest.domain.service.fingerprint;

import com.sashkomusic.catalogingest.domain.service.utils.FileNames;
import com.sashkomusic.catalogingest.domain.service.utils.TempAudioFile;
import lombok.extern.slf4j.Slf4j;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.AudioHeader;
import org.jaudiotagger.tag.Tag;
import org.jaudiotagger.tag.images.Artwork;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

@Slf4j
@Component
public class AudioTagReader {

    public AudioTags read(byte[] content, String declaredName) {
        try (TempAudioFile temp = TempAudioFile.of(content, FileNames.extension(declaredName))) {
            AudioFile audio = AudioFileIO.read(temp.file());

            Integer duration = null;
            Integer bitrate = null;
            AudioHeader header = audio.getAudioHeader();
            if (header != null) {
                duration = header.getTrackLength();
                bitrate = (int) header.getBitRateAsNumber();
            }

            Tag tag = audio.getTag();
            if (tag == null) {
                log.debug("No tags found in upload: {}", declaredName);
                return new AudioTags(Map.of(), duration, bitrate, null);
            }

            Map<TagField, String> values = new EnumMap<>(TagField.class);
            for (TagField field : TagField.values()) {
                String value = firstPresent(tag, field);
                if (value != null) {
                    values.put(field, value);
                }
            }

            log.debug("Extracted {} tags from: {}", values.size(), declaredName);
            return new AudioTags(values, duration, bitrate, readArtwork(tag));

        } catch (Exception e) {
            log.debug("Failed to read tags from {}: {}", declaredName, e.getMessage());
            return AudioTags.empty();
        }
    }

    String firstPresent(Tag tag, TagField field) {
        String value = readQuietly(tag, field);
        if (value != null) {
            return value;
        }
        for (String key : field.rawKeys()) {
            value = readQuietly(tag, key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private String readQuietly(Tag tag, TagField field) {
        try {
            return nonEmpty(tag.getFirst(field.fieldKey()));
        } catch (Exception e) {
            log.trace("Failed to extract {}: {}", field, e.getMessage());
            return null;
        }
    }

    private String readQuietly(Tag tag, String key) {
        try {
            return nonEmpty(tag.getFirst(key));
        } catch (Exception e) {
            log.trace("Failed to extract {}: {}", key, e.getMessage());
            return null;
        }
    }

    private byte[] readArtwork(Tag tag) {
        try {
            Artwork artwork = tag.getFirstArtwork();
            if (artwork != null && artwork.getBinaryData() != null && artwork.getBinaryData().length > 0) {
                return artwork.getBinaryData();
            }
        } catch (Exception e) {
            log.trace("Failed to extract artwork: {}", e.getMessage());
        }
        return null;
    }

    private String nonEmpty(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
