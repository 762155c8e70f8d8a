package com.sashkomusic.catalogingest.domain.service.validation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Checks the container header of an in-memory payload without touching disk.
 * A negative answer means "not confirmed", not "corrupted".
 */
@Slf4j
@Component
public class AudioHeaderProbe {

    private static final byte[] ASF_HEADER_GUID = {
            0x30, 0x26, (byte) 0xB2, 0x75, (byte) 0x8E, 0x66, (byte) 0xCF, 0x11,
            (byte) 0xA6, (byte) 0xD9, 0x00, (byte) 0xAA, 0x00, 0x62, (byte) 0xCE, 0x6C
    };

    // kbps, MPEG-1 Layer III
    private static final int[] MPEG1_L3_BITRATES = {0, 32, 40, 48, 56, 64, 80, 96, 112, 128, 160, 192, 224, 256, 320, -1};
    // kbps, MPEG-2/2.5 Layer III
    private static final int[] MPEG2_L3_BITRATES = {0, 8, 16, 24, 32, 40, 48, 56, 64, 80, 96, 112, 128, 144, 160, -1};
    private static final int[][] SAMPLE_RATES = {
            {11025, 12000, 8000},  // MPEG 2.5
            {0, 0, 0},             // reserved
            {22050, 24000, 16000}, // MPEG 2
            {44100, 48000, 32000}  // MPEG 1
    };

    public boolean looksValid(byte[] content, SupportedAudioType type) {
        if (content == null || content.length < 12) {
            return false;
        }
        return switch (type) {
            case MP3 -> probeMpeg(content);
            case WAV -> ascii(content, 0, "RIFF") && ascii(content, 8, "WAVE");
            case AIFF -> ascii(content, 0, "FORM") && (ascii(content, 8, "AIFF") || ascii(content, 8, "AIFC"));
            case FLAC -> ascii(content, skipId3(content), "fLaC");
            case OGG -> ascii(content, 0, "OggS");
            case M4A -> ascii(content, 4, "ftyp");
            case WMA -> startsWith(content, 0, ASF_HEADER_GUID);
        };
    }

    private boolean probeMpeg(byte[] content) {
        int offset = skipId3(content);
        int frameLength = mpegFrameLength(content, offset);
        if (frameLength <= 0) {
            log.debug("No MPEG frame header at offset {}", offset);
            return false;
        }
        int next = offset + frameLength;
        if (next + 4 > content.length) {
            // single frame payload, nothing more to confirm against
            return true;
        }
        return mpegFrameLength(content, next) > 0;
    }

    /**
     * @return frame length in bytes, or -1 when no valid Layer III header starts at the offset
     */
    int mpegFrameLength(byte[] content, int offset) {
        if (offset < 0 || offset + 4 > content.length) {
            return -1;
        }
        int b1 = content[offset] & 0xFF;
        int b2 = content[offset + 1] & 0xFF;
        int b3 = content[offset + 2] & 0xFF;
        if (b1 != 0xFF || (b2 & 0xE0) != 0xE0) {
            return -1;
        }
        int version = (b2 >> 3) & 0x03;
        int layer = (b2 >> 1) & 0x03;
        int bitrateIndex = (b3 >> 4) & 0x0F;
        int sampleRateIndex = (b3 >> 2) & 0x03;
        int padding = (b3 >> 1) & 0x01;

        if (version == 1 || layer != 1 || sampleRateIndex == 3) {
            return -1;
        }
        int bitrate = version == 3 ? MPEG1_L3_BITRATES[bitrateIndex] : MPEG2_L3_BITRATES[bitrateIndex];
        if (bitrate <= 0) {
            return -1;
        }
        int sampleRate = SAMPLE_RATES[version][sampleRateIndex];
        int coefficient = version == 3 ? 144 : 72;
        return coefficient * bitrate * 1000 / sampleRate + padding;
    }

    private int skipId3(byte[] content) {
        if (!ascii(content, 0, "ID3") || content.length < 10) {
            return 0;
        }
        int size = ((content[6] & 0x7F) << 21)
                | ((content[7] & 0x7F) << 14)
                | ((content[8] & 0x7F) << 7)
                | (content[9] & 0x7F);
        boolean hasFooter = (content[5] & 0x10) != 0;
        return 10 + size + (hasFooter ? 10 : 0);
    }

    private boolean ascii(byte[] content, int offset, String expected) {
        return startsWith(content, offset, expected.getBytes(StandardCharsets.US_ASCII));
    }

    private boolean startsWith(byte[] content, int offset, byte[] expected) {
        if (offset < 0 || offset + expected.length > content.length) {
            return false;
        }
        for (int i = 0; i < expected.length; i++) {
            if (content[offset + i] != expected[i]) {
                return false;
            }
        }
        return true;
    }
}
