package com.sashkomusic.catalogingest.domain.service.utils;

import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Copy of an in-memory payload on disk, for libraries that only read files.
 * The file is removed on {@link #close()}.
 */
@Slf4j
public final class TempAudioFile implements AutoCloseable {

    private final Path path;

    private TempAudioFile(Path path) {
        this.path = path;
    }

    public static TempAudioFile of(byte[] content, String extension) throws IOException {
        String suffix = extension == null || extension.isEmpty() ? ".tmp" : "." + extension;
        Path path = Files.createTempFile("catalog-ingest-", suffix);
        try {
            Files.write(path, content);
        } catch (IOException e) {
            Files.deleteIfExists(path);
            throw e;
        }
        return new TempAudioFile(path);
    }

    public Path path() {
        return path;
    }

    public File file() {
        return path.toFile();
    }

    @Override
    public void close() {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete temp file {}: {}", path, e.getMessage());
        }
    }
}
