package com.sashkomusic.catalogingest.domain.service.storage;

import com.sashkomusic.catalogingest.domain.exception.StorageUnavailableException;
import com.sashkomusic.catalogingest.domain.service.utils.FileNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Local filesystem tier. Never overwrites: an existing name gets a numeric suffix.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LocalFileStore {

    static final int MAX_NAME_ATTEMPTS = 1000;

    private final LocalPathResolver pathResolver;

    public Path write(String key, byte[] content) throws IOException {
        Path root = pathResolver.root().toAbsolutePath().normalize();
        Path target = root.resolve(key).normalize();
        if (!target.startsWith(root)) {
            throw new IllegalArgumentException("Path traversal blocked: " + key);
        }

        Path directory = target.getParent();
        Files.createDirectories(directory);

        String stem = FileNames.stem(target.getFileName().toString());
        String extension = FileNames.extension(target.getFileName().toString());
        String suffix = extension.isEmpty() ? "" : "." + extension;

        for (int attempt = 0; attempt < MAX_NAME_ATTEMPTS; attempt++) {
            String name = attempt == 0 ? stem + suffix : stem + "-" + attempt + suffix;
            Path candidate = directory.resolve(name);
            if (Files.exists(candidate)) {
                continue;
            }
            try {
                Files.write(candidate, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                Path stored = relativeToWorkingRoot(candidate, root);
                log.info("Stored {} bytes on local tier: {}", content.length, stored);
                return stored;
            } catch (FileAlreadyExistsException e) {
                log.debug("Name taken concurrently, trying next: {}", candidate);
            }
        }

        throw new StorageUnavailableException(
                "No free local file name for " + key + " after " + MAX_NAME_ATTEMPTS + " attempts");
    }

    public boolean delete(Path path) throws IOException {
        boolean deleted = Files.deleteIfExists(path);
        if (deleted) {
            log.info("Deleted local file: {}", path);
        }
        return deleted;
    }

    // keep locations in the configured form of the root (relative roots stay relative)
    private Path relativeToWorkingRoot(Path candidate, Path absoluteRoot) {
        Path configuredRoot = pathResolver.root();
        if (configuredRoot.isAbsolute()) {
            return candidate;
        }
        return configuredRoot.resolve(absoluteRoot.relativize(candidate));
    }
}
