package com.sashkomusic.catalogingest.domain.service.storage;

import com.sashkomusic.catalogingest.config.CatalogConfig;
import com.sashkomusic.catalogingest.domain.service.utils.FileNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps a stored location onto the local upload root.
 *
 * <p>
 * Stored locations have been written as absolute or working-directory paths, as public URL
 * paths ({@code /uploads/...}) and as bare file names. Candidates are tried in that order:
 * verbatim, public prefix replaced by the root, basename under the root.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LocalPathResolver {

    private final CatalogConfig catalogConfig;

    public static boolean isRemoteUrl(String location) {
        String trimmed = location == null ? "" : location.trim();
        return trimmed.startsWith("http://") || trimmed.startsWith("https://");
    }

    public Path root() {
        return Paths.get(catalogConfig.getLocal().getRoot());
    }

    public List<Path> candidates(String storedLocation) {
        String raw = storedLocation == null ? "" : storedLocation.trim();
        String normalized = raw.replace('\\', '/');
        if (normalized.isEmpty()) {
            return List.of();
        }

        List<Path> candidates = new ArrayList<>();
        addCandidate(candidates, () -> Paths.get(raw));

        String publicPrefix = catalogConfig.getLocal().getPublicPrefix();
        String relative = stripPublicPrefix(normalized, publicPrefix);
        if (relative != null && !relative.isEmpty()) {
            addCandidate(candidates, () -> root().resolve(relative));
        }

        String basename = FileNames.basename(normalized);
        if (!basename.isEmpty()) {
            addCandidate(candidates, () -> root().resolve(basename));
        }
        return candidates;
    }

    public Optional<Path> resolve(String storedLocation) {
        for (Path candidate : candidates(storedLocation)) {
            if (Files.exists(candidate)) {
                return Optional.of(candidate.toAbsolutePath().normalize());
            }
        }
        return Optional.empty();
    }

    private String stripPublicPrefix(String normalized, String publicPrefix) {
        if (publicPrefix == null || publicPrefix.isBlank()) {
            return null;
        }
        String withSlash = publicPrefix.endsWith("/") ? publicPrefix : publicPrefix + "/";
        String withoutLeading = withSlash.startsWith("/") ? withSlash.substring(1) : withSlash;
        if (normalized.startsWith(withSlash)) {
            return normalized.substring(withSlash.length());
        }
        if (!withoutLeading.isEmpty() && normalized.startsWith(withoutLeading)) {
            return normalized.substring(withoutLeading.length());
        }
        return null;
    }

    private void addCandidate(List<Path> candidates, PathSupplier supplier) {
        try {
            Path path = supplier.get();
            if (!candidates.contains(path)) {
                candidates.add(path);
            }
        } catch (InvalidPathException e) {
            log.debug("Skipping unusable path candidate: {}", e.getMessage());
        }
    }

    @FunctionalInterface
    private interface PathSupplier {
        Path get();
    }
}
