package com.sashkomusic.catalogingest.domain.service.reconciliation;

import com.sashkomusic.catalogingest.config.CatalogConfig;
import com.sashkomusic.catalogingest.domain.service.utils.FileNames;
import com.sashkomusic.catalogingest.domain.service.validation.SupportedAudioType;
import io.methvin.watcher.DirectoryChangeEvent;
import io.methvin.watcher.DirectoryWatcher;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.CompletableFuture;

/**
 * Watches the local upload root and drops catalog rows whose audio file was deleted.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UploadDirectoryWatcher {

    private final OrphanReconciliationService reconciliationService;
    private final CatalogConfig catalogConfig;

    private DirectoryWatcher watcher;
    private CompletableFuture<Void> watchFuture;

    @PostConstruct
    public void startWatching() {
        if (!catalogConfig.getLocal().isWatchEnabled()) {
            log.info("Upload directory watching is disabled");
            return;
        }

        try {
            Path rootPath = Paths.get(catalogConfig.getLocal().getRoot());
            Files.createDirectories(rootPath);
            log.info("Initializing directory watcher for uploads: {}", rootPath.toAbsolutePath());

            watcher = DirectoryWatcher.builder()
                    .path(rootPath)
                    .listener(this::handleFileEvent)
                    .fileHashing(false)
                    .build();

            watchFuture = watcher.watchAsync();
            log.info("Started watching upload directory: {}", rootPath.toAbsolutePath());

        } catch (IOException e) {
            log.error("Failed to start directory watcher: {}", e.getMessage(), e);
            log.warn("Falling back to scheduled reconciliation only");
        }
    }

    void handleFileEvent(DirectoryChangeEvent event) {
        try {
            if (event.eventType() != DirectoryChangeEvent.EventType.DELETE) {
                return;
            }

            Path deletedFile = event.path();
            if (!isAudioFile(deletedFile)) {
                return;
            }

            log.debug("Detected file deletion: {}", deletedFile.getFileName());
            reconciliationService.onFileDeleted(deletedFile);

        } catch (Exception e) {
            log.error("Error handling file event for {}: {}", event.path(), e.getMessage());
        }
    }

    private boolean isAudioFile(Path file) {
        return SupportedAudioType.fromExtension(FileNames.extension(file.getFileName().toString())).isPresent();
    }

    @PreDestroy
    public void stopWatching() {
        if (watcher != null) {
            try {
                log.info("Stopping directory watcher...");
                watcher.close();

                if (watchFuture != null && !watchFuture.isDone()) {
                    watchFuture.cancel(true);
                }

                log.info("Directory watcher stopped");
            } catch (IOException e) {
                log.error("Error stopping directory watcher: {}", e.getMessage());
            }
        }
    }
}
