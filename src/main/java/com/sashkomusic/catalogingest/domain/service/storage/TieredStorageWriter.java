package com.sashkomusic.catalogingest.domain.service.storage;

import com.sashkomusic.catalogingest.config.RemoteStorageConfig;
import com.sashkomusic.catalogingest.domain.exception.BlobStoreException;
import com.sashkomusic.catalogingest.domain.exception.StorageUnavailableException;
import com.sashkomusic.catalogingest.domain.model.RemoteErrorCode;
import com.sashkomusic.catalogingest.domain.model.RemoteWriteResult;
import com.sashkomusic.catalogingest.domain.model.StorageHealth;
import com.sashkomusic.catalogingest.domain.model.StorageOutcome;
import com.sashkomusic.catalogingest.domain.port.BlobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Writes payloads to the remote blob store, falling back to the local filesystem.
 *
 * <p>
 * One remote attempt per call, bounded by {@code storage.remote.timeout}; no retries. A timed-out
 * attempt is reported as {@code TIMEOUT} without interrupting the remote call.
 * An unconfigured remote tier is local-only mode and is not reported as a fallback.
 */
@Slf4j
@Service
public class TieredStorageWriter {

    private final BlobStore blobStore;
    private final LocalFileStore localFileStore;
    private final LocalPathResolver pathResolver;
    private final RemoteStorageConfig remoteConfig;
    private final ExecutorService remoteExecutor;

    public TieredStorageWriter(BlobStore blobStore,
                               LocalFileStore localFileStore,
                               LocalPathResolver pathResolver,
                               RemoteStorageConfig remoteConfig,
                               @Qualifier("remoteStorageExecutor") ExecutorService remoteExecutor) {
        this.blobStore = blobStore;
        this.localFileStore = localFileStore;
        this.pathResolver = pathResolver;
        this.remoteConfig = remoteConfig;
        this.remoteExecutor = remoteExecutor;
    }

    public StorageOutcome write(String key, byte[] content, String contentType) {
        RemoteWriteResult remote = attemptRemote(key, content, contentType);
        if (remote.ok()) {
            log.info("Stored {} on remote tier: {}", key, remote.url());
            return StorageOutcome.remote(remote.url(), remote);
        }

        if (remote.wasAttempted()) {
            log.warn("Remote write failed for {}: {} ({})", key, remote.errorCode().code(), remote.detail());
        }

        if (remoteConfig.isRequired()) {
            throw new StorageUnavailableException(
                    "Remote storage is required but unavailable: " + remote.errorCode().code());
        }

        try {
            Path path = localFileStore.write(key, content);
            StorageOutcome outcome = StorageOutcome.local(path.toString(), remote);
            if (outcome.fellBackFromRemote()) {
                log.warn("Fell back to local tier for {}: {}", key, outcome.location());
            }
            return outcome;
        } catch (IOException e) {
            log.error("Local write failed for {}: {}", key, e.getMessage(), e);
            throw new StorageUnavailableException("No storage tier accepted " + key, e);
        }
    }

    RemoteWriteResult attemptRemote(String key, byte[] content, String contentType) {
        if (!blobStore.isConfigured()) {
            return RemoteWriteResult.notConfigured();
        }

        Future<String> upload = remoteExecutor.submit(
                () -> blobStore.put(key, content, contentType, remoteConfig.getCacheControl()));
        long timeoutMillis = remoteConfig.getTimeout().toMillis();
        try {
            return RemoteWriteResult.success(upload.get(timeoutMillis, TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            // the call keeps running until the client's own apiCallTimeout ends it
            return RemoteWriteResult.failure(RemoteErrorCode.TIMEOUT,
                    "Remote write did not finish within " + timeoutMillis + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BlobStoreException) {
                BlobStoreException blobError = (BlobStoreException) cause;
                return RemoteWriteResult.failure(blobError.getErrorCode(), blobError.getMessage());
            }
            return RemoteWriteResult.failure(RemoteErrorCode.CLIENT_ERROR,
                    cause != null ? cause.getMessage() : e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            upload.cancel(true);
            return RemoteWriteResult.failure(RemoteErrorCode.CLIENT_ERROR, "Interrupted while writing to remote tier");
        }
    }

    /**
     * Removes a previously stored payload from whichever tier the location denotes.
     *
     * @return true when the payload is gone afterwards
     */
    public boolean delete(String location) {
        if (location == null || location.isBlank()) {
            return false;
        }

        if (LocalPathResolver.isRemoteUrl(location)) {
            return deleteRemote(location);
        }

        Optional<Path> resolved = pathResolver.resolve(location);
        if (resolved.isEmpty()) {
            log.debug("Local file already absent: {}", location);
            return true;
        }
        try {
            localFileStore.delete(resolved.get());
            return true;
        } catch (IOException e) {
            log.error("Failed to delete local file {}: {}", resolved.get(), e.getMessage());
            return false;
        }
    }

    private boolean deleteRemote(String url) {
        if (!blobStore.isConfigured()) {
            log.warn("Cannot delete remote object, remote storage is not configured: {}", url);
            return false;
        }
        Optional<String> key = blobStore.keyFromUrl(url);
        if (key.isEmpty()) {
            log.warn("URL does not belong to the configured bucket: {}", url);
            return false;
        }
        try {
            blobStore.delete(key.get());
            log.info("Deleted remote object: {}", key.get());
            return true;
        } catch (BlobStoreException e) {
            log.error("Failed to delete remote object {}: {} ({})", key.get(), e.getErrorCode().code(), e.getMessage());
            return false;
        }
    }

    public StorageHealth health() {
        if (!blobStore.isConfigured()) {
            return StorageHealth.of(new StorageHealth.Remote(false, false, null, null,
                    RemoteErrorCode.NOT_CONFIGURED.code(), null));
        }
        try {
            blobStore.checkAccess();
            return StorageHealth.of(new StorageHealth.Remote(true, true,
                    blobStore.describeEndpoint(), blobStore.describeBucket(), null, null));
        } catch (BlobStoreException e) {
            log.warn("Remote storage health check failed: {} ({})", e.getErrorCode().code(), e.getMessage());
            return StorageHealth.of(new StorageHealth.Remote(true, false,
                    blobStore.describeEndpoint(), blobStore.describeBucket(), e.getErrorCode().code(), e.getMessage()));
        }
    }
}
