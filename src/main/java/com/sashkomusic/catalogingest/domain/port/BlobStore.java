package com.sashkomusic.catalogingest.domain.port;

import com.sashkomusic.catalogingest.domain.model.BlobMetadata;

import java.util.List;
import java.util.Optional;

/**
 * Remote key-value store for audio and cover art payloads.
 *
 * <p>
 * Implementations read their configuration once at start-up. An implementation
 * without usable configuration stays in the not-configured state: it reports
 * {@link #isConfigured()} as false and every operation fails with
 * {@link com.sashkomusic.catalogingest.domain.model.RemoteErrorCode#NOT_CONFIGURED}.
 * Failures are reported as
 * {@link com.sashkomusic.catalogingest.domain.exception.BlobStoreException}
 * carrying the failure class.
 */
public interface BlobStore {

    boolean isConfigured();

    /**
     * Store the payload under the key.
     *
     * @return public URL of the stored object
     */
    String put(String key, byte[] content, String contentType, String cacheControl);

    byte[] get(String key);

    /**
     * Delete the object. Deleting a missing object succeeds.
     */
    void delete(String key);

    Optional<BlobMetadata> head(String key);

    List<String> list(String prefix);

    /**
     * Verify credentials and bucket reachability.
     */
    void checkAccess();

    String publicUrl(String key);

    /**
     * Extract the object key from a URL previously returned by {@link #put}.
     */
    Optional<String> keyFromUrl(String url);

    String describeEndpoint();

    String describeBucket();
}
