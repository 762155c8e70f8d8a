package com.sashkomusic.catalogingest.infrastructure.client.s3;

import com.sashkomusic.catalogingest.config.RemoteStorageConfig;
import com.sashkomusic.catalogingest.domain.exception.BlobStoreException;
import com.sashkomusic.catalogingest.domain.model.BlobMetadata;
import com.sashkomusic.catalogingest.domain.model.RemoteErrorCode;
import com.sashkomusic.catalogingest.domain.port.BlobStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link BlobStore} on any S3-compatible endpoint (Backblaze B2, MinIO, AWS) with path-style
 * addressing. The client is built once at start-up; incomplete configuration leaves the store in
 * the not-configured state.
 */
@Slf4j
@Component
public class S3BlobStore implements BlobStore {

    private static final Set<String> AUTH_ERROR_CODES = Set.of(
            "AccessDenied", "InvalidAccessKeyId", "SignatureDoesNotMatch", "Unauthorized", "ExpiredToken");

    private final RemoteStorageConfig config;
    private S3Client s3Client;

    @Autowired
    public S3BlobStore(RemoteStorageConfig config) {
        this.config = config;
    }

    S3BlobStore(RemoteStorageConfig config, S3Client s3Client) {
        this.config = config;
        this.s3Client = s3Client;
    }

    @PostConstruct
    public void init() {
        if (s3Client != null) {
            return;
        }
        if (!config.isComplete()) {
            log.info("Remote storage not configured (endpoint, bucket and credentials required), using local tier only");
            return;
        }

        try {
            s3Client = S3Client.builder()
                    .endpointOverride(URI.create(config.getEndpoint()))
                    .region(Region.of(config.getRegion()))
                    .credentialsProvider(StaticCredentialsProvider.create(
                            AwsBasicCredentials.create(config.getAccessKeyId(), config.getSecretAccessKey())))
                    .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build())
                    .httpClientBuilder(ApacheHttpClient.builder()
                            .connectionTimeout(config.getConnectTimeout())
                            .socketTimeout(config.getTimeout()))
                    .overrideConfiguration(ClientOverrideConfiguration.builder()
                            .apiCallTimeout(config.getTimeout())
                            .retryPolicy(RetryPolicy.none())
                            .build())
                    .build();
            log.info("Remote storage initialized: endpoint={}, bucket={}", config.getEndpoint(), config.getBucket());
        } catch (RuntimeException e) {
            log.error("Failed to initialize remote storage client: {}", e.getMessage(), e);
            s3Client = null;
        }
    }

    @PreDestroy
    public void close() {
        if (s3Client != null) {
            s3Client.close();
        }
    }

    @Override
    public boolean isConfigured() {
        return s3Client != null;
    }

    @Override
    public String put(String key, byte[] content, String contentType, String cacheControl) {
        S3Client client = requireClient();
        try {
            PutObjectRequest.Builder request = PutObjectRequest.builder()
                    .bucket(config.getBucket())
                    .key(key)
                    .contentType(contentType)
                    .contentLength((long) content.length);
            if (cacheControl != null && !cacheControl.isBlank()) {
                request.cacheControl(cacheControl);
            }
            client.putObject(request.build(), RequestBody.fromBytes(content));
            String url = publicUrl(key);
            log.debug("Uploaded {} bytes to {}", content.length, url);
            return url;
        } catch (SdkException e) {
            throw translate("put " + key, e);
        }
    }

    @Override
    public byte[] get(String key) {
        S3Client client = requireClient();
        try {
            return client.getObjectAsBytes(GetObjectRequest.builder()
                    .bucket(config.getBucket())
                    .key(key)
                    .build()).asByteArray();
        } catch (NoSuchKeyException e) {
            throw new BlobStoreException(RemoteErrorCode.CLIENT_ERROR, "Object not found: " + key, e);
        } catch (SdkException e) {
            throw translate("get " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        S3Client client = requireClient();
        try {
            client.deleteObject(DeleteObjectRequest.builder()
                    .bucket(config.getBucket())
                    .key(key)
                    .build());
        } catch (NoSuchKeyException e) {
            log.debug("Object already absent: {}", key);
        } catch (SdkException e) {
            throw translate("delete " + key, e);
        }
    }

    @Override
    public Optional<BlobMetadata> head(String key) {
        S3Client client = requireClient();
        try {
            HeadObjectResponse response = client.headObject(HeadObjectRequest.builder()
                    .bucket(config.getBucket())
                    .key(key)
                    .build());
            long length = response.contentLength() != null ? response.contentLength() : 0L;
            return Optional.of(new BlobMetadata(key, length, response.contentType(), response.cacheControl()));
        } catch (NoSuchKeyException e) {
            return Optional.empty();
        } catch (S3Exception e) {
            // HEAD responses carry no error body, a missing key is a bare 404
            if (e.statusCode() == 404 && !"NoSuchBucket".equals(errorCode(e))) {
                return Optional.empty();
            }
            throw translate("head " + key, e);
        } catch (SdkException e) {
            throw translate("head " + key, e);
        }
    }

    @Override
    public List<String> list(String prefix) {
        S3Client client = requireClient();
        try {
            return client.listObjectsV2Paginator(ListObjectsV2Request.builder()
                            .bucket(config.getBucket())
                            .prefix(prefix)
                            .build())
                    .contents()
                    .stream()
                    .map(S3Object::key)
                    .toList();
        } catch (SdkException e) {
            throw translate("list " + prefix, e);
        }
    }

    @Override
    public void checkAccess() {
        S3Client client = requireClient();
        try {
            client.headBucket(HeadBucketRequest.builder().bucket(config.getBucket()).build());
        } catch (SdkException e) {
            throw translate("check access to " + config.getBucket(), e);
        }
    }

    @Override
    public String publicUrl(String key) {
        String encoded = Arrays.stream(key.split("/"))
                .map(segment -> URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20"))
                .collect(Collectors.joining("/"));
        return baseUrl() + "/" + encoded;
    }

    @Override
    public Optional<String> keyFromUrl(String url) {
        if (url == null) {
            return Optional.empty();
        }
        String prefix = baseUrl() + "/";
        if (!url.startsWith(prefix) || url.length() == prefix.length()) {
            return Optional.empty();
        }
        return Optional.of(URLDecoder.decode(url.substring(prefix.length()), StandardCharsets.UTF_8));
    }

    @Override
    public String describeEndpoint() {
        return config.getEndpoint();
    }

    @Override
    public String describeBucket() {
        return config.getBucket();
    }

    private String baseUrl() {
        String base = config.getPublicBaseUrl();
        if (base == null || base.isBlank()) {
            base = stripTrailingSlash(config.getEndpoint()) + "/" + config.getBucket();
        }
        return stripTrailingSlash(base);
    }

    private S3Client requireClient() {
        if (s3Client == null) {
            throw new BlobStoreException(RemoteErrorCode.NOT_CONFIGURED, "Remote storage is not configured");
        }
        return s3Client;
    }

    static BlobStoreException translate(String operation, SdkException e) {
        RemoteErrorCode code = classify(e);
        log.debug("Remote storage failed to {}: {} ({})", operation, code.code(), e.getMessage());
        return new BlobStoreException(code, "Failed to " + operation + ": " + e.getMessage(), e);
    }

    static RemoteErrorCode classify(SdkException e) {
        if (e instanceof ApiCallTimeoutException || e instanceof ApiCallAttemptTimeoutException) {
            return RemoteErrorCode.TIMEOUT;
        }
        if (e instanceof S3Exception) {
            S3Exception s3Error = (S3Exception) e;
            int status = s3Error.statusCode();
            String code = errorCode(s3Error);
            if (status == 401 || status == 403 || (code != null && AUTH_ERROR_CODES.contains(code))) {
                return RemoteErrorCode.AUTH_ERROR;
            }
            if ("NoSuchBucket".equals(code) || status == 404) {
                return RemoteErrorCode.BUCKET_NOT_FOUND;
            }
            if (status == 429 || status == 503 || "SlowDown".equals(code)) {
                return RemoteErrorCode.RATE_LIMITED;
            }
            return RemoteErrorCode.CLIENT_ERROR;
        }
        if (e instanceof SdkClientException && e.getCause() instanceof SocketTimeoutException) {
            return RemoteErrorCode.TIMEOUT;
        }
        return RemoteErrorCode.CLIENT_ERROR;
    }

    private static String errorCode(S3Exception e) {
        return e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
    }

    private static String stripTrailingSlash(String value) {
        String result = value == null ? "" : value;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
