package com.sashkomusic.catalogingest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "storage.remote")
public class RemoteStorageConfig {
    private String endpoint;
    private String region = "us-west-002";
    private String bucket;
    private String accessKeyId;
    private String secretAccessKey;
    /**
     * Base URL objects are served from. Defaults to {@code endpoint/bucket}.
     */
    private String publicBaseUrl;
    private Duration timeout = Duration.ofSeconds(20);
    private Duration connectTimeout = Duration.ofSeconds(5);
    private String cacheControl = "public, max-age=31536000";
    /**
     * When set, a failed remote write is not compensated by the local tier.
     */
    private boolean required;

    public boolean isComplete() {
        return hasText(endpoint) && hasText(bucket) && hasText(accessKeyId) && hasText(secretAccessKey);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
