package com.sashkomusic.catalogingest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "catalog")
public class CatalogConfig {

    private Upload upload = new Upload();
    private Local local = new Local();
    private Events events = new Events();
    private Http http = new Http();

    @Data
    public static class Upload {
        private DataSize maxFileSize = DataSize.ofMegabytes(500);
    }

    @Data
    public static class Local {
        private String root = "uploads";
        private String publicPrefix = "/uploads/";
        private boolean watchEnabled = true;
    }

    @Data
    public static class Events {
        private boolean enabled = false;
    }

    /**
     * Outbound HTTP used to fetch generated cover art.
     */
    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
    }
}
