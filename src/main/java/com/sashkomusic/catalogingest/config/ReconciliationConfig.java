package com.sashkomusic.catalogingest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "reconciliation")
public class ReconciliationConfig {
    private boolean enabled = true;
    private boolean dryRun = true;
}
