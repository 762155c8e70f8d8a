package com.sashkomusic.catalogingest.domain.service.reconciliation;

import com.sashkomusic.catalogingest.config.ReconciliationConfig;
import com.sashkomusic.catalogingest.domain.model.CleanupReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ReconciliationScheduler {

    static final String TRIGGER_SCHEDULED = "scheduled";

    private final OrphanReconciliationService reconciliationService;
    private final ReconciliationConfig config;

    @Scheduled(fixedDelayString = "${reconciliation.interval:3600000}",
            initialDelayString = "${reconciliation.initial-delay:60000}")
    public void runScheduledPass() {
        if (!config.isEnabled()) {
            return;
        }

        log.info("Starting scheduled orphan reconciliation (dryRun={})", config.isDryRun());
        try {
            CleanupReport report = reconciliationService.cleanup(config.isDryRun(), TRIGGER_SCHEDULED);
            log.info("Scheduled reconciliation finished: {} orphaned track(s), dryRun={}",
                    report.count(), report.dryRun());
        } catch (Exception e) {
            log.error("Scheduled reconciliation failed: {}", e.getMessage(), e);
        }
    }
}
