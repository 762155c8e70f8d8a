package com.sashkomusic.catalogingest.domain.service.reconciliation;

import com.sashkomusic.catalogingest.config.ReconciliationConfig;
import com.sashkomusic.catalogingest.domain.exception.ReconciliationException;
import com.sashkomusic.catalogingest.domain.model.CleanupReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReconciliationSchedulerTest {

    private OrphanReconciliationService service;
    private ReconciliationConfig config;
    private ReconciliationScheduler scheduler;

    @BeforeEach
    void setUp() {
        service = mock(OrphanReconciliationService.class);
        config = new ReconciliationConfig();
        scheduler = new ReconciliationScheduler(service, config);
    }

    @Test
    void scheduledPassIsDryRunByDefault() {
        when(service.cleanup(true, "scheduled")).thenReturn(CleanupReport.empty(true));

        scheduler.runScheduledPass();

        verify(service).cleanup(true, "scheduled");
    }

    @Test
    void disabledSchedulerDoesNothing() {
        config.setEnabled(false);

        scheduler.runScheduledPass();

        verify(service, never()).cleanup(anyBoolean(), anyString());
    }

    @Test
    void failuresAreContained() {
        config.setDryRun(false);
        when(service.cleanup(false, "scheduled"))
                .thenThrow(new ReconciliationException("rolled back", new RuntimeException("db")));

        assertDoesNotThrow(() -> scheduler.runScheduledPass());
    }
}
