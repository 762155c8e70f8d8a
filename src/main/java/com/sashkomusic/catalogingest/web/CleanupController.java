package com.sashkomusic.catalogingest.web;

import com.sashkomusic.catalogingest.domain.service.reconciliation.OrphanReconciliationService;
import com.sashkomusic.catalogingest.web.dto.CleanupResponse;
import com.sashkomusic.catalogingest.web.dto.OrphanListResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/cleanup")
@RequiredArgsConstructor
public class CleanupController {

    private final OrphanReconciliationService reconciliationService;

    @GetMapping("/orphans")
    public ResponseEntity<OrphanListResponse> listOrphans() {
        return ResponseEntity.ok(OrphanListResponse.of(reconciliationService.findOrphaned()));
    }

    @DeleteMapping("/orphans")
    public ResponseEntity<CleanupResponse> deleteOrphans(
            @RequestParam(value = "dry_run", defaultValue = "false") boolean dryRun) {
        return ResponseEntity.ok(CleanupResponse.of(reconciliationService.cleanup(dryRun)));
    }
}
