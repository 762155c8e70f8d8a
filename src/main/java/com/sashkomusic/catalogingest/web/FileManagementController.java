package com.sashkomusic.catalogingest.web;

import com.sashkomusic.catalogingest.domain.service.reconciliation.OrphanReconciliationService;
import com.sashkomusic.catalogingest.web.dto.LocalDeletionResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/files")
@RequiredArgsConstructor
public class FileManagementController {

    private final OrphanReconciliationService reconciliationService;

    @DeleteMapping("/local/{trackId}")
    public ResponseEntity<LocalDeletionResponse> deleteLocalFile(@PathVariable Long trackId) {
        return ResponseEntity.ok(LocalDeletionResponse.of(reconciliationService.deleteLocalFile(trackId)));
    }
}
