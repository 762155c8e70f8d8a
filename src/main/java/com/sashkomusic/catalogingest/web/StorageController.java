package com.sashkomusic.catalogingest.web;

import com.sashkomusic.catalogingest.domain.model.StorageHealth;
import com.sashkomusic.catalogingest.domain.service.storage.TieredStorageWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/storage")
@RequiredArgsConstructor
public class StorageController {

    private final TieredStorageWriter storageWriter;

    @GetMapping("/health")
    public ResponseEntity<StorageHealth> health() {
        return ResponseEntity.ok(storageWriter.health());
    }
}
