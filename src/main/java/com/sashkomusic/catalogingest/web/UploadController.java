package com.sashkomusic.catalogingest.web;

import com.sashkomusic.catalogingest.domain.model.DeclaredMetadata;
import com.sashkomusic.catalogingest.domain.model.IngestionError;
import com.sashkomusic.catalogingest.domain.model.IngestionResult;
import com.sashkomusic.catalogingest.domain.model.MetadataPreview;
import com.sashkomusic.catalogingest.domain.model.SubmittedAsset;
import com.sashkomusic.catalogingest.domain.service.IngestionService;
import com.sashkomusic.catalogingest.web.dto.ErrorResponse;
import com.sashkomusic.catalogingest.web.dto.UploadResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

@Slf4j
@RestController
@RequestMapping("/upload")
@RequiredArgsConstructor
public class UploadController {

    private final IngestionService ingestionService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> upload(
            @RequestParam("title") String title,
            @RequestParam("artist_name") String artistName,
            @RequestParam(value = "album", required = false) String album,
            @RequestParam(value = "year", required = false) Integer year,
            @RequestParam(value = "genre", required = false) String genre,
            @RequestParam(value = "tags", required = false) String tags,
            @RequestParam(value = "description", required = false) String description,
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "cover_art", required = false) MultipartFile coverArt,
            @RequestParam(value = "skip_duplicate_check", defaultValue = "false") boolean skipDuplicateCheck)
            throws IOException {

        log.info("Upload request: '{}' by '{}' ({}, {} bytes)", title, artistName, file.getOriginalFilename(), file.getSize());

        byte[] coverBytes = coverArt != null && !coverArt.isEmpty() ? coverArt.getBytes() : null;
        String coverName = coverArt != null ? coverArt.getOriginalFilename() : null;
        DeclaredMetadata metadata = new DeclaredMetadata(title, artistName, album, year, genre, tags, description,
                coverBytes, coverName);
        SubmittedAsset asset = SubmittedAsset.of(file.getBytes(), file.getOriginalFilename(), file.getContentType());

        IngestionResult result = ingestionService.ingest(asset, metadata, skipDuplicateCheck);
        if (result.committed()) {
            return ResponseEntity.status(HttpStatus.CREATED).body(UploadResponse.of(result.track(), result.storage()));
        }

        IngestionError error = result.error();
        return ResponseEntity.status(statusFor(error))
                .body(ErrorResponse.of(error.code(), error.message(), error.match()));
    }

    @PostMapping(value = "/extract-metadata", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<MetadataPreview> extractMetadata(@RequestParam("file") MultipartFile file) throws IOException {
        log.info("Metadata extraction request: {}", file.getOriginalFilename());
        return ResponseEntity.ok(ingestionService.previewMetadata(file.getBytes(), file.getOriginalFilename()));
    }

    static HttpStatus statusFor(IngestionError error) {
        return switch (error.type()) {
            case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
            case DUPLICATE_CONFLICT -> HttpStatus.CONFLICT;
            case STORAGE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case PERSISTENCE_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
