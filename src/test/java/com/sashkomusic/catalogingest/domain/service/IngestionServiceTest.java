package com.sashkomusic.catalogingest.domain.service;

import com.sashkomusic.catalogingest.AudioFixtures;
import com.sashkomusic.catalogingest.InMemoryBlobStore;
import com.sashkomusic.catalogingest.config.CatalogConfig;
import com.sashkomusic.catalogingest.config.RemoteStorageConfig;
import com.sashkomusic.catalogingest.domain.entity.Artist;
import com.sashkomusic.catalogingest.domain.entity.Track;
import com.sashkomusic.catalogingest.domain.exception.BlobStoreException;
import com.sashkomusic.catalogingest.domain.exception.CatalogPersistenceException;
import com.sashkomusic.catalogingest.domain.exception.InvalidAudioException;
import com.sashkomusic.catalogingest.domain.exception.StoredLocationConflictException;
import com.sashkomusic.catalogingest.domain.model.DeclaredMetadata;
import com.sashkomusic.catalogingest.domain.model.IngestionErrorType;
import com.sashkomusic.catalogingest.domain.model.IngestionResult;
import com.sashkomusic.catalogingest.domain.model.IngestionState;
import com.sashkomusic.catalogingest.domain.model.MatchType;
import com.sashkomusic.catalogingest.domain.model.MetadataPreview;
import com.sashkomusic.catalogingest.domain.model.RemoteErrorCode;
import com.sashkomusic.catalogingest.domain.model.ResolvedCover;
import com.sashkomusic.catalogingest.domain.model.StorageTier;
import com.sashkomusic.catalogingest.domain.model.SubmittedAsset;
import com.sashkomusic.catalogingest.domain.port.BlobStore;
import com.sashkomusic.catalogingest.domain.service.duplicate.DuplicateDetector;
import com.sashkomusic.catalogingest.domain.service.fingerprint.AudioFingerprinter;
import com.sashkomusic.catalogingest.domain.service.fingerprint.AudioTagReader;
import com.sashkomusic.catalogingest.domain.service.fingerprint.AudioTags;
import com.sashkomusic.catalogingest.domain.service.fingerprint.TagField;
import com.sashkomusic.catalogingest.domain.service.storage.LocalFileStore;
import com.sashkomusic.catalogingest.domain.service.storage.LocalPathResolver;
import com.sashkomusic.catalogingest.domain.service.storage.StorageKeyBuilder;
import com.sashkomusic.catalogingest.domain.service.storage.TieredStorageWriter;
import com.sashkomusic.catalogingest.domain.service.validation.AudioFileValidator;
import com.sashkomusic.catalogingest.domain.service.validation.AudioHeaderProbe;
import com.sashkomusic.catalogingest.messaging.producer.TrackIngestedProducer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IngestionServiceTest {

    private static final String FILENAME = "ithemba.mp3";
    private static final String REMOTE_URL = "https://s3.example.com/catalog/audio/Calvin%20Fallo%20-%20Ithemba.mp3";

    @TempDir
    Path root;

    private AudioTagReader tagReader;
    private CatalogService catalogService;
    private CoverArtService coverArtService;
    private BlobStore blobStore;
    private RemoteStorageConfig remoteConfig;
    private TrackIngestedProducer producer;
    private ExecutorService executor;
    private CatalogConfig catalogConfig;
    private IngestionService ingestionService;

    @BeforeEach
    void setUp() {
        catalogConfig = new CatalogConfig();
        catalogConfig.getLocal().setRoot(root.toString());

        tagReader = mock(AudioTagReader.class);
        catalogService = mock(CatalogService.class);
        coverArtService = mock(CoverArtService.class);
        blobStore = mock(BlobStore.class);
        producer = mock(TrackIngestedProducer.class);
        remoteConfig = new RemoteStorageConfig();
        executor = Executors.newCachedThreadPool();
        ingestionService = newIngestionService(blobStore);

        when(tagReader.read(any(), anyString())).thenReturn(new AudioTags(Map.of(), 372, 320, null));
        when(catalogService.snapshot()).thenReturn(List.of());
        when(catalogService.findOrCreateArtist(anyString()))
                .thenAnswer(invocation -> new Artist(invocation.getArgument(0)));
        when(catalogService.saveTrack(any(Track.class))).thenAnswer(invocation -> {
            Track track = invocation.getArgument(0);
            track.setId(1L);
            return track;
        });
        when(coverArtService.resolve(any(), any())).thenReturn(Optional.empty());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void happyPathCommitsToLocalTierWhenRemoteIsNotConfigured() throws IOException {
        byte[] content = AudioFixtures.mp3(8);

        IngestionResult result = ingest(content, DeclaredMetadata.of("Ithemba", "Calvin Fallo"), false);

        assertTrue(result.committed());
        assertEquals(IngestionState.COMMITTED, result.state());
        Track track = result.track();
        assertEquals("Ithemba", track.getTitle());
        assertEquals("Calvin Fallo", track.getArtistName());
        assertEquals(372, track.getDurationSeconds());
        assertEquals(320, track.getQualityKbps());
        assertEquals(sha256(content), track.getContentHash());
        assertEquals(StorageTier.LOCAL, track.getStorageTier());
        assertFalse(result.storage().fellBackFromRemote());

        Path stored = root.resolve("audio/Calvin Fallo - Ithemba.mp3");
        assertEquals(stored.toString(), track.getStoredLocation());
        assertArrayEquals(content, Files.readAllBytes(stored));
        verify(producer).send(any());
    }

    @Test
    void remoteTierIsUsedWhenAvailable() throws IOException {
        when(blobStore.isConfigured()).thenReturn(true);
        when(blobStore.put(anyString(), any(), anyString(), any())).thenReturn(REMOTE_URL);

        IngestionResult result = ingest(AudioFixtures.mp3(8), DeclaredMetadata.of("Ithemba", "Calvin Fallo"), false);

        assertTrue(result.committed());
        assertEquals(StorageTier.REMOTE, result.track().getStorageTier());
        assertEquals(REMOTE_URL, result.track().getStoredLocation());
        assertEquals(0, storedFileCount());
    }

    @Test
    void remoteFailureFallsBackAndIsReported() throws IOException {
        when(blobStore.isConfigured()).thenReturn(true);
        when(blobStore.put(anyString(), any(), anyString(), any()))
                .thenThrow(new BlobStoreException(RemoteErrorCode.AUTH_ERROR, "invalid key"));

        IngestionResult result = ingest(AudioFixtures.mp3(8), DeclaredMetadata.of("Ithemba", "Calvin Fallo"), false);

        assertTrue(result.committed());
        assertEquals(StorageTier.LOCAL, result.track().getStorageTier());
        assertTrue(result.storage().fellBackFromRemote());
        assertEquals(1, storedFileCount());
    }

    @Test
    void corruptedUploadIsRejectedBeforeAnyWrite() throws IOException {
        IngestionResult result = ingest(AudioFixtures.corrupted(), DeclaredMetadata.of("Ithemba", "Calvin Fallo"), false);

        assertFalse(result.committed());
        assertEquals(IngestionState.FAILED, result.state());
        assertEquals(IngestionErrorType.INVALID_INPUT, result.error().type());
        assertEquals("invalid_or_corrupted", result.error().code());
        assertEquals(0, storedFileCount());
        verify(blobStore, never()).put(anyString(), any(), anyString(), any());
        verify(catalogService, never()).saveTrack(any());
    }

    @Test
    void unsupportedTypeIsInvalidInput() {
        IngestionResult result = ingestNamed(AudioFixtures.mp3(8), "ithemba.exe",
                DeclaredMetadata.of("Ithemba", "Calvin Fallo"), false);

        assertEquals(IngestionErrorType.INVALID_INPUT, result.error().type());
        assertEquals("unsupported_file_type", result.error().code());
    }

    @Test
    void reUploadOfSameBytesIsExactDuplicate() throws IOException {
        byte[] content = AudioFixtures.mp3(8);
        Track existing = existingTrack(5L, "Ithemba", "Calvin Fallo", 372);
        existing.setContentHash(sha256(content));
        when(catalogService.snapshot()).thenReturn(List.of(existing));

        IngestionResult result = ingest(content, DeclaredMetadata.of("Different Title", "Someone Else"), false);

        assertEquals(IngestionErrorType.DUPLICATE_CONFLICT, result.error().type());
        assertEquals("duplicate_track", result.error().code());
        assertEquals(MatchType.EXACT_CONTENT, result.error().match().matchType());
        assertEquals(5L, result.error().match().matchedTrackId());
        assertEquals(0, storedFileCount());
    }

    @Test
    void nearDuplicateIsRejectedAsMetadataMatch() throws IOException {
        byte[] content = AudioFixtures.mp3(8);
        Track existing = existingTrack(9L, "Ithemba", "Calvin Fallo", 372);
        existing.setAlbum("Amapiano Sessions");
        // the upload is 2% smaller than the catalogued file
        existing.setFileSizeMb(content.length / (1024.0 * 1024.0) / 0.98);
        when(catalogService.snapshot()).thenReturn(List.of(existing));

        IngestionResult result = ingest(content, DeclaredMetadata.of("Ithemba", "Calvin Fallo"), false);

        assertEquals(IngestionErrorType.DUPLICATE_CONFLICT, result.error().type());
        assertEquals("metadata", result.error().match().matchType().wireName());
        assertEquals(9L, result.error().match().matchedTrackId());
        assertEquals(0.85, result.error().match().confidence(), 0.05);
        assertEquals(0.89, result.error().match().confidence(), 1e-9);
        assertEquals(0, storedFileCount());
    }

    @Test
    void skipDuplicateCheckSaltsTheStorageKey() throws IOException {
        byte[] content = AudioFixtures.mp3(8);
        Track existing = existingTrack(5L, "Ithemba", "Calvin Fallo", 372);
        existing.setContentHash(sha256(content));
        when(catalogService.snapshot()).thenReturn(List.of(existing));

        IngestionResult result = ingest(content, DeclaredMetadata.of("Ithemba", "Calvin Fallo"), true);

        assertTrue(result.committed());
        String name = Path.of(result.track().getStoredLocation()).getFileName().toString();
        assertTrue(name.matches("Calvin Fallo - Ithemba-[0-9a-f]{8}\\.mp3"), name);
        verify(catalogService, never()).snapshot();
    }

    @Test
    void losingTheStoredLocationRaceRemovesWrittenBlobs() throws IOException {
        when(coverArtService.resolve(any(), any())).thenReturn(Optional.of(
                new ResolvedCover(AudioFixtures.jpeg(), "jpg", "image/jpeg", "upload")));
        doThrow(new StoredLocationConflictException("audio/Calvin Fallo - Ithemba.mp3", null))
                .when(catalogService).saveTrack(any(Track.class));

        IngestionResult result = ingest(AudioFixtures.mp3(8), DeclaredMetadata.of("Ithemba", "Calvin Fallo"), false);

        assertFalse(result.committed());
        assertEquals(IngestionErrorType.DUPLICATE_CONFLICT, result.error().type());
        assertEquals("duplicate_track", result.error().code());
        assertNull(result.error().match());
        assertEquals(0, storedFileCount());
        verify(producer, never()).send(any());
    }

    @Test
    void persistenceFailureRemovesWrittenBlobs() throws IOException {
        doThrow(new CatalogPersistenceException("connection reset", null))
                .when(catalogService).saveTrack(any(Track.class));

        IngestionResult result = ingest(AudioFixtures.mp3(8), DeclaredMetadata.of("Ithemba", "Calvin Fallo"), false);

        assertEquals(IngestionErrorType.PERSISTENCE_ERROR, result.error().type());
        assertEquals("persistence_error", result.error().code());
        assertEquals(0, storedFileCount());
    }

    @Test
    void remoteFailureWithRequiredRemoteIsStorageUnavailable() throws IOException {
        remoteConfig.setRequired(true);
        when(blobStore.isConfigured()).thenReturn(true);
        when(blobStore.put(anyString(), any(), anyString(), any()))
                .thenThrow(new BlobStoreException(RemoteErrorCode.BUCKET_NOT_FOUND, "no bucket"));

        IngestionResult result = ingest(AudioFixtures.mp3(8), DeclaredMetadata.of("Ithemba", "Calvin Fallo"), false);

        assertEquals(IngestionErrorType.STORAGE_UNAVAILABLE, result.error().type());
        assertEquals("storage_unavailable", result.error().code());
        assertEquals(0, storedFileCount());
        verify(catalogService, never()).saveTrack(any());
    }

    @Test
    void coverArtIsStoredNextToAudio() {
        when(coverArtService.resolve(any(), any())).thenReturn(Optional.of(
                new ResolvedCover(AudioFixtures.jpeg(), "jpg", "image/jpeg", "embedded")));

        IngestionResult result = ingest(AudioFixtures.mp3(8), DeclaredMetadata.of("Ithemba", "Calvin Fallo"), false);

        assertTrue(result.committed());
        assertEquals(root.resolve("covers/Calvin Fallo - Ithemba.jpg").toString(), result.track().getCoverArtLocation());
    }

    @Test
    void previewExtractsMetadataWithoutStoring() throws IOException {
        Map<TagField, String> values = new EnumMap<>(TagField.class);
        values.put(TagField.TITLE, "Ithemba");
        values.put(TagField.ARTIST, "Calvin Fallo");
        values.put(TagField.YEAR, "2023");
        when(tagReader.read(any(), anyString())).thenReturn(new AudioTags(values, 372, 320, AudioFixtures.jpeg()));

        MetadataPreview preview = ingestionService.previewMetadata(AudioFixtures.mp3(8), FILENAME);

        assertEquals("Ithemba", preview.title());
        assertEquals("Calvin Fallo", preview.artist());
        assertEquals(2023, preview.year());
        assertEquals(372, preview.durationSeconds());
        assertEquals(320, preview.bitrate());
        assertNotNull(preview.coverArt());
        assertEquals(0, storedFileCount());
    }

    @Test
    void previewRejectsUnsupportedType() {
        InvalidAudioException error = assertThrows(InvalidAudioException.class,
                () -> ingestionService.previewMetadata(AudioFixtures.mp3(8), "notes.txt"));

        assertEquals("unsupported_file_type", error.getValidation().getCode().code());
    }

    @Test
    void remoteRaceForTheSameKeyKeepsTheWinnersObjects() throws IOException {
        InMemoryBlobStore bucket = new InMemoryBlobStore();
        IngestionService service = newIngestionService(bucket);
        when(coverArtService.resolve(any(), any())).thenReturn(Optional.of(
                new ResolvedCover(AudioFixtures.jpeg(), "jpg", "image/jpeg", "upload")));
        DeclaredMetadata metadata = DeclaredMetadata.of("Ithemba", "Calvin Fallo");
        List<IngestionResult> concurrent = new ArrayList<>();
        commitAnotherUploadBeforeFirstSave(() -> concurrent.add(
                service.ingest(SubmittedAsset.of(AudioFixtures.mp3(9), FILENAME, "audio/mpeg"), metadata, false)));

        IngestionResult loser = service.ingest(
                SubmittedAsset.of(AudioFixtures.mp3(8), FILENAME, "audio/mpeg"), metadata, false);
        IngestionResult winner = concurrent.get(0);

        assertTrue(winner.committed());
        assertFalse(loser.committed());
        assertEquals(IngestionErrorType.DUPLICATE_CONFLICT, loser.error().type());
        assertEquals(InMemoryBlobStore.BASE_URL + "audio/Calvin Fallo - Ithemba.mp3",
                winner.track().getStoredLocation());
        assertEquals(List.of("audio/Calvin Fallo - Ithemba.mp3", "covers/Calvin Fallo - Ithemba.jpg"),
                bucket.list(""));
        assertArrayEquals(AudioFixtures.mp3(9), bucket.get("audio/Calvin Fallo - Ithemba.mp3"));
        assertEquals(0, storedFileCount());
        verify(producer).send(any());
    }

    @Test
    void localRaceForTheSameKeyStoresTheSecondUploadWithSuffix() throws IOException {
        DeclaredMetadata metadata = DeclaredMetadata.of("Ithemba", "Calvin Fallo");
        List<IngestionResult> concurrent = new ArrayList<>();
        commitAnotherUploadBeforeFirstSave(() -> concurrent.add(ingest(AudioFixtures.mp3(9), metadata, false)));

        IngestionResult first = ingest(AudioFixtures.mp3(8), metadata, false);
        IngestionResult second = concurrent.get(0);

        assertTrue(first.committed());
        assertTrue(second.committed());
        Path firstPath = root.resolve("audio/Calvin Fallo - Ithemba.mp3");
        Path secondPath = root.resolve("audio/Calvin Fallo - Ithemba-1.mp3");
        assertEquals(firstPath.toString(), first.track().getStoredLocation());
        assertEquals(secondPath.toString(), second.track().getStoredLocation());
        assertArrayEquals(AudioFixtures.mp3(8), Files.readAllBytes(firstPath));
        assertArrayEquals(AudioFixtures.mp3(9), Files.readAllBytes(secondPath));
    }

    private IngestionService newIngestionService(BlobStore store) {
        LocalPathResolver resolver = new LocalPathResolver(catalogConfig);
        TieredStorageWriter storageWriter = new TieredStorageWriter(store, new LocalFileStore(resolver), resolver,
                remoteConfig, executor);

        return new IngestionService(
                new AudioFileValidator(catalogConfig, new AudioHeaderProbe()),
                new AudioFingerprinter(tagReader),
                new DuplicateDetector(),
                catalogService,
                coverArtService,
                storageWriter,
                new StorageKeyBuilder(),
                producer);
    }

    /**
     * Catalog that enforces a unique stored location and lets a second upload commit while the
     * first one sits between its storage write and its save.
     */
    private void commitAnotherUploadBeforeFirstSave(Runnable otherUpload) {
        Set<String> takenLocations = new HashSet<>();
        AtomicBoolean raced = new AtomicBoolean();
        doAnswer(invocation -> {
            Track track = invocation.getArgument(0);
            if (raced.compareAndSet(false, true)) {
                otherUpload.run();
            }
            if (!takenLocations.add(track.getStoredLocation())) {
                throw new StoredLocationConflictException(track.getStoredLocation(), null);
            }
            track.setId((long) takenLocations.size());
            return track;
        }).when(catalogService).saveTrack(any(Track.class));
    }

    private IngestionResult ingest(byte[] content, DeclaredMetadata metadata, boolean skipDuplicateCheck) {
        return ingestNamed(content, FILENAME, metadata, skipDuplicateCheck);
    }

    private IngestionResult ingestNamed(byte[] content, String filename, DeclaredMetadata metadata,
                                        boolean skipDuplicateCheck) {
        return ingestionService.ingest(SubmittedAsset.of(content, filename, "audio/mpeg"), metadata, skipDuplicateCheck);
    }

    private Track existingTrack(Long id, String title, String artist, Integer duration) {
        Track track = new Track(title, new Artist(artist));
        track.setId(id);
        track.setDurationSeconds(duration);
        track.setStoredLocation("uploads/audio/" + artist + " - " + title + ".mp3");
        track.setStorageTier(StorageTier.LOCAL);
        return track;
    }

    private long storedFileCount() throws IOException {
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(Files::isRegularFile).count();
        }
    }

    private static String sha256(byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
