package com.sashkomusic.catalogingest.domain.entity;

import com.sashkomusic.catalogingest.domain.model.StorageTier;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Table(
        name = "tracks",
        uniqueConstraints = @UniqueConstraint(name = Track.STORED_LOCATION_CONSTRAINT, columnNames = "stored_location"),
        indexes = @Index(name = "idx_tracks_content_hash", columnList = "content_hash")
)
@Getter
@Setter
public class Track {

    public static final String STORED_LOCATION_CONSTRAINT = "uk_tracks_stored_location";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String title;

    @Column
    private String album;

    @Column
    private String genre;

    @Column
    private Integer year;

    @Column(columnDefinition = "text")
    private String description;

    @Column
    private String tags;

    @Column
    private String originalFilename;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "artist_id")
    private Artist artist;

    @Column
    private Integer durationSeconds; // in seconds

    @Column
    private Double fileSizeMb;

    @Column
    private Integer qualityKbps;

    @Column(name = "stored_location", nullable = false, length = 1024)
    private String storedLocation;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StorageTier storageTier;

    @Column(name = "content_hash", length = 64)
    private String contentHash;

    @Column(length = 1024)
    private String coverArtLocation;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    public Track() {
    }

    public Track(String title, Artist artist) {
        this.title = title;
        this.artist = artist;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public String getArtistName() {
        return artist != null ? artist.getName() : null;
    }

    public boolean isRemote() {
        String location = storedLocation == null ? "" : storedLocation.trim();
        return location.startsWith("http://") || location.startsWith("https://");
    }
}
