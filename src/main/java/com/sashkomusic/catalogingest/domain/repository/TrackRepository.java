package com.sashkomusic.catalogingest.domain.repository;

import com.sashkomusic.catalogingest.domain.entity.Track;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TrackRepository extends JpaRepository<Track, Long> {

    @Query("SELECT t FROM Track t LEFT JOIN FETCH t.artist")
    List<Track> findAllWithArtist();

    @Query("SELECT t FROM Track t LEFT JOIN FETCH t.artist " +
           "WHERE t.storedLocation NOT LIKE 'http://%' AND t.storedLocation NOT LIKE 'https://%'")
    List<Track> findAllLocal();
}
