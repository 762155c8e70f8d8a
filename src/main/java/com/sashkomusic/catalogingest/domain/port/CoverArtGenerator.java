package com.sashkomusic.catalogingest.domain.port;

import java.util.Optional;

public interface CoverArtGenerator {

    Optional<byte[]> generate(String title, String artist, String genre);
}
