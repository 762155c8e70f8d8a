package com.sashkomusic.catalogingest.domain.model;

public enum StorageTier {
    REMOTE,
    LOCAL
}
