package com.sashkomusic.catalogingest.domain.model;

public enum ValidationMode {
    /**
     * Size and extension checks only.
     */
    LIGHTWEIGHT,
    /**
     * Size and extension checks plus container/codec header parsing.
     */
    FULL
}
