package com.sashkomusic.catalogingest.domain.exception;

/**
 * Another track already references the same stored location.
 */
public class StoredLocationConflictException extends CatalogPersistenceException {

    private final String storedLocation;

    public StoredLocationConflictException(String storedLocation, Throwable cause) {
        super("Stored location already in use: " + storedLocation, cause);
        this.storedLocation = storedLocation;
    }

    public String getStoredLocation() {
        return storedLocation;
    }
}
