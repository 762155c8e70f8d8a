package com.sashkomusic.catalogingest.domain.model;

public record StorageOutcome(
        StorageTier tier,
        String location,
        boolean fellBackFromRemote,
        RemoteWriteResult remoteAttempt
) {
    public static StorageOutcome remote(String url, RemoteWriteResult attempt) {
        return new StorageOutcome(StorageTier.REMOTE, url, false, attempt);
    }

    public static StorageOutcome local(String path, RemoteWriteResult attempt) {
        return new StorageOutcome(StorageTier.LOCAL, path, attempt != null && attempt.wasAttempted(), attempt);
    }
}
