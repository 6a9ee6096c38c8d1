package com.z254.butterfly.drift.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Cloud provider whose resources are snapshotted into the configuration tree.
 * <p>
 * The directory name is the first path segment of every snapshot file.
 */
public enum Provider {
    GCP("gcp"),
    AZURE("azure");

    private final String directory;

    Provider(String directory) {
        this.directory = directory;
    }

    public String getDirectory() {
        return directory;
    }

    public static Optional<Provider> fromDirectory(String directory) {
        if (directory == null) {
            return Optional.empty();
        }
        String normalized = directory.toLowerCase(Locale.ROOT);
        for (Provider provider : values()) {
            if (provider.directory.equals(normalized)) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }
}
