package de.bsommerfeld.gamesync.updater.download;

import de.bsommerfeld.gamesync.core.config.DownloadConfig;

/**
 * @param workers     concurrent transfers
 * @param maxAttempts attempts per file when the downloaded bytes do not match
 */
public record OrchestratorSettings(int workers, int maxAttempts) {

    public OrchestratorSettings {
        if (workers < 1)
            throw new IllegalArgumentException("workers must be positive: " + workers);
        if (maxAttempts < 1)
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
    }

    public static OrchestratorSettings defaults() {
        return new OrchestratorSettings(4, 2);
    }

    public static OrchestratorSettings fromConfig(DownloadConfig config) {
        return new OrchestratorSettings(config.getWorkers(), config.getMaxAttempts());
    }
}
