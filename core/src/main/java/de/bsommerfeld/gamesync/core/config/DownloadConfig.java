package de.bsommerfeld.gamesync.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class DownloadConfig {

    @JsonProperty("workers")
    private int workers = 4;

    /** Attempts per file before a hash mismatch marks it failed. */
    @JsonProperty("max-attempts")
    private int maxAttempts = 2;

    @JsonProperty("connect-timeout-seconds")
    private int connectTimeoutSeconds = 15;

    @JsonProperty("read-timeout-seconds")
    private int readTimeoutSeconds = 30;

    /** Pending progress events per observer before new ones are dropped. */
    @JsonProperty("progress-queue-limit")
    private int progressQueueLimit = 256;

    public int getWorkers() {
        return workers;
    }

    public void setWorkers(int workers) {
        this.workers = workers;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public int getConnectTimeoutSeconds() {
        return connectTimeoutSeconds;
    }

    public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
        this.connectTimeoutSeconds = connectTimeoutSeconds;
    }

    public int getReadTimeoutSeconds() {
        return readTimeoutSeconds;
    }

    public void setReadTimeoutSeconds(int readTimeoutSeconds) {
        this.readTimeoutSeconds = readTimeoutSeconds;
    }

    public int getProgressQueueLimit() {
        return progressQueueLimit;
    }

    public void setProgressQueueLimit(int progressQueueLimit) {
        this.progressQueueLimit = progressQueueLimit;
    }
}
