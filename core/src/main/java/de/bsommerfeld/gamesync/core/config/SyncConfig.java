package de.bsommerfeld.gamesync.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of the {@code config.toml} file. Every section has usable defaults so
 * a missing or partial file still yields a runnable configuration.
 *
 * @see ConfigLoader
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncConfig {

    @JsonProperty("debug-mode")
    private boolean debugMode = false;

    @JsonProperty("hashing")
    private HashingConfig hashing = new HashingConfig();

    @JsonProperty("sync")
    private SyncRulesConfig sync = new SyncRulesConfig();

    @JsonProperty("download")
    private DownloadConfig download = new DownloadConfig();

    @JsonProperty("keys")
    private KeyConfig keys = new KeyConfig();

    public boolean isDebugMode() {
        return debugMode;
    }

    public void setDebugMode(boolean debugMode) {
        this.debugMode = debugMode;
    }

    public HashingConfig getHashing() {
        return hashing;
    }

    public SyncRulesConfig getSync() {
        return sync;
    }

    public DownloadConfig getDownload() {
        return download;
    }

    public KeyConfig getKeys() {
        return keys;
    }
}
