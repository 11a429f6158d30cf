package de.bsommerfeld.gamesync.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Which files a hashing walk considers and how thoroughly each one is hashed.
 * All patterns are regular expressions matched against the forward-slash
 * relative path.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class HashingConfig {

    @JsonProperty("include-patterns")
    private List<String> includePatterns = new ArrayList<>();

    @JsonProperty("exclude-patterns")
    private List<String> excludePatterns = new ArrayList<>();

    /**
     * When enabled, only files matching {@link #fullHashPatterns} are read
     * and hashed; all others are compared by size alone.
     */
    @JsonProperty("fast-check-enabled")
    private boolean fastCheckEnabled = false;

    @JsonProperty("full-hash-patterns")
    private List<String> fullHashPatterns = new ArrayList<>(List.of("\\.jar$", "\\.dll$", "\\.so$", "\\.dylib$"));

    public List<String> getIncludePatterns() {
        return includePatterns;
    }

    public void setIncludePatterns(List<String> includePatterns) {
        this.includePatterns = includePatterns;
    }

    public List<String> getExcludePatterns() {
        return excludePatterns;
    }

    public void setExcludePatterns(List<String> excludePatterns) {
        this.excludePatterns = excludePatterns;
    }

    public boolean isFastCheckEnabled() {
        return fastCheckEnabled;
    }

    public void setFastCheckEnabled(boolean fastCheckEnabled) {
        this.fastCheckEnabled = fastCheckEnabled;
    }

    public List<String> getFullHashPatterns() {
        return fullHashPatterns;
    }

    public void setFullHashPatterns(List<String> fullHashPatterns) {
        this.fullHashPatterns = fullHashPatterns;
    }
}
