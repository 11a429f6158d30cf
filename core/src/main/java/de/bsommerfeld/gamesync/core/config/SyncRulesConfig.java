package de.bsommerfeld.gamesync.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Client-side reconciliation rules.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncRulesConfig {

    /** User-owned paths inside the install root that a sync never deletes. */
    @JsonProperty("exclusion-patterns")
    private List<String> exclusionPatterns = new ArrayList<>(
            List.of("^saves/", "^screenshots/", "^logs/", "^options\\.txt$", "^servers\\.dat$"));

    /** Unchanged files matching these are re-hashed on every sync. */
    @JsonProperty("recheck-patterns")
    private List<String> recheckPatterns = new ArrayList<>();

    public List<String> getExclusionPatterns() {
        return exclusionPatterns;
    }

    public void setExclusionPatterns(List<String> exclusionPatterns) {
        this.exclusionPatterns = exclusionPatterns;
    }

    public List<String> getRecheckPatterns() {
        return recheckPatterns;
    }

    public void setRecheckPatterns(List<String> recheckPatterns) {
        this.recheckPatterns = recheckPatterns;
    }
}
