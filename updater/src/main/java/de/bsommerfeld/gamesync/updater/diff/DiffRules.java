package de.bsommerfeld.gamesync.updater.diff;

import de.bsommerfeld.gamesync.core.config.SyncRulesConfig;
import de.bsommerfeld.gamesync.updater.hash.PathRules;

import java.util.Objects;

/**
 * @param exclusions local paths that are never deleted or overwritten by a
 *                   type conflict (saves, settings, logs)
 * @param recheck    unchanged files that are re-hashed on every sync anyway
 */
public record DiffRules(PathRules exclusions, PathRules recheck) {

    public DiffRules {
        Objects.requireNonNull(exclusions, "exclusions");
        Objects.requireNonNull(recheck, "recheck");
    }

    public static DiffRules none() {
        return new DiffRules(PathRules.none(), PathRules.none());
    }

    public static DiffRules fromConfig(SyncRulesConfig config) {
        return new DiffRules(PathRules.of(config.getExclusionPatterns()), PathRules.of(config.getRecheckPatterns()));
    }
}
