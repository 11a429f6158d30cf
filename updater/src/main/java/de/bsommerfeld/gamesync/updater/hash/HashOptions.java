package de.bsommerfeld.gamesync.updater.hash;

import de.bsommerfeld.gamesync.core.config.HashingConfig;

import java.util.Objects;

/**
 * Filters and verification policy for a hashing walk.
 *
 * @param include files considered at all; empty means every file
 * @param exclude directories and files skipped entirely
 * @param policy  full hash or size check per file
 */
public record HashOptions(PathRules include, PathRules exclude, VerificationPolicy policy) {

    public HashOptions {
        Objects.requireNonNull(include, "include");
        Objects.requireNonNull(exclude, "exclude");
        Objects.requireNonNull(policy, "policy");
    }

    public static HashOptions defaults() {
        return new HashOptions(PathRules.none(), PathRules.none(), VerificationPolicy.fullHash());
    }

    public static HashOptions fromConfig(HashingConfig config) {
        VerificationPolicy policy = config.isFastCheckEnabled()
                ? VerificationPolicy.fastCheckExcept(PathRules.of(config.getFullHashPatterns()))
                : VerificationPolicy.fullHash();
        return new HashOptions(
                PathRules.of(config.getIncludePatterns()),
                PathRules.of(config.getExcludePatterns()),
                policy);
    }

    boolean considers(String relativePath) {
        return include.isEmpty() || include.matches(relativePath);
    }
}
