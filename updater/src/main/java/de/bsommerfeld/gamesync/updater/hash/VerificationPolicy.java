package de.bsommerfeld.gamesync.updater.hash;

/**
 * Decides per path whether a file is fully hashed or only size-checked.
 *
 * <p>
 * Publisher and client must use the same policy: a fast-checked file carries
 * a placeholder digest in the manifest, and the client has to compute the
 * same placeholder to consider it unchanged.
 */
@FunctionalInterface
public interface VerificationPolicy {

    HashMode modeFor(String relativePath);

    /** Hashes every file. */
    static VerificationPolicy fullHash() {
        return path -> HashMode.FULL;
    }

    /** Hashes files matching {@code fullHashRules}; everything else is size-checked. */
    static VerificationPolicy fastCheckExcept(PathRules fullHashRules) {
        return path -> fullHashRules.matches(path) ? HashMode.FULL : HashMode.FAST;
    }

    /** The expected digest for a file of the given size, or {@code null} if it must be read. */
    default String placeholderFor(String relativePath, long size) {
        return modeFor(relativePath) == HashMode.FAST ? HashUtil.sizePlaceholder(size) : null;
    }
}
