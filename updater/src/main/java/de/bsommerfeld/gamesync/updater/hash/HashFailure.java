package de.bsommerfeld.gamesync.updater.hash;

/**
 * An entry that could not be read during a hashing walk and was left out
 * of the result.
 */
public record HashFailure(String relativePath, String reason) {
}
