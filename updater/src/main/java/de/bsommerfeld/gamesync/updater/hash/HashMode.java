package de.bsommerfeld.gamesync.updater.hash;

/** How thoroughly a single file is checked. */
public enum HashMode {

    /** Read the whole file and compute its SHA-256. */
    FULL,

    /** Trust the size and record {@link HashUtil#sizePlaceholder(long)}. */
    FAST
}
