package de.bsommerfeld.gamesync.updater.model;

import java.util.Arrays;

/**
 * The logical content root a manifest describes. Each scope is published
 * and synchronized independently.
 */
public enum ContentScope {

    CLIENT("client"),
    ASSET_INDEX("asset"),
    RUNTIME("jvm");

    private final String wireName;

    ContentScope(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @throws IllegalArgumentException for an unknown wire name
     */
    public static ContentScope fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(s -> s.wireName.equals(wireName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown content scope: " + wireName));
    }
}
