package de.bsommerfeld.gamesync.updater.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Canonical manifest bytes together with their hex-encoded signature.
 * Only ever held until verified; after that the {@link Manifest} is used.
 */
public record SignedManifest(byte[] manifestBytes, String signature) {

    public SignedManifest {
        Objects.requireNonNull(manifestBytes, "manifestBytes");
        Objects.requireNonNull(signature, "signature");
        manifestBytes = manifestBytes.clone();
    }

    @Override
    public byte[] manifestBytes() {
        return manifestBytes.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SignedManifest other
                && Arrays.equals(manifestBytes, other.manifestBytes)
                && signature.equals(other.signature);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(manifestBytes) + signature.hashCode();
    }

    @Override
    public String toString() {
        return "SignedManifest[" + manifestBytes.length + " bytes, signature=" + signature + "]";
    }
}
