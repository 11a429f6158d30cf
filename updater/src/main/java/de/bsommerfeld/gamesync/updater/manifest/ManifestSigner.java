package de.bsommerfeld.gamesync.updater.manifest;

import de.bsommerfeld.gamesync.updater.model.Manifest;
import de.bsommerfeld.gamesync.updater.model.SignedManifest;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.Signature;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Signs canonical manifest bytes with the publisher's private key.
 * Only the publishing side ever holds an instance of this class.
 */
public final class ManifestSigner {

    private final PrivateKey privateKey;
    private final ManifestCodec codec;

    public ManifestSigner(PrivateKey privateKey, ManifestCodec codec) {
        this.privateKey = Objects.requireNonNull(privateKey, "privateKey");
        this.codec = codec;
    }

    public SignedManifest sign(Manifest manifest) {
        byte[] canonical = codec.canonicalBytes(manifest);
        try {
            Signature signature = PssSignatures.newSignature();
            signature.initSign(privateKey);
            signature.update(canonical);
            return new SignedManifest(canonical, HexFormat.of().formatHex(signature.sign()));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cannot sign manifest", e);
        }
    }

    @Override
    public String toString() {
        return "ManifestSigner[" + privateKey.getAlgorithm() + "]";
    }
}
