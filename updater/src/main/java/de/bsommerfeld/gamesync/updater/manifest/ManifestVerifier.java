package de.bsommerfeld.gamesync.updater.manifest;

import com.google.common.base.CharMatcher;
import de.bsommerfeld.gamesync.updater.model.Manifest;
import de.bsommerfeld.gamesync.updater.model.SignedManifest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.security.Signature;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Checks a manifest signature against the trusted public key before any of
 * its content is interpreted.
 *
 * <h3>Order of operations</h3>
 * <ol>
 * <li>Read the outer envelope (payload tree and signature string).</li>
 * <li>Re-canonicalize the payload without looking at its fields.</li>
 * <li>Verify the signature over the canonical bytes.</li>
 * <li>Only then decode the tree, which validates every path.</li>
 * </ol>
 * A payload that fails step 3 never reaches path validation, let alone the
 * diff engine or the filesystem.
 */
public final class ManifestVerifier {

    private static final Logger LOG = LoggerFactory.getLogger(ManifestVerifier.class);

    private static final CharMatcher LOWER_HEX = CharMatcher.inRange('0', '9').or(CharMatcher.inRange('a', 'f'));

    private final PublicKey publicKey;
    private final ManifestCodec codec;

    public ManifestVerifier(PublicKey publicKey, ManifestCodec codec) {
        this.publicKey = Objects.requireNonNull(publicKey, "publicKey");
        this.codec = codec;
    }

    /**
     * Verifies a manifest in wire format.
     *
     * @throws SignatureInvalidException if the envelope is malformed or the
     *                                   signature does not verify
     */
    public Manifest verify(String wireJson) throws SignatureInvalidException {
        ManifestCodec.Envelope envelope;
        byte[] canonical;
        try {
            envelope = codec.readEnvelope(wireJson);
            canonical = codec.canonicalize(envelope.manifest());
        } catch (ManifestFormatException e) {
            throw rejected("Unreadable manifest envelope: " + e.getMessage(), e);
        }
        checkSignature(canonical, envelope.signature());
        return codec.decode(envelope.manifest());
    }

    /**
     * Verifies a signed manifest whose bytes are taken as received.
     *
     * @throws SignatureInvalidException if the bytes are not JSON or the
     *                                   signature does not verify
     */
    public Manifest verify(SignedManifest signed) throws SignatureInvalidException {
        byte[] canonical;
        try {
            canonical = codec.canonicalize(signed.manifestBytes());
        } catch (ManifestFormatException e) {
            throw rejected("Unreadable manifest bytes: " + e.getMessage(), e);
        }
        checkSignature(canonical, signed.signature());
        return codec.decode(canonical);
    }

    private void checkSignature(byte[] canonical, String signatureHex) throws SignatureInvalidException {
        // lowercase only, as the signer writes it
        if (!LOWER_HEX.matchesAllOf(signatureHex))
            throw rejected("Signature is not lowercase hex", null);
        byte[] signatureBytes;
        try {
            signatureBytes = HexFormat.of().parseHex(signatureHex);
        } catch (IllegalArgumentException e) {
            throw rejected("Signature is not valid hex", e);
        }

        boolean valid;
        try {
            Signature signature = PssSignatures.newSignature();
            signature.initVerify(publicKey);
            signature.update(canonical);
            valid = signature.verify(signatureBytes);
        } catch (GeneralSecurityException e) {
            throw rejected("Signature could not be checked: " + e.getMessage(), e);
        }

        if (!valid)
            throw rejected("Signature does not match manifest content", null);
    }

    private static SignatureInvalidException rejected(String message, Throwable cause) {
        LOG.warn("Rejected manifest: {}", message);
        return cause == null ? new SignatureInvalidException(message) : new SignatureInvalidException(message, cause);
    }
}
