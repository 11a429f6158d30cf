package de.bsommerfeld.gamesync.updater.manifest;

import de.bsommerfeld.gamesync.updater.api.SyncException;
import de.bsommerfeld.gamesync.updater.hash.DirectoryHasher;
import de.bsommerfeld.gamesync.updater.hash.HashFailure;
import de.bsommerfeld.gamesync.updater.hash.HashedTree;
import de.bsommerfeld.gamesync.updater.model.ContentScope;
import de.bsommerfeld.gamesync.updater.model.Manifest;
import de.bsommerfeld.gamesync.updater.model.SignedManifest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.stream.Collectors;

/**
 * Publishing side of the pipeline: hash a content directory, wrap the tree
 * in a fresh manifest and sign it.
 *
 * <p>
 * Publishing refuses to sign an incomplete tree. A file missing from the
 * manifest would be deleted on every client.
 */
public final class ManifestPublisher {

    private static final Logger LOG = LoggerFactory.getLogger(ManifestPublisher.class);

    private final DirectoryHasher hasher;
    private final ManifestSigner signer;
    private final ManifestCodec codec;
    private final Clock clock;

    public ManifestPublisher(DirectoryHasher hasher, ManifestSigner signer, ManifestCodec codec, Clock clock) {
        this.hasher = hasher;
        this.signer = signer;
        this.codec = codec;
        this.clock = clock;
    }

    /**
     * @throws SyncException if the directory is inaccessible or any entry in
     *                       it could not be hashed
     */
    public SignedManifest publish(Path contentDir, ContentScope scope) throws SyncException {
        HashedTree tree = hasher.hash(contentDir);
        if (!tree.isComplete()) {
            String failed = tree.failures().stream()
                    .map(HashFailure::relativePath)
                    .collect(Collectors.joining(", "));
            throw new SyncException("Cannot publish " + contentDir + ", unreadable entries: " + failed);
        }

        Manifest manifest = new Manifest(tree.root(), clock.instant(), scope);
        SignedManifest signed = signer.sign(manifest);
        LOG.info("Published {} manifest for {} ({} files)", scope.wireName(), contentDir,
                tree.root().files().size());
        return signed;
    }

    /** {@link #publish} followed by serialization to the wire envelope. */
    public String publishWireJson(Path contentDir, ContentScope scope) throws SyncException {
        return codec.toWireJson(publish(contentDir, scope));
    }
}
