package de.bsommerfeld.gamesync.updater.manifest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.RSAKeyGenParameterSpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * Loads and creates the RSA key pair used for manifest signatures.
 * Keys are stored as PEM: PKCS#8 for the private key, X.509 for the public
 * key. Key material is never logged, only the file locations.
 */
public final class ManifestKeys {

    private static final Logger LOG = LoggerFactory.getLogger(ManifestKeys.class);

    private static final int KEY_SIZE = 2048;
    private static final String PRIVATE_LABEL = "PRIVATE KEY";
    private static final String PUBLIC_LABEL = "PUBLIC KEY";

    private ManifestKeys() {
    }

    /**
     * Loads the key pair, generating and writing a new one if neither file
     * exists. A lone private or public key file is an error rather than
     * being silently replaced.
     */
    public static KeyPair loadOrGenerate(Path privateKeyFile, Path publicKeyFile) throws IOException {
        boolean hasPrivate = Files.exists(privateKeyFile);
        boolean hasPublic = Files.exists(publicKeyFile);

        if (hasPrivate && hasPublic)
            return new KeyPair(loadPublicKey(publicKeyFile), loadPrivateKey(privateKeyFile));
        if (hasPrivate || hasPublic)
            throw new IOException("Incomplete key pair: expected both " + privateKeyFile + " and " + publicKeyFile);

        KeyPair pair = generate();
        write(pair, privateKeyFile, publicKeyFile);
        LOG.info("Generated new signing key pair at {}", publicKeyFile.toAbsolutePath().getParent());
        return pair;
    }

    public static KeyPair generate() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(new RSAKeyGenParameterSpec(KEY_SIZE, RSAKeyGenParameterSpec.F4));
            return generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("RSA key generation unavailable", e);
        }
    }

    public static void write(KeyPair pair, Path privateKeyFile, Path publicKeyFile) throws IOException {
        writePem(privateKeyFile, PRIVATE_LABEL, pair.getPrivate().getEncoded());
        restrictToOwner(privateKeyFile);
        writePem(publicKeyFile, PUBLIC_LABEL, pair.getPublic().getEncoded());
    }

    public static PrivateKey loadPrivateKey(Path file) throws IOException {
        byte[] der = readPem(file, PRIVATE_LABEL);
        try {
            return KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(der));
        } catch (GeneralSecurityException e) {
            throw new IOException("Malformed private key in " + file, e);
        }
    }

    public static PublicKey loadPublicKey(Path file) throws IOException {
        byte[] der = readPem(file, PUBLIC_LABEL);
        try {
            return KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
        } catch (GeneralSecurityException e) {
            throw new IOException("Malformed public key in " + file, e);
        }
    }

    private static void writePem(Path file, String label, byte[] der) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);
        String body = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII)).encodeToString(der);
        String pem = "-----BEGIN " + label + "-----\n" + body + "\n-----END " + label + "-----\n";
        Files.writeString(file, pem, StandardCharsets.US_ASCII);
    }

    private static byte[] readPem(Path file, String label) throws IOException {
        String pem = Files.readString(file, StandardCharsets.US_ASCII);
        String begin = "-----BEGIN " + label + "-----";
        String end = "-----END " + label + "-----";
        int start = pem.indexOf(begin);
        int stop = pem.indexOf(end);
        if (start < 0 || stop < start)
            throw new IOException("No " + label + " block in " + file);
        String body = pem.substring(start + begin.length(), stop).replaceAll("\\s", "");
        try {
            return Base64.getDecoder().decode(body);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid base64 in " + file, e);
        }
    }

    private static void restrictToOwner(Path file) throws IOException {
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix"))
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
    }
}
