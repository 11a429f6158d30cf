package de.bsommerfeld.gamesync.updater.manifest;

import java.security.GeneralSecurityException;
import java.security.Signature;
import java.security.spec.MGF1ParameterSpec;
import java.security.spec.PSSParameterSpec;

/** RSASSA-PSS with SHA-256, MGF1/SHA-256 and a 32 byte salt. */
final class PssSignatures {

    private static final String ALGORITHM = "RSASSA-PSS";
    private static final PSSParameterSpec PARAMETERS =
            new PSSParameterSpec("SHA-256", "MGF1", MGF1ParameterSpec.SHA256, 32, 1);

    private PssSignatures() {
    }

    static Signature newSignature() throws GeneralSecurityException {
        Signature signature = Signature.getInstance(ALGORITHM);
        signature.setParameter(PARAMETERS);
        return signature;
    }
}
