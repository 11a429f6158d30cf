package de.bsommerfeld.gamesync.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Locations of the manifest signing keys. Relative paths resolve against the
 * application data directory. Publishing hosts need both files; clients
 * only ever read the public key.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class KeyConfig {

    @JsonProperty("private-key")
    private String privateKey = "keys/private.pem";

    @JsonProperty("public-key")
    private String publicKey = "keys/public.pem";

    public String getPrivateKey() {
        return privateKey;
    }

    public void setPrivateKey(String privateKey) {
        this.privateKey = privateKey;
    }

    public String getPublicKey() {
        return publicKey;
    }

    public void setPublicKey(String publicKey) {
        this.publicKey = publicKey;
    }
}
