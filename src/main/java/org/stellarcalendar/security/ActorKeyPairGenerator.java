package org.stellarcalendar.security;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * Generates RSA key pairs for local actors, PEM encoded.
 */
@Component
public class ActorKeyPairGenerator {

    private static final int KEY_SIZE = 2048;

    public PemKeyPair generate() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(KEY_SIZE);
            KeyPair keyPair = generator.generateKeyPair();
            return new PemKeyPair(
                toPem("PUBLIC KEY", keyPair.getPublic().getEncoded()),
                toPem("PRIVATE KEY", keyPair.getPrivate().getEncoded())
            );
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("RSA not available", e);
        }
    }

    private static String toPem(String type, byte[] der) {
        String body = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII)).encodeToString(der);
        return "-----BEGIN " + type + "-----\n" + body + "\n-----END " + type + "-----\n";
    }

    /**
     * Public key as X.509 SubjectPublicKeyInfo, private key as PKCS#8.
     */
    public record PemKeyPair(String publicKeyPem, String privateKeyPem) {
    }
}
