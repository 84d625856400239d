package org.stellarcalendar.security;

import lombok.extern.slf4j.Slf4j;
import org.stellarcalendar.exception.KeyEncryptionException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Encrypts local actors' private keys at rest with AES-256-GCM.
 *
 * Stored format: {@code iv:authTag:ciphertext}, each part hex encoded.
 */
@Component
@Slf4j
public class PrivateKeyEncryptor {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 16;
    private static final int AUTH_TAG_LENGTH = 16;

    private static final HexFormat HEX = HexFormat.of();

    private final SecureRandom random = new SecureRandom();
    private final SecretKeySpec key;

    public PrivateKeyEncryptor(@Value("${stellar.security.encryption-key}") String encryptionKeyHex) {
        byte[] keyBytes;
        try {
            keyBytes = HEX.parseHex(encryptionKeyHex);
        } catch (IllegalArgumentException e) {
            throw new KeyEncryptionException("Encryption key must be hex encoded", e);
        }
        if (keyBytes.length != 32) {
            throw new KeyEncryptionException("Encryption key must be 32 bytes (64 hex characters), got " + keyBytes.length);
        }
        this.key = new SecretKeySpec(keyBytes, "AES");
    }

    /**
     * Encrypts a PEM private key for storage.
     *
     * @param privateKeyPem plaintext PEM
     * @return encrypted value in {@code iv:authTag:ciphertext} form
     */
    public String encrypt(String privateKeyPem) {
        if (privateKeyPem == null || privateKeyPem.isEmpty()) {
            throw new KeyEncryptionException("Cannot encrypt empty private key");
        }
        try {
            byte[] iv = new byte[IV_LENGTH];
            random.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(AUTH_TAG_LENGTH * 8, iv));
            byte[] sealed = cipher.doFinal(privateKeyPem.getBytes(StandardCharsets.UTF_8));

            // JCE appends the tag to the ciphertext
            byte[] ciphertext = Arrays.copyOfRange(sealed, 0, sealed.length - AUTH_TAG_LENGTH);
            byte[] authTag = Arrays.copyOfRange(sealed, sealed.length - AUTH_TAG_LENGTH, sealed.length);

            return HEX.formatHex(iv) + ":" + HEX.formatHex(authTag) + ":" + HEX.formatHex(ciphertext);
        } catch (GeneralSecurityException e) {
            throw new KeyEncryptionException("Failed to encrypt private key", e);
        }
    }

    /**
     * Decrypts a stored private key.
     *
     * @param encryptedKey value in {@code iv:authTag:ciphertext} form, may be null
     * @return plaintext PEM, or null when no key is stored
     */
    public String decrypt(String encryptedKey) {
        if (encryptedKey == null || encryptedKey.isEmpty()) {
            return null;
        }
        String[] parts = encryptedKey.split(":");
        if (parts.length != 3) {
            throw new KeyEncryptionException("Invalid encrypted key format, expected iv:authTag:ciphertext");
        }
        try {
            byte[] iv = HEX.parseHex(parts[0]);
            byte[] authTag = HEX.parseHex(parts[1]);
            byte[] ciphertext = HEX.parseHex(parts[2]);

            byte[] sealed = new byte[ciphertext.length + authTag.length];
            System.arraycopy(ciphertext, 0, sealed, 0, ciphertext.length);
            System.arraycopy(authTag, 0, sealed, ciphertext.length, authTag.length);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(authTag.length * 8, iv));
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.error("Failed to decrypt private key");
            throw new KeyEncryptionException("Failed to decrypt private key", e);
        }
    }

    /**
     * Whether a stored value has the encrypted format.
     */
    public boolean isEncrypted(String storedKey) {
        return storedKey != null && storedKey.split(":").length == 3;
    }
}
