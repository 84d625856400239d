package org.stellarcalendar.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.stellarcalendar.model.entity.User;
import org.stellarcalendar.repository.UserRepository;
import org.stellarcalendar.security.ActorKeyPairGenerator;
import org.stellarcalendar.security.PrivateKeyEncryptor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Key management for local actors.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LocalActorService {

    private final UserRepository userRepository;
    private final ActorKeyPairGenerator keyPairGenerator;
    private final PrivateKeyEncryptor privateKeyEncryptor;

    /**
     * Generates and stores a key pair for a user that has none yet.
     * The private key is stored encrypted.
     *
     * @return the user, with keys
     */
    @Transactional
    public User ensureKeys(User user) {
        if (user.getPublicKey() != null && user.getPrivateKey() != null) {
            return user;
        }
        ActorKeyPairGenerator.PemKeyPair keyPair = keyPairGenerator.generate();
        user.setPublicKey(keyPair.publicKeyPem());
        user.setPrivateKey(privateKeyEncryptor.encrypt(keyPair.privateKeyPem()));
        log.info("Generated key pair for user {}", user.getUsername());
        return userRepository.save(user);
    }

    /**
     * Decrypted private key of a user, or null when none is stored.
     */
    public String privateKeyOf(User user) {
        return privateKeyEncryptor.decrypt(user.getPrivateKey());
    }
}
