package org.stellarcalendar.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * Local user account.
 * Each user is published as an ActivityPub Person actor and owns the key pair used
 * to sign its outbound deliveries.
 */
@Entity
@Table(name = "users", indexes = {
    @Index(name = "idx_user_username", columnList = "username", unique = true)
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true, length = 50)
    private String username;

    @Column(name = "display_name", length = 100)
    private String displayName;

    @Column(columnDefinition = "TEXT")
    private String bio;

    @Column(name = "avatar_url")
    private String avatarUrl;

    /**
     * RSA public key (PEM) served in the actor document.
     * Generated lazily on the first actor request when missing.
     */
    @Column(name = "public_key", columnDefinition = "TEXT")
    private String publicKey;

    /**
     * RSA private key (PKCS#8 PEM), AES-GCM encrypted at rest.
     * Format: iv:authTag:ciphertext (hex).
     */
    @Column(name = "private_key", columnDefinition = "TEXT")
    private String privateKey;

    /**
     * Whether incoming Follow requests are accepted without manual approval.
     */
    @Column(name = "auto_accept_followers", nullable = false)
    @Builder.Default
    private boolean autoAcceptFollowers = true;

    @Column(nullable = false)
    @Builder.Default
    private boolean enabled = true;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Gets the ActivityPub actor URI for this user.
     * Format: https://domain/users/{username}
     */
    public String getActorUri(String baseUrl) {
        return String.format("%s/users/%s", baseUrl, username);
    }

    /**
     * Gets the WebFinger account identifier.
     * Format: acct:username@domain
     */
    public String getWebFingerAccount(String domain) {
        return String.format("acct:%s@%s", username, domain);
    }
}
