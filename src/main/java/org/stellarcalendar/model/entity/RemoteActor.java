package org.stellarcalendar.model.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * Represents a remote ActivityPub actor (user from another server).
 * Read-only cache of the remote actor document, refreshed opportunistically.
 */
@Entity
@Table(name = "remote_actors", indexes = {
    @Index(name = "idx_actor_uri", columnList = "actor_uri", unique = true),
    @Index(name = "idx_remote_actor_domain", columnList = "domain")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemoteActor {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    /**
     * The full ActivityPub actor URI.
     * Example: https://events.example/users/alice
     */
    @Column(name = "actor_uri", nullable = false, unique = true, length = 512)
    private String actorUri;

    @Column(nullable = false, length = 255)
    private String username;

    @Column(nullable = false, length = 255)
    private String domain;

    @Column(name = "inbox_url", nullable = false, length = 512)
    private String inboxUrl;

    @Column(name = "outbox_url", length = 512)
    private String outboxUrl;

    /**
     * The actor's shared inbox URL (if available).
     * Preferred over the personal inbox for delivery.
     */
    @Column(name = "shared_inbox_url", length = 512)
    private String sharedInboxUrl;

    /**
     * The actor's public key in PEM format.
     */
    @Column(name = "public_key", columnDefinition = "TEXT")
    private String publicKey;

    @Column(name = "public_key_id", length = 512)
    private String publicKeyId;

    @Column(name = "display_name", length = 255)
    private String displayName;

    @Column(name = "avatar_url", length = 512)
    private String avatarUrl;

    @Column(columnDefinition = "TEXT")
    private String summary;

    /**
     * When the actor document was last fetched.
     */
    @Column(name = "last_fetched_at")
    private Instant lastFetchedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Example: https://events.example/users/alice -> alice@events.example
     */
    public String getHandle() {
        return username + "@" + domain;
    }

    /**
     * The inbox deliveries should go to: the shared inbox when the server exposes one.
     */
    public String getDeliveryInbox() {
        return sharedInboxUrl != null ? sharedInboxUrl : inboxUrl;
    }
}
