package org.stellarcalendar.model.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * A local user's block of a remote actor or of a whole remote domain.
 * Exactly one of {@code blockedActorUri} and {@code blockedDomain} is set.
 */
@Entity
@Table(name = "user_blocks", indexes = {
    @Index(name = "idx_user_block_user", columnList = "user_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserBlock {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "blocked_actor_uri", length = 512)
    private String blockedActorUri;

    @Column(name = "blocked_domain", length = 255)
    private String blockedDomain;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
