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
 * A delivery attempt to one inbox that did not succeed.
 * Consulted by the retry sweep; never blocks delivery to other inboxes.
 */
@Entity
@Table(name = "failed_deliveries", indexes = {
    @Index(name = "idx_failed_delivery_next_attempt", columnList = "next_attempt_at"),
    @Index(name = "idx_failed_delivery_activity_inbox", columnList = "activity_id, target_inbox", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailedDelivery {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "activity_id", nullable = false, length = 1024)
    private String activityId;

    /**
     * The serialized activity exactly as it was sent (bcc already removed).
     */
    @Column(name = "activity_json", nullable = false, columnDefinition = "TEXT")
    private String activityJson;

    @Column(name = "target_inbox", nullable = false, length = 512)
    private String targetInbox;

    @Column(name = "sender_actor_uri", nullable = false, length = 512)
    private String senderActorUri;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(nullable = false)
    @Builder.Default
    private int attempts = 1;

    @Column(name = "next_attempt_at", nullable = false)
    private Instant nextAttemptAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
