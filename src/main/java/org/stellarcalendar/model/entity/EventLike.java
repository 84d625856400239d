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
 * A like on an event by a (usually remote) actor.
 */
@Entity
@Table(name = "event_likes", uniqueConstraints = {
    @UniqueConstraint(name = "uk_event_like_actor", columnNames = {"event_id", "actor_uri"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventLike {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "event_id", nullable = false)
    private UUID eventId;

    @Column(name = "actor_uri", nullable = false, length = 512)
    private String actorUri;

    /**
     * Id of the Like activity.
     */
    @Column(name = "external_id", length = 1024)
    private String externalId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
