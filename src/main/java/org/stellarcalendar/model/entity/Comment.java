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
 * A comment on an event, received as a Note replying to the event.
 */
@Entity
@Table(name = "comments", indexes = {
    @Index(name = "idx_comment_event_id", columnList = "event_id"),
    @Index(name = "idx_comment_external_id", columnList = "external_id", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Comment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "event_id", nullable = false)
    private UUID eventId;

    @Column(name = "external_id", unique = true, length = 1024)
    private String externalId;

    @Column(name = "author_actor_uri", nullable = false, length = 512)
    private String authorActorUri;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
