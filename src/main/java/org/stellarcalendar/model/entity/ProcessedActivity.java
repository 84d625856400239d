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
 * Marks an inbound activity id as handled.
 * At most one row exists per activity id; rows are reaped after {@code expiresAt}.
 */
@Entity
@Table(name = "processed_activities", indexes = {
    @Index(name = "idx_processed_activity_id", columnList = "activity_id", unique = true),
    @Index(name = "idx_processed_expires_at", columnList = "expires_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessedActivity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "activity_id", nullable = false, unique = true, length = 1024)
    private String activityId;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
