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
 * A calendar event.
 * Local events have {@code userId} set; events received from other instances are
 * cached with their remote object id in {@code externalId}.
 */
@Entity
@Table(name = "events", indexes = {
    @Index(name = "idx_event_external_id", columnList = "external_id", unique = true),
    @Index(name = "idx_event_user_id", columnList = "user_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Event {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    /**
     * Owning local user, NULL for remote events.
     */
    @Column(name = "user_id")
    private UUID userId;

    /**
     * ActivityPub id of a remote event.
     */
    @Column(name = "external_id", unique = true, length = 1024)
    private String externalId;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String summary;

    @Column(length = 500)
    private String location;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    @Column(length = 50)
    private String duration;

    @Column(length = 1024)
    private String url;

    @Column(name = "event_status", length = 50)
    private String eventStatus;

    @Column(name = "event_attendance_mode", length = 50)
    private String eventAttendanceMode;

    @Column(name = "maximum_attendee_capacity")
    private Integer maximumAttendeeCapacity;

    @Column(name = "header_image", length = 1024)
    private String headerImage;

    /**
     * Actor URI of the remote author.
     */
    @Column(name = "attributed_to", length = 512)
    private String attributedTo;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public boolean isRemote() {
        return userId == null;
    }
}
