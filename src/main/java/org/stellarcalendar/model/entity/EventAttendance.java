package org.stellarcalendar.model.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * RSVP state of an actor for an event.
 */
@Entity
@Table(name = "event_attendance", uniqueConstraints = {
    @UniqueConstraint(name = "uk_event_attendance_actor", columnNames = {"event_id", "actor_uri"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventAttendance {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "event_id", nullable = false)
    private UUID eventId;

    @Column(name = "actor_uri", nullable = false, length = 512)
    private String actorUri;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AttendanceStatus status;

    /**
     * Id of the Accept / TentativeAccept / Reject activity that set this status.
     */
    @Column(name = "external_id", length = 1024)
    private String externalId;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public enum AttendanceStatus {
        /** Accept */
        ATTENDING,
        /** TentativeAccept */
        MAYBE,
        /** Reject */
        NOT_ATTENDING
    }
}
