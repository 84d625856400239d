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
 * Represents a follow relationship between actors (local or remote).
 * A local user following a remote actor has {@code followerId} set; a remote actor
 * following a local user has {@code remoteActorUri} set.
 */
@Entity
@Table(name = "follows", indexes = {
    @Index(name = "idx_follower_id", columnList = "follower_id"),
    @Index(name = "idx_following_actor_uri", columnList = "following_actor_uri"),
    @Index(name = "idx_follow_activity_id", columnList = "activity_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Follow {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    /**
     * The local user who is following.
     * NULL if this is a remote actor following a local user.
     */
    @Column(name = "follower_id")
    private UUID followerId;

    /**
     * The remote actor URI of the follower (for remote-to-local follows).
     */
    @Column(name = "remote_actor_uri", length = 512)
    private String remoteActorUri;

    /**
     * Inbox of the remote follower, captured when the Follow arrived.
     */
    @Column(name = "inbox_url", length = 512)
    private String inboxUrl;

    @Column(name = "shared_inbox_url", length = 512)
    private String sharedInboxUrl;

    /**
     * The ActivityPub actor URI being followed (local or remote).
     */
    @Column(name = "following_actor_uri", nullable = false, length = 512)
    private String followingActorUri;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private FollowStatus status = FollowStatus.PENDING;

    /**
     * The ActivityPub Follow activity ID.
     */
    @Column(name = "activity_id", length = 512)
    private String activityId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public boolean isRemoteFollower() {
        return remoteActorUri != null;
    }

    /**
     * Status of a follow relationship.
     */
    public enum FollowStatus {
        /** Follow request sent, awaiting acceptance */
        PENDING,
        /** Follow request accepted, relationship active */
        ACCEPTED,
        /** Follow request rejected */
        REJECTED
    }
}
