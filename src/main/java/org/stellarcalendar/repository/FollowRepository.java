package org.stellarcalendar.repository;

import org.stellarcalendar.model.entity.Follow;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for Follow entity operations.
 */
@Repository
public interface FollowRepository extends JpaRepository<Follow, UUID> {

    /**
     * Find a follow relationship by follower and following actor URI.
     *
     * @param followerId the local follower's user ID
     * @param followingActorUri the actor URI being followed
     * @return the follow relationship if it exists
     */
    Optional<Follow> findByFollowerIdAndFollowingActorUri(UUID followerId, String followingActorUri);

    /**
     * Find all accepted followers of an actor.
     * Pending requests never receive pushes.
     *
     * @param actorUri the actor URI being followed
     * @return list of accepted follow relationships
     */
    @Query("SELECT f FROM Follow f WHERE f.followingActorUri = :actorUri AND f.status = 'ACCEPTED'")
    List<Follow> findAcceptedFollowersByActorUri(@Param("actorUri") String actorUri);

    @Query("SELECT f FROM Follow f WHERE f.followingActorUri = :actorUri AND f.status = 'ACCEPTED'")
    Page<Follow> findAcceptedFollowersByActorUri(@Param("actorUri") String actorUri, Pageable pageable);

    @Query("SELECT COUNT(f) FROM Follow f WHERE f.followingActorUri = :actorUri AND f.status = 'ACCEPTED'")
    long countAcceptedFollowersByActorUri(@Param("actorUri") String actorUri);

    /**
     * Accepted relationships where a local user follows someone.
     *
     * @param followerId the follower's user ID
     * @param pageable page request
     * @return page of accepted follow relationships
     */
    @Query("SELECT f FROM Follow f WHERE f.followerId = :followerId AND f.status = 'ACCEPTED'")
    Page<Follow> findAcceptedFollowingByUserId(@Param("followerId") UUID followerId, Pageable pageable);

    @Query("SELECT COUNT(f) FROM Follow f WHERE f.followerId = :followerId AND f.status = 'ACCEPTED'")
    long countAcceptedFollowingByUserId(@Param("followerId") UUID followerId);

    /**
     * Find a follow relationship by the id of the Follow activity that created it.
     *
     * @param activityId the Follow activity id
     * @return the follow relationship if it exists
     */
    Optional<Follow> findByActivityId(String activityId);

    /**
     * Find a follow relationship by remote actor URI and following actor URI.
     *
     * @param remoteActorUri the remote actor's URI (follower)
     * @param followingActorUri the actor URI being followed
     * @return the follow relationship if it exists
     */
    Optional<Follow> findByRemoteActorUriAndFollowingActorUri(String remoteActorUri, String followingActorUri);

    @Modifying
    @Transactional
    @Query("DELETE FROM Follow f WHERE f.remoteActorUri = :remoteActorUri AND f.followingActorUri = :followingActorUri")
    int deleteRemoteFollower(@Param("remoteActorUri") String remoteActorUri,
                             @Param("followingActorUri") String followingActorUri);
}
