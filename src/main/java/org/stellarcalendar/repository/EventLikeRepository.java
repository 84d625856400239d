package org.stellarcalendar.repository;

import org.stellarcalendar.model.entity.EventLike;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface EventLikeRepository extends JpaRepository<EventLike, UUID> {

    Optional<EventLike> findByEventIdAndActorUri(UUID eventId, String actorUri);

    Optional<EventLike> findByExternalIdAndActorUri(String externalId, String actorUri);

    @Modifying
    @Transactional
    @Query("DELETE FROM EventLike l WHERE l.eventId = :eventId AND l.actorUri = :actorUri")
    int deleteByEventIdAndActorUri(@Param("eventId") UUID eventId, @Param("actorUri") String actorUri);
}
