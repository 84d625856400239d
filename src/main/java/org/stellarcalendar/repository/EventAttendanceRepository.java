package org.stellarcalendar.repository;

import org.stellarcalendar.model.entity.EventAttendance;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface EventAttendanceRepository extends JpaRepository<EventAttendance, UUID> {

    Optional<EventAttendance> findByEventIdAndActorUri(UUID eventId, String actorUri);

    Optional<EventAttendance> findByExternalIdAndActorUri(String externalId, String actorUri);

    @Modifying
    @Transactional
    @Query("DELETE FROM EventAttendance a WHERE a.eventId = :eventId AND a.actorUri = :actorUri")
    int deleteByEventIdAndActorUri(@Param("eventId") UUID eventId, @Param("actorUri") String actorUri);
}
