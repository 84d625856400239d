package org.stellarcalendar.repository;

import org.stellarcalendar.model.entity.ProcessedActivity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

/**
 * Repository for processed inbound activity ids.
 */
@Repository
public interface ProcessedActivityRepository extends JpaRepository<ProcessedActivity, UUID> {

    boolean existsByActivityId(String activityId);

    /**
     * Inserts a record unless one already exists for the activity id.
     * Relies on the unique index on activity_id, so concurrent inserts of the same id
     * affect exactly one row in total.
     *
     * @return 1 if this call created the record, 0 if it already existed
     */
    @Modifying
    @Transactional
    @Query(value = "INSERT INTO processed_activities (id, activity_id, expires_at, created_at) " +
        "VALUES (gen_random_uuid(), :activityId, :expiresAt, :createdAt) " +
        "ON CONFLICT (activity_id) DO NOTHING", nativeQuery = true)
    int insertIfAbsent(@Param("activityId") String activityId,
                       @Param("expiresAt") Instant expiresAt,
                       @Param("createdAt") Instant createdAt);

    @Modifying
    @Transactional
    @Query("DELETE FROM ProcessedActivity p WHERE p.expiresAt < :now")
    int deleteExpired(@Param("now") Instant now);
}
