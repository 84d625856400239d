package org.stellarcalendar.repository;

import org.stellarcalendar.model.entity.FailedDelivery;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for failed delivery records awaiting retry.
 */
@Repository
public interface FailedDeliveryRepository extends JpaRepository<FailedDelivery, UUID> {

    Optional<FailedDelivery> findByActivityIdAndTargetInbox(String activityId, String targetInbox);

    /**
     * Records due for another attempt, oldest first.
     */
    List<FailedDelivery> findTop100ByNextAttemptAtBeforeOrderByNextAttemptAtAsc(Instant now);
}
