package org.stellarcalendar.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.stellarcalendar.model.entity.FailedDelivery;
import org.stellarcalendar.repository.FailedDeliveryRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Bookkeeping for deliveries that failed and wait for a retry.
 * The next attempt is scheduled {@code 2^attempts} minutes after the last one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FailedDeliveryService {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final FailedDeliveryRepository failedDeliveryRepository;

    /**
     * Creates the record for a failed delivery, or counts another attempt on an existing one.
     */
    @Transactional
    public void recordFailure(String activityId, String activityJson, String targetInbox, String senderActorUri,
                              String error) {
        try {
            FailedDelivery record = failedDeliveryRepository.findByActivityIdAndTargetInbox(activityId, targetInbox)
                .map(existing -> {
                    existing.setAttempts(existing.getAttempts() + 1);
                    return existing;
                })
                .orElseGet(() -> FailedDelivery.builder()
                    .activityId(activityId)
                    .activityJson(activityJson)
                    .targetInbox(targetInbox)
                    .senderActorUri(senderActorUri)
                    .attempts(1)
                    .build());
            record.setLastError(truncate(error));
            record.setNextAttemptAt(nextAttemptAfter(record.getAttempts(), Instant.now()));
            failedDeliveryRepository.save(record);
        } catch (DataIntegrityViolationException e) {
            log.debug("Failure for {} to {} already recorded concurrently", activityId, targetInbox);
        }
    }

    @Transactional(readOnly = true)
    public List<FailedDelivery> findDue(Instant now) {
        return failedDeliveryRepository.findTop100ByNextAttemptAtBeforeOrderByNextAttemptAtAsc(now);
    }

    @Transactional
    public void markRetryFailed(FailedDelivery record, String error) {
        record.setAttempts(record.getAttempts() + 1);
        record.setLastError(truncate(error));
        record.setNextAttemptAt(nextAttemptAfter(record.getAttempts(), Instant.now()));
        failedDeliveryRepository.save(record);
    }

    @Transactional
    public void remove(FailedDelivery record) {
        failedDeliveryRepository.delete(record);
    }

    static Instant nextAttemptAfter(int attempts, Instant lastAttempt) {
        long minutes = 1L << Math.min(attempts, 20);
        return lastAttempt.plus(Duration.ofMinutes(minutes));
    }

    private static String truncate(String error) {
        if (error == null) {
            return null;
        }
        return error.length() > MAX_ERROR_LENGTH ? error.substring(0, MAX_ERROR_LENGTH) : error;
    }
}
