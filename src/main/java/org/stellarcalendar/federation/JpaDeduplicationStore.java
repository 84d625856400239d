package org.stellarcalendar.federation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.stellarcalendar.repository.ProcessedActivityRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;

/**
 * Deduplication store backed by the processed_activities table.
 * Uniqueness is enforced by the database, not by a read before the write.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaDeduplicationStore implements DeduplicationStore {

    private final ProcessedActivityRepository processedActivityRepository;

    @Value("${stellar.activitypub.dedup-retention-days:30}")
    private int retentionDays;

    @Override
    @Transactional
    public boolean markProcessed(String activityId) {
        Instant now = Instant.now();
        int inserted = processedActivityRepository.insertIfAbsent(
            activityId, now.plus(Duration.ofDays(retentionDays)), now);
        if (inserted == 0) {
            log.debug("Activity already processed: {}", activityId);
        }
        return inserted > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isProcessed(String activityId) {
        return processedActivityRepository.existsByActivityId(activityId);
    }

    @Override
    @Transactional
    public int purgeExpired(Instant now) {
        return processedActivityRepository.deleteExpired(now);
    }
}
