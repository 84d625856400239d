package org.stellarcalendar.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.stellarcalendar.federation.DeduplicationStore;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Purges expired deduplication records.
 * Runs daily at 3:30 AM server time.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProcessedActivityCleanupScheduler {

    private final DeduplicationStore deduplicationStore;

    @Scheduled(cron = "${stellar.activitypub.dedup-cleanup-cron:0 30 3 * * *}")
    public void purgeExpiredActivities() {
        log.info("Starting scheduled cleanup of processed activity records");

        try {
            int deletedCount = deduplicationStore.purgeExpired(Instant.now());

            if (deletedCount > 0) {
                log.info("Processed activity cleanup completed. Deleted {} records", deletedCount);
            } else {
                log.info("Processed activity cleanup completed. No records to delete");
            }

        } catch (Exception e) {
            log.error("Processed activity cleanup failed", e);
        }
    }
}
