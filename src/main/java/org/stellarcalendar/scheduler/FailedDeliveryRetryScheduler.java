package org.stellarcalendar.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.stellarcalendar.model.entity.FailedDelivery;
import org.stellarcalendar.service.ActivityDeliveryService;
import org.stellarcalendar.service.DeliveryResult;
import org.stellarcalendar.service.FailedDeliveryService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Retries failed deliveries whose backoff has elapsed.
 * Records are dropped after the configured number of attempts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FailedDeliveryRetryScheduler {

    private final FailedDeliveryService failedDeliveryService;
    private final ActivityDeliveryService deliveryService;

    @Value("${stellar.delivery.max-attempts:5}")
    private int maxAttempts;

    @Scheduled(fixedDelayString = "${stellar.delivery.retry-interval:PT1M}", initialDelayString = "PT1M")
    public void retryDueDeliveries() {
        List<FailedDelivery> due;
        try {
            due = failedDeliveryService.findDue(Instant.now());
        } catch (Exception e) {
            log.error("Could not load failed deliveries", e);
            return;
        }
        if (due.isEmpty()) {
            return;
        }

        log.info("Retrying {} failed deliveries", due.size());
        int delivered = 0;
        for (FailedDelivery record : due) {
            try {
                if (retry(record)) {
                    delivered++;
                }
            } catch (Exception e) {
                log.error("Retry of {} to {} failed unexpectedly", record.getActivityId(), record.getTargetInbox(), e);
            }
        }
        log.info("Delivery retry completed. {} of {} delivered", delivered, due.size());
    }

    boolean retry(FailedDelivery record) {
        DeliveryResult result = deliveryService.redeliver(record);
        if (result.success()) {
            failedDeliveryService.remove(record);
            return true;
        }

        if (record.getAttempts() + 1 >= maxAttempts) {
            log.warn("Giving up on {} to {} after {} attempts: {}", record.getActivityId(), record.getTargetInbox(),
                record.getAttempts() + 1, result.error());
            failedDeliveryService.remove(record);
        } else {
            failedDeliveryService.markRetryFailed(record, result.error());
        }
        return false;
    }
}
