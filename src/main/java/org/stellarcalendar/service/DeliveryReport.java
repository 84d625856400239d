package org.stellarcalendar.service;

import java.util.List;

/**
 * Per-target results of one fan-out.
 */
public record DeliveryReport(String activityId, List<DeliveryResult> results) {

    public static DeliveryReport empty(String activityId) {
        return new DeliveryReport(activityId, List.of());
    }

    public long successCount() {
        return results.stream().filter(DeliveryResult::success).count();
    }

    public long failureCount() {
        return results.size() - successCount();
    }
}
