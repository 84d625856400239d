package org.stellarcalendar.federation;

import java.time.Instant;

/**
 * Remembers inbound activity ids that were already accepted for processing.
 */
public interface DeduplicationStore {

    /**
     * Atomically records the activity id if it is not yet known.
     * Safe under concurrent calls with the same id: exactly one caller gets {@code true}.
     *
     * @return true if this call created the record
     */
    boolean markProcessed(String activityId);

    boolean isProcessed(String activityId);

    /**
     * Deletes records whose retention has passed.
     *
     * @return number of records removed
     */
    int purgeExpired(Instant now);
}
