package org.stellarcalendar.model.activitypub;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * An inbound activity that passed shape validation.
 *
 * @param raw the JSON exactly as received
 */
public record InboundActivity(
    ActivityType type,
    String id,
    String actor,
    Instant published,
    Addressing addressing,
    ActivityObject object,
    JsonNode raw
) {
}
