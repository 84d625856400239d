package org.stellarcalendar.model.activitypub;

/**
 * Outcome of parsing an inbound payload: a typed activity or the reason it was rejected.
 */
public sealed interface ActivityParseResult {

    record Parsed(InboundActivity activity) implements ActivityParseResult {
    }

    record Rejected(String reason) implements ActivityParseResult {
    }

    static ActivityParseResult parsed(InboundActivity activity) {
        return new Parsed(activity);
    }

    static ActivityParseResult rejected(String reason) {
        return new Rejected(reason);
    }
}
