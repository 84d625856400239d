package org.stellarcalendar.service;

/**
 * Terminal states of an inbound POST to a personal or shared inbox.
 * The three accepted states are indistinguishable to the sender.
 */
public enum InboxOutcome {
    ACCEPTED_PROCESSED,
    ACCEPTED_DEDUPLICATED,
    ACCEPTED_DROPPED_BLOCKED,
    REJECTED_UNAUTHENTICATED,
    REJECTED_INVALID,
    NOT_FOUND;

    public boolean isAccepted() {
        return this == ACCEPTED_PROCESSED || this == ACCEPTED_DEDUPLICATED || this == ACCEPTED_DROPPED_BLOCKED;
    }
}
