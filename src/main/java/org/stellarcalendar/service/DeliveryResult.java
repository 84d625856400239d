package org.stellarcalendar.service;

/**
 * Outcome of delivering one activity to one inbox.
 *
 * @param statusCode HTTP status when a response was received, otherwise null
 * @param error      failure description, null on success
 */
public record DeliveryResult(String inbox, boolean success, Integer statusCode, String error) {

    public static DeliveryResult success(String inbox, int statusCode) {
        return new DeliveryResult(inbox, true, statusCode, null);
    }

    public static DeliveryResult failure(String inbox, String error) {
        return new DeliveryResult(inbox, false, null, error);
    }
}
