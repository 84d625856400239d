package org.stellarcalendar.service;

import java.util.Map;

/**
 * An inbound inbox POST as received.
 *
 * @param username target user for a personal inbox, null for the shared inbox
 * @param path     request path including the query string, as the sender signed it
 * @param headers  request headers with lower-case names
 * @param body     raw body bytes
 */
public record InboxRequest(String username, String method, String path, Map<String, String> headers, byte[] body) {

    public boolean isSharedInbox() {
        return username == null;
    }

    public String header(String name) {
        return headers.get(name);
    }
}
