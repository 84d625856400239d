package org.stellarcalendar.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.stellarcalendar.exception.RemoteFetchException;
import org.stellarcalendar.model.activitypub.WebFingerResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * WebFinger client for discovering ActivityPub actors on remote instances (RFC 7033).
 * Requests go through {@link SafeHttpClient}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebFingerClient {

    private static final String WEBFINGER_PATH = "/.well-known/webfinger";

    private final SafeHttpClient safeHttpClient;
    private final ObjectMapper objectMapper;

    @Value("${stellar.domain}")
    private String localDomain;

    @Value("${stellar.activitypub.federation-protocol:https}")
    private String federationProtocol = "https";

    /**
     * Whether a recipient looks like a handle rather than a URL.
     */
    public static boolean isHandle(String recipient) {
        if (recipient == null) {
            return false;
        }
        String normalized = stripPrefix(recipient);
        return !recipient.contains("://") && normalized.indexOf('@') > 0;
    }

    /**
     * Discovers an actor URL from a handle.
     *
     * @param handle {@code acct:user@domain}, {@code @user@domain} or {@code user@domain}
     * @return the actor URL
     * @throws IllegalArgumentException if the handle is malformed or names the local domain
     * @throws RemoteFetchException if the lookup fails or no ActivityPub link is advertised
     * @throws org.stellarcalendar.exception.UnsafeUrlException if the domain is rejected
     */
    public String discoverActor(String handle) {
        ParsedHandle parsed = parseHandle(handle);
        if (parsed.domain().equalsIgnoreCase(localDomain)) {
            throw new IllegalArgumentException("Cannot discover local users via WebFinger: " + handle);
        }

        String url = UriComponentsBuilder.newInstance()
            .scheme(federationProtocol)
            .host(parsed.hostWithoutPort())
            .port(parsed.port())
            .path(WEBFINGER_PATH)
            .queryParam("resource", "acct:" + parsed.username() + "@" + parsed.domain())
            .build()
            .toUriString();

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.ACCEPT, "application/jrd+json, application/json");
        JsonNode response = safeHttpClient.fetchJson(url, headers);

        String actorUri = readDescriptor(response, handle).actorUrl()
            .orElseThrow(() -> new RemoteFetchException("No ActivityPub actor link found in WebFinger response for " + handle));
        log.info("Discovered actor URI: {} for handle: {}", actorUri, handle);
        return actorUri;
    }

    static ParsedHandle parseHandle(String handle) {
        if (handle == null || handle.isBlank()) {
            throw new IllegalArgumentException("Handle cannot be null or empty");
        }

        String[] parts = stripPrefix(handle.trim()).split("@");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid handle format. Expected: @username@domain or username@domain");
        }

        String username = parts[0].trim();
        String domain = parts[1].trim().toLowerCase();
        if (username.isEmpty() || domain.isEmpty()) {
            throw new IllegalArgumentException("Username and domain cannot be empty");
        }
        if (!username.matches("^[a-zA-Z0-9_.-]+$")) {
            throw new IllegalArgumentException("Invalid username format: " + username);
        }
        if (!domain.matches("^[a-z0-9.-]+(:[0-9]+)?$")) {
            throw new IllegalArgumentException("Invalid domain format: " + domain);
        }
        return new ParsedHandle(username, domain);
    }

    private static String stripPrefix(String handle) {
        if (handle.startsWith("acct:")) {
            return handle.substring(5);
        }
        return handle.startsWith("@") ? handle.substring(1) : handle;
    }

    private WebFingerResponse readDescriptor(JsonNode response, String handle) {
        try {
            return objectMapper.treeToValue(response, WebFingerResponse.class);
        } catch (JsonProcessingException e) {
            throw new RemoteFetchException("Malformed WebFinger response for " + handle, e);
        }
    }

    record ParsedHandle(String username, String domain) {

        String hostWithoutPort() {
            int colon = domain.indexOf(':');
            return colon >= 0 ? domain.substring(0, colon) : domain;
        }

        int port() {
            int colon = domain.indexOf(':');
            return colon >= 0 ? Integer.parseInt(domain.substring(colon + 1)) : -1;
        }
    }
}
