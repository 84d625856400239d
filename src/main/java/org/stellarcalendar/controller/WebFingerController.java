package org.stellarcalendar.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.stellarcalendar.model.activitypub.WebFingerResponse;
import org.stellarcalendar.model.entity.User;
import org.stellarcalendar.repository.UserRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * WebFinger controller for user discovery (RFC 7033).
 *
 * Example: /.well-known/webfinger?resource=acct:username@domain.com
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class WebFingerController {

    private static final String JRD_JSON = "application/jrd+json";

    private final UserRepository userRepository;

    @Value("${stellar.domain}")
    private String domain;

    @Value("${stellar.base-url}")
    private String baseUrl;

    @GetMapping(value = "/.well-known/webfinger", produces = {JRD_JSON, MediaType.APPLICATION_JSON_VALUE})
    public ResponseEntity<WebFingerResponse> webfinger(@RequestParam("resource") String resource) {
        log.debug("WebFinger request for resource: {}", resource);

        String username = parseUsername(resource);
        if (username == null) {
            log.warn("Invalid WebFinger resource: {}", resource);
            return ResponseEntity.badRequest().build();
        }

        Optional<User> userOpt = userRepository.findByUsernameAndEnabledTrue(username);
        if (userOpt.isEmpty()) {
            return ResponseEntity.notFound().build();
        }

        String actorUrl = userOpt.get().getActorUri(baseUrl);
        return ResponseEntity.ok(WebFingerResponse.forLocalActor(username, domain, actorUrl));
    }

    /**
     * Accepts {@code acct:user@domain} and this instance's actor URLs.
     *
     * @return the username, or null when the resource is malformed or names another domain
     */
    private String parseUsername(String resource) {
        String usersPrefix = baseUrl + "/users/";
        if (resource.startsWith(usersPrefix)) {
            String username = resource.substring(usersPrefix.length());
            return username.isEmpty() || username.contains("/") ? null : username;
        }
        if (!resource.startsWith("acct:")) {
            return null;
        }

        String[] parts = resource.substring(5).split("@");
        if (parts.length != 2 || parts[0].isEmpty()) {
            return null;
        }
        if (!parts[1].equalsIgnoreCase(domain)) {
            log.warn("WebFinger request for different domain: {} (ours: {})", parts[1], domain);
            return null;
        }
        return parts[0];
    }
}
