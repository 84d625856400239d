package org.stellarcalendar.controller;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.stellarcalendar.model.activitypub.ActivityStreams;
import org.stellarcalendar.model.activitypub.Actor;
import org.stellarcalendar.model.activitypub.EventObject;
import org.stellarcalendar.model.activitypub.OrderedCollection;
import org.stellarcalendar.model.activitypub.OrderedCollectionPage;
import org.stellarcalendar.model.entity.Event;
import org.stellarcalendar.model.entity.Follow;
import org.stellarcalendar.model.entity.User;
import org.stellarcalendar.repository.EventRepository;
import org.stellarcalendar.repository.FollowRepository;
import org.stellarcalendar.repository.UserRepository;
import org.stellarcalendar.service.InboxOutcome;
import org.stellarcalendar.service.InboxRequest;
import org.stellarcalendar.service.InboxService;
import org.stellarcalendar.service.LocalActorService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * ActivityPub protocol controller.
 * Implements ActivityPub server-to-server (S2S) protocol endpoints.
 *
 * Spec: https://www.w3.org/TR/activitypub/
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class ActivityPubController {

    private final UserRepository userRepository;
    private final FollowRepository followRepository;
    private final EventRepository eventRepository;
    private final LocalActorService localActorService;
    private final InboxService inboxService;

    @Value("${stellar.base-url}")
    private String baseUrl;

    @Value("${stellar.activitypub.page-size:20}")
    private int pageSize = 20;

    /**
     * Actor profile endpoint. Keys are generated on first request when the user has none.
     */
    @GetMapping(
        value = "/users/{username}",
        produces = {ActivityStreams.ACTIVITY_JSON, ActivityStreams.LD_JSON, MediaType.APPLICATION_JSON_VALUE}
    )
    public ResponseEntity<Actor> getActor(@PathVariable String username) {
        log.debug("ActivityPub actor request for user: {}", username);

        Optional<User> userOpt = userRepository.findByUsernameAndEnabledTrue(username);
        if (userOpt.isEmpty()) {
            log.warn("User not found for ActivityPub request: {}", username);
            return ResponseEntity.notFound().build();
        }

        User user = localActorService.ensureKeys(userOpt.get());
        return ResponseEntity.ok()
            .contentType(MediaType.parseMediaType(ActivityStreams.ACTIVITY_JSON))
            .body(Actor.fromUser(user, baseUrl));
    }

    /**
     * Personal inbox.
     */
    @PostMapping("/users/{username}/inbox")
    public ResponseEntity<Void> inbox(@PathVariable String username,
                                      @RequestBody(required = false) byte[] body,
                                      HttpServletRequest request) {
        return toResponse(inboxService.receive(toInboxRequest(username, body, request)));
    }

    /**
     * Shared inbox.
     */
    @PostMapping("/inbox")
    public ResponseEntity<Void> sharedInbox(@RequestBody(required = false) byte[] body, HttpServletRequest request) {
        return toResponse(inboxService.receive(toInboxRequest(null, body, request)));
    }

    /**
     * Followers collection. Without {@code page} a summary is returned, with it a 1-based page of actor URLs.
     */
    @GetMapping(
        value = "/users/{username}/followers",
        produces = {ActivityStreams.ACTIVITY_JSON, ActivityStreams.LD_JSON, MediaType.APPLICATION_JSON_VALUE}
    )
    public ResponseEntity<Object> followers(@PathVariable String username,
                                            @RequestParam(required = false) Integer page) {
        Optional<User> userOpt = userRepository.findByUsernameAndEnabledTrue(username);
        if (userOpt.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        String actorUrl = userOpt.get().getActorUri(baseUrl);
        String collectionId = actorUrl + "/followers";
        long total = followRepository.countAcceptedFollowersByActorUri(actorUrl);

        return collection(collectionId, total, page, pageRequest ->
            followRepository.findAcceptedFollowersByActorUri(actorUrl, pageRequest)
                .map(this::followerActorUrl));
    }

    @GetMapping(
        value = "/users/{username}/following",
        produces = {ActivityStreams.ACTIVITY_JSON, ActivityStreams.LD_JSON, MediaType.APPLICATION_JSON_VALUE}
    )
    public ResponseEntity<Object> following(@PathVariable String username,
                                            @RequestParam(required = false) Integer page) {
        Optional<User> userOpt = userRepository.findByUsernameAndEnabledTrue(username);
        if (userOpt.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        UUID userId = userOpt.get().getId();
        String collectionId = userOpt.get().getActorUri(baseUrl) + "/following";
        long total = followRepository.countAcceptedFollowingByUserId(userId);

        return collection(collectionId, total, page, pageRequest ->
            followRepository.findAcceptedFollowingByUserId(userId, pageRequest)
                .map(Follow::getFollowingActorUri));
    }

    /**
     * Outbox: the user's events as Create activities, newest first.
     */
    @GetMapping(
        value = "/users/{username}/outbox",
        produces = {ActivityStreams.ACTIVITY_JSON, ActivityStreams.LD_JSON, MediaType.APPLICATION_JSON_VALUE}
    )
    public ResponseEntity<Object> outbox(@PathVariable String username,
                                         @RequestParam(required = false) Integer page) {
        Optional<User> userOpt = userRepository.findByUsernameAndEnabledTrue(username);
        if (userOpt.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        User user = userOpt.get();
        String actorUrl = user.getActorUri(baseUrl);
        long total = eventRepository.countByUserId(user.getId());

        return collection(actorUrl + "/outbox", total, page, pageRequest ->
            eventRepository.findByUserIdOrderByCreatedAtDesc(user.getId(), pageRequest)
                .map(event -> createActivity(event, actorUrl)));
    }

    /**
     * Public Event object for a local event.
     */
    @GetMapping(
        value = "/events/{id}",
        produces = {ActivityStreams.ACTIVITY_JSON, ActivityStreams.LD_JSON, MediaType.APPLICATION_JSON_VALUE}
    )
    public ResponseEntity<EventObject> event(@PathVariable UUID id) {
        Optional<Event> eventOpt = eventRepository.findById(id).filter(event -> !event.isRemote());
        if (eventOpt.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        Optional<User> owner = userRepository.findById(eventOpt.get().getUserId());
        if (owner.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok()
            .contentType(MediaType.parseMediaType(ActivityStreams.ACTIVITY_JSON))
            .body(EventObject.fromEvent(eventOpt.get(), eventUrl(eventOpt.get()), owner.get().getActorUri(baseUrl)));
    }

    private ResponseEntity<Object> collection(String collectionId, long total, Integer page,
                                              Function<PageRequest, Page<?>> loader) {
        if (page == null) {
            return ResponseEntity.ok(OrderedCollection.summary(collectionId, total));
        }
        if (page < 1) {
            return ResponseEntity.badRequest().build();
        }
        int totalPages = (int) Math.max(1, (total + pageSize - 1) / pageSize);
        List<Object> items = new ArrayList<>(loader.apply(PageRequest.of(page - 1, pageSize)).getContent());
        items.removeIf(Objects::isNull);
        return ResponseEntity.ok(OrderedCollectionPage.of(collectionId, page, totalPages, total, items));
    }

    private String followerActorUrl(Follow follow) {
        if (follow.isRemoteFollower()) {
            return follow.getRemoteActorUri();
        }
        return userRepository.findById(follow.getFollowerId())
            .map(user -> user.getActorUri(baseUrl))
            .orElse(null);
    }

    private Map<String, Object> createActivity(Event event, String actorUrl) {
        String eventUrl = eventUrl(event);
        Map<String, Object> create = new LinkedHashMap<>();
        create.put("id", eventUrl + "/activity");
        create.put("type", "Create");
        create.put("actor", actorUrl);
        create.put("published", event.getCreatedAt() != null ? event.getCreatedAt().toString() : null);
        create.put("to", List.of(ActivityStreams.PUBLIC_COLLECTION));
        create.put("cc", List.of(actorUrl + "/followers"));
        create.put("object", EventObject.fromEvent(event, eventUrl, actorUrl));
        return create;
    }

    private String eventUrl(Event event) {
        return baseUrl + "/events/" + event.getId();
    }

    private static InboxRequest toInboxRequest(String username, byte[] body, HttpServletRequest request) {
        Map<String, String> headers = new HashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.put(name.toLowerCase(Locale.ROOT), request.getHeader(name));
        }
        String path = request.getRequestURI();
        if (request.getQueryString() != null) {
            path += "?" + request.getQueryString();
        }
        return new InboxRequest(username, request.getMethod(), path, headers, body == null ? new byte[0] : body);
    }

    /**
     * The single place where inbox outcomes become HTTP statuses.
     */
    static ResponseEntity<Void> toResponse(InboxOutcome outcome) {
        HttpStatus status = switch (outcome) {
            case ACCEPTED_PROCESSED, ACCEPTED_DEDUPLICATED, ACCEPTED_DROPPED_BLOCKED -> HttpStatus.ACCEPTED;
            case REJECTED_UNAUTHENTICATED -> HttpStatus.UNAUTHORIZED;
            case REJECTED_INVALID -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
        };
        return ResponseEntity.status(status).build();
    }
}
