package org.stellarcalendar.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.stellarcalendar.model.activitypub.ActivityObject;
import org.stellarcalendar.model.activitypub.EventObject;
import org.stellarcalendar.model.activitypub.InboundActivity;
import org.stellarcalendar.model.entity.Comment;
import org.stellarcalendar.model.entity.Event;
import org.stellarcalendar.repository.CommentRepository;
import org.stellarcalendar.repository.EventRepository;
import org.stellarcalendar.util.HtmlText;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Keeps the local cache of remote events and comments in step with Create, Update and Delete activities.
 * Content is only changed on behalf of the actor it is attributed to.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RemoteContentService {

    private static final String EVENTS_PATH = "/events/";

    private final EventRepository eventRepository;
    private final CommentRepository commentRepository;
    private final RemoteActorService remoteActorService;
    private final ObjectMapper objectMapper;

    @Value("${stellar.base-url}")
    private String baseUrl;

    /**
     * Finds a local event by its public URL or a cached remote event by its object id.
     */
    @Transactional(readOnly = true)
    public Optional<Event> findEvent(String objectUrl) {
        if (objectUrl == null) {
            return Optional.empty();
        }
        String prefix = baseUrl + EVENTS_PATH;
        if (objectUrl.startsWith(prefix)) {
            try {
                return eventRepository.findById(UUID.fromString(objectUrl.substring(prefix.length())));
            } catch (IllegalArgumentException e) {
                return Optional.empty();
            }
        }
        return eventRepository.findByExternalId(objectUrl);
    }

    @Transactional
    public void handleCreate(InboundActivity activity) {
        ActivityObject object = activity.object();
        if (object.hasType("Event")) {
            upsertEvent(activity.actor(), object);
        } else if (object.hasType("Note")) {
            createComment(activity.actor(), object);
        } else {
            log.debug("Ignoring Create of {}", object.type());
        }
    }

    @Transactional
    public void handleUpdate(InboundActivity activity) {
        ActivityObject object = activity.object();
        if (object.hasType("Event")) {
            upsertEvent(activity.actor(), object);
        } else if (object.hasType("Person") || object.hasType("Service") || object.hasType("Group")) {
            remoteActorService.updateFromDocument(activity.actor(), object.embedded())
                .ifPresent(actor -> log.info("Refreshed remote actor {}", actor.getActorUri()));
        } else {
            log.debug("Ignoring Update of {}", object.type());
        }
    }

    @Transactional
    public void handleDelete(InboundActivity activity) {
        ActivityObject object = activity.object();
        String objectId = object.id();

        if (isComment(object)) {
            commentRepository.findByExternalId(objectId)
                .filter(comment -> activity.actor().equals(comment.getAuthorActorUri()))
                .ifPresentOrElse(comment -> {
                    commentRepository.delete(comment);
                    log.info("Deleted remote comment {}", objectId);
                }, () -> log.debug("No comment {} owned by {}", objectId, activity.actor()));
            return;
        }

        List<Event> events = eventRepository.findAllByExternalIdAndAttributedTo(objectId, activity.actor());
        if (events.isEmpty()) {
            log.debug("No cached event {} owned by {}", objectId, activity.actor());
            return;
        }
        eventRepository.deleteAll(events);
        log.info("Deleted {} cached event(s) {}", events.size(), objectId);
    }

    private boolean isComment(ActivityObject object) {
        if (object.hasType("Note")) {
            return true;
        }
        if (object.hasType("Tombstone") && "Note".equals(object.text("formerType"))) {
            return true;
        }
        return object.id().contains("/comments/") || commentRepository.existsByExternalId(object.id());
    }

    private void upsertEvent(String actorUrl, ActivityObject object) {
        EventObject remote;
        try {
            remote = objectMapper.treeToValue(object.embedded(), EventObject.class);
        } catch (JsonProcessingException e) {
            log.warn("Malformed Event {}: {}", object.id(), e.getOriginalMessage());
            return;
        }

        String attributedTo = remote.getAttributedTo() != null ? remote.getAttributedTo() : actorUrl;
        if (!attributedTo.equals(actorUrl)) {
            log.warn("Event {} is attributed to {} but was sent by {}", object.id(), attributedTo, actorUrl);
            return;
        }
        Instant startTime = parseTime(remote.getStartTime());
        if (remote.getName() == null || startTime == null) {
            log.warn("Event {} lacks a name or a valid startTime", object.id());
            return;
        }

        Optional<Event> existing = eventRepository.findByExternalId(object.id());
        if (existing.isPresent() && !actorUrl.equals(existing.get().getAttributedTo())) {
            log.warn("Actor {} may not modify event {}", actorUrl, object.id());
            return;
        }

        Event event = existing.orElseGet(() -> Event.builder().externalId(object.id()).build());
        event.setAttributedTo(actorUrl);
        event.setTitle(HtmlText.strip(remote.getName()));
        event.setSummary(HtmlText.strip(remote.getSummary() != null ? remote.getSummary() : remote.getContent()));
        event.setLocation(HtmlText.strip(remote.locationText()));
        event.setStartTime(startTime);
        event.setEndTime(parseTime(remote.getEndTime()));
        event.setDuration(remote.getDuration());
        event.setUrl(remote.getUrl() != null ? remote.getUrl() : object.id());
        event.setEventStatus(remote.getEventStatus());
        event.setEventAttendanceMode(remote.getEventAttendanceMode());
        event.setMaximumAttendeeCapacity(remote.getMaximumAttendeeCapacity());
        event.setHeaderImage(remote.headerImageUrl());

        eventRepository.save(event);
        log.info("{} remote event {}", existing.isPresent() ? "Updated" : "Cached", object.id());
    }

    private void createComment(String actorUrl, ActivityObject object) {
        String inReplyTo = object.text("inReplyTo");
        Optional<Event> event = findEvent(inReplyTo);
        if (event.isEmpty()) {
            log.debug("Ignoring Note {} not replying to a known event", object.id());
            return;
        }
        String attributedTo = object.text("attributedTo");
        if (attributedTo != null && !attributedTo.equals(actorUrl)) {
            log.warn("Note {} is attributed to {} but was sent by {}", object.id(), attributedTo, actorUrl);
            return;
        }
        if (commentRepository.existsByExternalId(object.id())) {
            log.debug("Comment {} already stored", object.id());
            return;
        }
        String content = HtmlText.strip(object.text("content"));
        if (content == null || content.isEmpty()) {
            log.debug("Ignoring empty Note {}", object.id());
            return;
        }

        commentRepository.save(Comment.builder()
            .eventId(event.get().getId())
            .externalId(object.id())
            .authorActorUri(actorUrl)
            .content(content)
            .build());
        log.info("Stored remote comment {} on event {}", object.id(), event.get().getId());
    }

    private static Instant parseTime(String value) {
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
