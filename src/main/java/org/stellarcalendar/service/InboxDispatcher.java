package org.stellarcalendar.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.stellarcalendar.federation.Directory;
import org.stellarcalendar.federation.FederatedActor;
import org.stellarcalendar.model.activitypub.ActivityObject;
import org.stellarcalendar.model.activitypub.InboundActivity;
import org.stellarcalendar.model.entity.Event;
import org.stellarcalendar.model.entity.EventAttendance;
import org.stellarcalendar.model.entity.EventAttendance.AttendanceStatus;
import org.stellarcalendar.model.entity.EventLike;
import org.stellarcalendar.model.entity.Follow;
import org.stellarcalendar.repository.EventAttendanceRepository;
import org.stellarcalendar.repository.EventLikeRepository;
import org.stellarcalendar.repository.FollowRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Applies accepted inbound activities to local state, off the request thread.
 * Failures are logged; the sender already received its 202.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InboxDispatcher {

    private final Directory directory;
    private final FollowRepository followRepository;
    private final EventLikeRepository eventLikeRepository;
    private final EventAttendanceRepository eventAttendanceRepository;
    private final RemoteContentService remoteContentService;
    private final ActivityBuilder activityBuilder;
    private final ActivityDeliveryService deliveryService;

    /**
     * @param recipientActorUrl the personal inbox owner, or null for the shared inbox
     */
    @Async("inboxExecutor")
    public void dispatch(InboundActivity activity, String recipientActorUrl) {
        try {
            switch (activity.type()) {
                case FOLLOW -> processFollow(activity);
                case ACCEPT -> processResponse(activity, Follow.FollowStatus.ACCEPTED, AttendanceStatus.ATTENDING);
                case REJECT -> processResponse(activity, Follow.FollowStatus.REJECTED, AttendanceStatus.NOT_ATTENDING);
                case TENTATIVE_ACCEPT -> processResponse(activity, null, AttendanceStatus.MAYBE);
                case LIKE -> processLike(activity);
                case UNDO -> processUndo(activity);
                case CREATE -> remoteContentService.handleCreate(activity);
                case UPDATE -> remoteContentService.handleUpdate(activity);
                case DELETE -> remoteContentService.handleDelete(activity);
                case ANNOUNCE -> log.info("Received Announce of {} from {}", activity.object().id(), activity.actor());
            }
        } catch (RuntimeException e) {
            log.error("Error processing {} activity {} from {}", activity.type().getName(), activity.id(),
                activity.actor(), e);
        }
    }

    /**
     * A remote actor follows a local user. Auto-accepting users reply with Accept.
     */
    private void processFollow(InboundActivity activity) {
        String targetUrl = activity.object().id();
        Optional<FederatedActor> target = directory.findActor(targetUrl).filter(actor -> !actor.isRemote());
        if (target.isEmpty()) {
            log.warn("Follow {} targets unknown local actor {}", activity.id(), targetUrl);
            return;
        }
        if (directory.isBlocked(targetUrl, activity.actor())) {
            log.info("Dropping Follow from {} blocked by {}", activity.actor(), targetUrl);
            return;
        }

        FederatedActor follower = directory.fetchRemoteActor(activity.actor());
        FederatedActor localActor = target.get();
        Follow.FollowStatus status = localActor.isAutoAcceptFollowers()
            ? Follow.FollowStatus.ACCEPTED
            : Follow.FollowStatus.PENDING;

        Follow follow = followRepository.findByRemoteActorUriAndFollowingActorUri(activity.actor(), targetUrl)
            .orElseGet(() -> Follow.builder()
                .remoteActorUri(activity.actor())
                .followingActorUri(targetUrl)
                .build());
        follow.setActivityId(activity.id());
        follow.setInboxUrl(follower.getInboxUrl());
        follow.setSharedInboxUrl(follower.getSharedInboxUrl());
        if (follow.getStatus() != Follow.FollowStatus.ACCEPTED) {
            follow.setStatus(status);
        }
        followRepository.save(follow);
        log.info("Processed Follow from {} for {} ({})", activity.actor(), targetUrl, follow.getStatus());

        if (follow.getStatus() == Follow.FollowStatus.ACCEPTED) {
            Map<String, Object> accept = activityBuilder.buildAccept(localActor, activity.raw(), activity.actor());
            deliveryService.deliverToInbox(accept, follower.getDeliveryInbox(), localActor);
        }
    }

    /**
     * Accept, Reject and TentativeAccept either answer a Follow one of our users sent or express an RSVP.
     */
    private void processResponse(InboundActivity activity, Follow.FollowStatus followStatus,
                                 AttendanceStatus attendanceStatus) {
        ActivityObject object = activity.object();

        Optional<Follow> follow = followRepository.findByActivityId(object.id())
            .filter(candidate -> candidate.getFollowerId() != null);
        if (follow.isPresent() || object.hasType("Follow")) {
            if (followStatus == null) {
                log.debug("Ignoring {} of a Follow", activity.type().getName());
                return;
            }
            follow.or(() -> findOutgoingFollow(object, activity.actor()))
                .filter(candidate -> activity.actor().equals(candidate.getFollowingActorUri()))
                .ifPresentOrElse(candidate -> {
                    candidate.setStatus(followStatus);
                    followRepository.save(candidate);
                    log.info("Follow of {} is now {}", activity.actor(), followStatus);
                }, () -> log.warn("No pending follow matches {} from {}", object.id(), activity.actor()));
            return;
        }

        Optional<Event> event = remoteContentService.findEvent(object.id());
        if (event.isEmpty()) {
            log.debug("{} for unknown object {}", activity.type().getName(), object.id());
            return;
        }
        EventAttendance attendance = eventAttendanceRepository
            .findByEventIdAndActorUri(event.get().getId(), activity.actor())
            .orElseGet(() -> EventAttendance.builder()
                .eventId(event.get().getId())
                .actorUri(activity.actor())
                .build());
        attendance.setStatus(attendanceStatus);
        attendance.setExternalId(activity.id());
        attendance.setUpdatedAt(Instant.now());
        save(() -> eventAttendanceRepository.save(attendance), "attendance", activity);
        log.info("RSVP {} from {} for event {}", attendanceStatus, activity.actor(), event.get().getId());
    }

    /**
     * Follow sent by a local user, found via the embedded Follow's actor.
     */
    private Optional<Follow> findOutgoingFollow(ActivityObject embeddedFollow, String followedActorUrl) {
        String localActorUrl = embeddedFollow.text("actor");
        if (localActorUrl == null) {
            return Optional.empty();
        }
        return directory.findActor(localActorUrl)
            .filter(actor -> !actor.isRemote())
            .flatMap(actor -> followRepository.findByFollowerIdAndFollowingActorUri(actor.getLocalUserId(),
                followedActorUrl));
    }

    private void processLike(InboundActivity activity) {
        Optional<Event> event = remoteContentService.findEvent(activity.object().id());
        if (event.isEmpty()) {
            log.debug("Like for unknown object {}", activity.object().id());
            return;
        }
        if (eventLikeRepository.findByEventIdAndActorUri(event.get().getId(), activity.actor()).isPresent()) {
            log.debug("Event {} already liked by {}", event.get().getId(), activity.actor());
            return;
        }
        save(() -> eventLikeRepository.save(EventLike.builder()
            .eventId(event.get().getId())
            .actorUri(activity.actor())
            .externalId(activity.id())
            .build()), "like", activity);
        log.info("Processed Like from {} for event {}", activity.actor(), event.get().getId());
    }

    /**
     * Reverts a Like, Follow or RSVP previously sent by the same actor.
     */
    private void processUndo(InboundActivity activity) {
        ActivityObject undone = activity.object();
        String actor = activity.actor();

        if (!undone.isEmbedded()) {
            undoByActivityId(undone.id(), actor);
            return;
        }
        String innerActor = undone.text("actor");
        if (innerActor != null && !innerActor.equals(actor)) {
            log.warn("Undo from {} wraps an activity by {}", actor, innerActor);
            return;
        }

        String innerObject = undone.text("object");
        if (undone.embedded().path("object").isObject()) {
            innerObject = undone.embedded().path("object").path("id").asText(null);
        }

        switch (undone.type()) {
            case "Follow" -> {
                int removed = innerObject != null ? followRepository.deleteRemoteFollower(actor, innerObject) : 0;
                if (removed == 0) {
                    undoByActivityId(undone.id(), actor);
                } else {
                    log.info("Processed Undo Follow from {} for {}", actor, innerObject);
                }
            }
            case "Like" -> remoteContentService.findEvent(innerObject).ifPresentOrElse(
                event -> {
                    eventLikeRepository.deleteByEventIdAndActorUri(event.getId(), actor);
                    log.info("Processed Undo Like from {} for event {}", actor, event.getId());
                },
                () -> undoByActivityId(undone.id(), actor));
            case "Accept", "TentativeAccept", "Reject" -> remoteContentService.findEvent(innerObject).ifPresentOrElse(
                event -> {
                    eventAttendanceRepository.deleteByEventIdAndActorUri(event.getId(), actor);
                    log.info("Processed Undo {} from {} for event {}", undone.type(), actor, event.getId());
                },
                () -> undoByActivityId(undone.id(), actor));
            default -> log.debug("Ignoring Undo of {}", undone.type());
        }
    }

    private void undoByActivityId(String activityId, String actor) {
        followRepository.findByActivityId(activityId)
            .filter(follow -> actor.equals(follow.getRemoteActorUri()))
            .ifPresent(follow -> {
                followRepository.delete(follow);
                log.info("Processed Undo Follow {}", activityId);
            });
        eventLikeRepository.findByExternalIdAndActorUri(activityId, actor)
            .ifPresent(like -> {
                eventLikeRepository.delete(like);
                log.info("Processed Undo Like {}", activityId);
            });
        eventAttendanceRepository.findByExternalIdAndActorUri(activityId, actor)
            .ifPresent(attendance -> {
                eventAttendanceRepository.delete(attendance);
                log.info("Processed Undo RSVP {}", activityId);
            });
    }

    private void save(Runnable write, String what, InboundActivity activity) {
        try {
            write.run();
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent {} write for {} ignored", what, activity.id());
        }
    }
}
