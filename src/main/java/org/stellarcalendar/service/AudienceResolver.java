package org.stellarcalendar.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.stellarcalendar.federation.Directory;
import org.stellarcalendar.federation.FederatedActor;
import org.stellarcalendar.model.activitypub.ActivityStreams;
import org.stellarcalendar.model.activitypub.Addressing;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Turns addressing into the set of remote inbox URLs to deliver to.
 * Shared inboxes are preferred, so followers on one server collapse into a single target.
 * Resolution never mutates local state beyond the remote actor cache.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AudienceResolver {

    private static final String FOLLOWERS_SUFFIX = "/followers";

    private final Directory directory;
    private final WebFingerClient webFingerClient;

    /**
     * Resolves to, cc and bcc.
     * <ul>
     *   <li>the public collection resolves to the sender's accepted followers</li>
     *   <li>a local followers collection resolves to that actor's accepted followers</li>
     *   <li>a remote followers collection resolves to nothing</li>
     *   <li>a local actor resolves to nothing</li>
     *   <li>a remote actor or handle resolves to its shared inbox, else its personal inbox</li>
     * </ul>
     * A recipient that cannot be resolved is skipped.
     */
    public Set<String> resolveInboxes(Addressing addressing, String senderActorUrl) {
        Set<String> inboxes = new LinkedHashSet<>();

        for (String recipient : addressing.allRecipients()) {
            try {
                inboxes.addAll(resolveRecipient(recipient, senderActorUrl));
            } catch (RuntimeException e) {
                log.warn("Could not resolve recipient {}: {}", recipient, e.getMessage());
            }
        }

        log.debug("Resolved {} recipients from {} to {} inboxes", addressing.allRecipients().size(), senderActorUrl,
            inboxes.size());
        return inboxes;
    }

    /**
     * Inboxes of the accepted followers of an actor. Pending follow requests are excluded.
     */
    public Set<String> getFollowerInboxes(String actorUrl) {
        Set<String> inboxes = new LinkedHashSet<>();
        for (FederatedActor follower : directory.findAcceptedFollowers(actorUrl)) {
            try {
                String inbox = follower.getDeliveryInbox();
                if (inbox == null) {
                    inbox = directory.fetchRemoteActor(follower.getActorUrl()).getDeliveryInbox();
                }
                if (inbox != null && !directory.isLocalUrl(inbox)) {
                    inboxes.add(inbox);
                }
            } catch (RuntimeException e) {
                log.warn("Failed to get inbox for follower {}: {}", follower.getActorUrl(), e.getMessage());
            }
        }
        return inboxes;
    }

    private Set<String> resolveRecipient(String recipient, String senderActorUrl) {
        if (recipient == null || recipient.isBlank()) {
            return Set.of();
        }
        if (ActivityStreams.isPublic(recipient)) {
            return getFollowerInboxes(senderActorUrl);
        }

        Optional<String> followersOwner = directory.localUsernameOfFollowersCollection(recipient);
        if (followersOwner.isPresent()) {
            return getFollowerInboxes(recipient.substring(0, recipient.length() - FOLLOWERS_SUFFIX.length()));
        }
        if (recipient.endsWith(FOLLOWERS_SUFFIX)) {
            log.debug("Not expanding remote followers collection {}", recipient);
            return Set.of();
        }

        String actorUrl = WebFingerClient.isHandle(recipient) ? webFingerClient.discoverActor(recipient) : recipient;
        if (directory.isLocalUrl(actorUrl)) {
            return Set.of();
        }

        FederatedActor actor = directory.findActor(actorUrl)
            .filter(cached -> cached.getDeliveryInbox() != null)
            .orElseGet(() -> directory.fetchRemoteActor(actorUrl));
        if (!actor.isRemote()) {
            return Set.of();
        }
        String inbox = actor.getDeliveryInbox();
        return inbox != null ? Set.of(inbox) : Set.of();
    }
}
