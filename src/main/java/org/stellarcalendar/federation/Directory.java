package org.stellarcalendar.federation;

import java.util.List;
import java.util.Optional;

/**
 * Actor and follower lookup used by the audience resolver and the inbox processor.
 */
public interface Directory {

    /**
     * Finds an enabled local actor by username.
     */
    Optional<FederatedActor> findLocalActor(String username);

    /**
     * Finds an actor by URL, local or already cached remote. Never touches the network.
     */
    Optional<FederatedActor> findActor(String actorUrl);

    /**
     * Fetches a remote actor document through the SSRF guard and caches it.
     *
     * @throws org.stellarcalendar.exception.RemoteFetchException if the actor cannot be fetched
     * @throws org.stellarcalendar.exception.UnsafeUrlException if the URL is rejected
     */
    FederatedActor fetchRemoteActor(String actorUrl);

    /**
     * Accepted remote followers of a local actor. Pending requests are never included.
     */
    List<FederatedActor> findAcceptedFollowers(String localActorUrl);

    boolean isLocalUrl(String url);

    /**
     * Returns the username when the URL is the followers collection of a local actor.
     */
    Optional<String> localUsernameOfFollowersCollection(String url);

    /**
     * Whether the sender, or the sender's domain, is blocked instance-wide or by the recipient.
     *
     * @param recipientActorUrl local recipient, or null for the shared inbox
     */
    boolean isBlocked(String recipientActorUrl, String senderActorUrl);
}
