package org.stellarcalendar.federation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.stellarcalendar.model.entity.Follow;
import org.stellarcalendar.model.entity.RemoteActor;
import org.stellarcalendar.model.entity.User;
import org.stellarcalendar.repository.BlockedDomainRepository;
import org.stellarcalendar.repository.FollowRepository;
import org.stellarcalendar.repository.UserBlockRepository;
import org.stellarcalendar.repository.UserRepository;
import org.stellarcalendar.service.LocalActorService;
import org.stellarcalendar.service.RemoteActorService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * Directory over the user, follow and block tables plus the remote actor cache.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaDirectory implements Directory {

    private static final String USERS_PATH = "/users/";
    private static final String FOLLOWERS_SUFFIX = "/followers";

    private final UserRepository userRepository;
    private final FollowRepository followRepository;
    private final BlockedDomainRepository blockedDomainRepository;
    private final UserBlockRepository userBlockRepository;
    private final RemoteActorService remoteActorService;
    private final LocalActorService localActorService;

    @Value("${stellar.base-url}")
    private String baseUrl;

    @Override
    public Optional<FederatedActor> findLocalActor(String username) {
        return userRepository.findByUsernameAndEnabledTrue(username)
            .map(localActorService::ensureKeys)
            .map(this::toLocalActor);
    }

    @Override
    public Optional<FederatedActor> findActor(String actorUrl) {
        if (isLocalUrl(actorUrl)) {
            return localUsername(actorUrl).flatMap(this::findLocalActor);
        }
        return remoteActorService.findCached(actorUrl).map(JpaDirectory::toRemoteActor);
    }

    @Override
    public FederatedActor fetchRemoteActor(String actorUrl) {
        return toRemoteActor(remoteActorService.fetchRemoteActor(actorUrl));
    }

    @Override
    @Transactional(readOnly = true)
    public List<FederatedActor> findAcceptedFollowers(String localActorUrl) {
        return followRepository.findAcceptedFollowersByActorUri(localActorUrl).stream()
            .filter(Follow::isRemoteFollower)
            .map(this::followerActor)
            .toList();
    }

    @Override
    public boolean isLocalUrl(String url) {
        return url != null && (url.equals(baseUrl) || url.startsWith(baseUrl + "/"));
    }

    @Override
    public Optional<String> localUsernameOfFollowersCollection(String url) {
        if (!isLocalUrl(url) || !url.endsWith(FOLLOWERS_SUFFIX)) {
            return Optional.empty();
        }
        String actorUrl = url.substring(0, url.length() - FOLLOWERS_SUFFIX.length());
        return localUsername(actorUrl);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isBlocked(String recipientActorUrl, String senderActorUrl) {
        String senderDomain = domainOf(senderActorUrl);
        if (senderDomain != null && blockedDomainRepository.existsByDomainIgnoreCase(senderDomain)) {
            return true;
        }
        if (recipientActorUrl == null) {
            return false;
        }
        Optional<User> recipient = localUsername(recipientActorUrl).flatMap(userRepository::findByUsername);
        if (recipient.isEmpty()) {
            return false;
        }
        return userBlockRepository.existsByUserIdAndBlockedActorUri(recipient.get().getId(), senderActorUrl)
            || (senderDomain != null
                && userBlockRepository.existsByUserIdAndBlockedDomainIgnoreCase(recipient.get().getId(), senderDomain));
    }

    /**
     * Username of a local actor URL of the form {@code {baseUrl}/users/{username}}.
     */
    private Optional<String> localUsername(String actorUrl) {
        String prefix = baseUrl + USERS_PATH;
        if (actorUrl == null || !actorUrl.startsWith(prefix)) {
            return Optional.empty();
        }
        String username = actorUrl.substring(prefix.length());
        if (username.isEmpty() || username.contains("/") || username.contains("#") || username.contains("?")) {
            return Optional.empty();
        }
        return Optional.of(username);
    }

    /**
     * Prefers the cached actor document; falls back to the inboxes recorded with the follow.
     */
    private FederatedActor followerActor(Follow follow) {
        Optional<RemoteActor> cached = remoteActorService.findCached(follow.getRemoteActorUri());
        if (cached.isPresent()) {
            return toRemoteActor(cached.get());
        }
        return FederatedActor.builder()
            .actorUrl(follow.getRemoteActorUri())
            .handle(follow.getRemoteActorUri())
            .inboxUrl(follow.getInboxUrl())
            .sharedInboxUrl(follow.getSharedInboxUrl())
            .remote(true)
            .build();
    }

    private FederatedActor toLocalActor(User user) {
        return FederatedActor.builder()
            .actorUrl(user.getActorUri(baseUrl))
            .handle(user.getUsername())
            .inboxUrl(user.getActorUri(baseUrl) + "/inbox")
            .sharedInboxUrl(baseUrl + "/inbox")
            .publicKeyPem(user.getPublicKey())
            .privateKeyPem(localActorService.privateKeyOf(user))
            .remote(false)
            .localUserId(user.getId())
            .autoAcceptFollowers(user.isAutoAcceptFollowers())
            .build();
    }

    private static FederatedActor toRemoteActor(RemoteActor actor) {
        return FederatedActor.builder()
            .actorUrl(actor.getActorUri())
            .handle(actor.getHandle())
            .inboxUrl(actor.getInboxUrl())
            .sharedInboxUrl(actor.getSharedInboxUrl())
            .publicKeyPem(actor.getPublicKey())
            .remote(true)
            .build();
    }

    private static String domainOf(String url) {
        try {
            String host = URI.create(url).getHost();
            return host != null ? host.toLowerCase() : null;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
