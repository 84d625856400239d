package org.stellarcalendar.service;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.stellarcalendar.exception.RemoteFetchException;
import org.stellarcalendar.model.entity.RemoteActor;
import org.stellarcalendar.repository.RemoteActorRepository;
import org.stellarcalendar.util.HtmlText;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Fetches remote actor documents and keeps a local cache of them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RemoteActorService {

    private final RemoteActorRepository remoteActorRepository;
    private final SafeHttpClient safeHttpClient;

    @Value("${stellar.activitypub.remote-actor-cache-ttl:1h}")
    private Duration cacheTtl = Duration.ofHours(1);

    public Optional<RemoteActor> findCached(String actorUri) {
        return remoteActorRepository.findByActorUri(actorUri);
    }

    /**
     * Returns the cached actor while it is fresh, otherwise fetches and caches the document.
     *
     * @throws RemoteFetchException if the actor cannot be fetched or is not a usable actor document
     * @throws org.stellarcalendar.exception.UnsafeUrlException if the URL is rejected
     */
    public RemoteActor fetchRemoteActor(String actorUri) {
        RemoteActor cached = remoteActorRepository.findByActorUri(actorUri).orElse(null);
        if (cached != null && cached.getLastFetchedAt() != null
            && cached.getLastFetchedAt().isAfter(Instant.now().minus(cacheTtl))) {
            log.debug("Using cached actor info for: {}", actorUri);
            return cached;
        }

        log.info("Fetching remote actor: {}", actorUri);
        JsonNode document = safeHttpClient.fetchJson(actorUri);
        return storeDocument(actorUri, document, cached);
    }

    /**
     * Refreshes a cached actor from a document received in an Update activity.
     * The document id must be the actor that sent it.
     */
    public Optional<RemoteActor> updateFromDocument(String senderActorUri, JsonNode document) {
        String id = document.path("id").asText(null);
        if (!senderActorUri.equals(id)) {
            log.warn("Ignoring actor update for {} sent by {}", id, senderActorUri);
            return Optional.empty();
        }
        RemoteActor cached = remoteActorRepository.findByActorUri(senderActorUri).orElse(null);
        return Optional.of(storeDocument(senderActorUri, document, cached));
    }

    private RemoteActor storeDocument(String actorUri, JsonNode document, RemoteActor cached) {
        String inboxUrl = document.path("inbox").asText(null);
        if (inboxUrl == null) {
            throw new RemoteFetchException("Actor document has no inbox: " + actorUri);
        }
        if (document.hasNonNull("id") && !actorUri.equals(document.get("id").asText())) {
            throw new RemoteFetchException("Actor document id does not match " + actorUri);
        }

        RemoteActor actor = cached != null ? cached : RemoteActor.builder().actorUri(actorUri).build();
        actor.setUsername(extractUsername(actorUri, document));
        actor.setDomain(URI.create(actorUri).getHost());
        actor.setInboxUrl(inboxUrl);
        actor.setOutboxUrl(document.path("outbox").asText(null));
        actor.setSharedInboxUrl(document.path("endpoints").path("sharedInbox").asText(null));
        actor.setPublicKey(document.path("publicKey").path("publicKeyPem").asText(null));
        actor.setPublicKeyId(document.path("publicKey").path("id").asText(null));
        actor.setDisplayName(document.path("name").asText(null));
        actor.setSummary(HtmlText.strip(document.path("summary").asText(null)));
        actor.setAvatarUrl(document.path("icon").path("url").asText(null));
        actor.setLastFetchedAt(Instant.now());

        try {
            return remoteActorRepository.save(actor);
        } catch (DataIntegrityViolationException e) {
            // another request cached the same actor concurrently
            log.debug("Concurrent insert of remote actor {}", actorUri);
            return remoteActorRepository.findByActorUri(actorUri).orElseThrow(() -> e);
        }
    }

    private static String extractUsername(String actorUri, JsonNode document) {
        String preferredUsername = document.path("preferredUsername").asText(null);
        if (preferredUsername != null) {
            return preferredUsername;
        }
        return actorUri.substring(actorUri.lastIndexOf('/') + 1);
    }
}
