package org.stellarcalendar.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.stellarcalendar.federation.DeduplicationStore;
import org.stellarcalendar.federation.Directory;
import org.stellarcalendar.federation.FederatedActor;
import org.stellarcalendar.model.activitypub.ActivityParseResult;
import org.stellarcalendar.model.activitypub.ActivityParser;
import org.stellarcalendar.model.activitypub.InboundActivity;
import org.stellarcalendar.security.HttpSignatureService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Receiving side of federation: authenticates, validates, filters and deduplicates inbound activities,
 * then hands them to {@link InboxDispatcher} without waiting.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InboxService {

    private final Directory directory;
    private final DeduplicationStore deduplicationStore;
    private final HttpSignatureService signatureService;
    private final ActivityParser activityParser;
    private final InboxDispatcher inboxDispatcher;
    private final ObjectMapper objectMapper;

    @Value("${stellar.base-url}")
    private String baseUrl;

    public InboxOutcome receive(InboxRequest request) {
        String recipientActorUrl = null;
        if (!request.isSharedInbox()) {
            Optional<FederatedActor> recipient = directory.findLocalActor(request.username());
            if (recipient.isEmpty()) {
                log.warn("Inbox POST for unknown user: {}", request.username());
                return InboxOutcome.NOT_FOUND;
            }
            recipientActorUrl = recipient.get().getActorUrl();
        }

        String signatureHeader = request.header("signature");
        if (signatureHeader == null || signatureHeader.isBlank()) {
            log.warn("Rejecting unsigned inbox POST to {}", request.path());
            return InboxOutcome.REJECTED_UNAUTHENTICATED;
        }

        String digestHeader = request.header("digest");
        if (digestHeader != null && !signatureService.digestMatches(digestHeader, request.body())) {
            log.warn("Digest mismatch on inbox POST to {}", request.path());
            return InboxOutcome.REJECTED_UNAUTHENTICATED;
        }

        if (!signatureService.verify(signatureHeader, request.method(), request.path(), withReceivingHost(request.headers()))) {
            return InboxOutcome.REJECTED_UNAUTHENTICATED;
        }

        Optional<HttpSignatureService.SignatureParameters> signature = signatureService.parseSignatureHeader(signatureHeader);
        String signer = signature
            .map(params -> HttpSignatureService.keyIdToActorUrl(params.keyId()))
            .orElse(null);
        boolean digestSigned = signature.map(params -> params.headers().contains("digest")).orElse(false);
        if (request.body() != null && request.body().length > 0 && !digestSigned) {
            if (digestHeader != null) {
                log.warn("Digest header on inbox POST to {} is not covered by the signature of {}", request.path(), signer);
                return InboxOutcome.REJECTED_UNAUTHENTICATED;
            }
            log.warn("Signature from {} does not cover the body of inbox POST to {}", signer, request.path());
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(request.body());
        } catch (IOException e) {
            log.warn("Inbox POST body is not JSON: {}", e.getMessage());
            return InboxOutcome.REJECTED_INVALID;
        }

        ActivityParseResult parsed = activityParser.parse(json);
        if (parsed instanceof ActivityParseResult.Rejected rejected) {
            log.warn("Rejecting invalid activity: {}", rejected.reason());
            return InboxOutcome.REJECTED_INVALID;
        }
        InboundActivity activity = ((ActivityParseResult.Parsed) parsed).activity();

        if (!activity.actor().equals(signer)) {
            log.warn("Activity {} claims actor {} but was signed by {}", activity.id(), activity.actor(), signer);
            return InboxOutcome.REJECTED_UNAUTHENTICATED;
        }

        if (directory.isBlocked(recipientActorUrl, activity.actor())) {
            log.info("Dropping {} from blocked actor {}", activity.type().getName(), activity.actor());
            return InboxOutcome.ACCEPTED_DROPPED_BLOCKED;
        }

        if (!deduplicationStore.markProcessed(activity.id())) {
            log.debug("Ignoring replay of {}", activity.id());
            return InboxOutcome.ACCEPTED_DEDUPLICATED;
        }

        inboxDispatcher.dispatch(activity, recipientActorUrl);
        log.info("Accepted {} {} from {}", activity.type().getName(), activity.id(), activity.actor());
        return InboxOutcome.ACCEPTED_PROCESSED;
    }

    /**
     * Replaces the Host header with this instance's configured authority, which is what senders sign,
     * even when a reverse proxy rewrote the header.
     */
    private Map<String, String> withReceivingHost(Map<String, String> headers) {
        Map<String, String> adjusted = new HashMap<>(headers);
        URI base = URI.create(baseUrl);
        adjusted.put("host", base.getPort() == -1 ? base.getHost() : base.getHost() + ":" + base.getPort());
        return adjusted;
    }
}
