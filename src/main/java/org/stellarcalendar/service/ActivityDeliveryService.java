package org.stellarcalendar.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.stellarcalendar.federation.Directory;
import org.stellarcalendar.federation.FederatedActor;
import org.stellarcalendar.model.activitypub.ActivityStreams;
import org.stellarcalendar.model.activitypub.Addressing;
import org.stellarcalendar.model.entity.FailedDelivery;
import org.stellarcalendar.security.HttpSignatureService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Signs and sends activities to remote inboxes.
 * Each target is delivered independently on the bounded delivery executor; a failing target is recorded
 * for retry and never affects the others.
 */
@Service
@Slf4j
public class ActivityDeliveryService {

    private static final Set<String> HIDDEN_FIELDS = Set.of("bcc", "bto");

    private final AudienceResolver audienceResolver;
    private final Directory directory;
    private final HttpSignatureService signatureService;
    private final SafeHttpClient safeHttpClient;
    private final FailedDeliveryService failedDeliveryService;
    private final ObjectMapper objectMapper;
    private final Executor deliveryExecutor;

    public ActivityDeliveryService(AudienceResolver audienceResolver,
                                   Directory directory,
                                   HttpSignatureService signatureService,
                                   SafeHttpClient safeHttpClient,
                                   FailedDeliveryService failedDeliveryService,
                                   ObjectMapper objectMapper,
                                   @Qualifier("deliveryExecutor") Executor deliveryExecutor) {
        this.audienceResolver = audienceResolver;
        this.directory = directory;
        this.signatureService = signatureService;
        this.safeHttpClient = safeHttpClient;
        this.failedDeliveryService = failedDeliveryService;
        this.objectMapper = objectMapper;
        this.deliveryExecutor = deliveryExecutor;
    }

    /**
     * Resolves the audience and delivers the activity to every resulting inbox.
     * The returned future completes when all targets finished and never completes exceptionally.
     *
     * @param activity       the activity as built by the caller
     * @param addressing     recipients, bcc included
     * @param senderActorUrl a local actor
     */
    public CompletableFuture<DeliveryReport> deliver(Map<String, Object> activity, Addressing addressing,
                                                     String senderActorUrl) {
        String activityId = String.valueOf(activity.get("id"));

        Optional<FederatedActor> sender = directory.findActor(senderActorUrl).filter(actor -> !actor.isRemote());
        if (sender.isEmpty()) {
            log.warn("Cannot deliver {}: {} is not a local actor", activityId, senderActorUrl);
            return CompletableFuture.completedFuture(DeliveryReport.empty(activityId));
        }

        String body;
        try {
            body = serializeForDelivery(activity);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize activity {}", activityId, e);
            return CompletableFuture.completedFuture(DeliveryReport.empty(activityId));
        }

        return CompletableFuture
            .supplyAsync(() -> audienceResolver.resolveInboxes(addressing, senderActorUrl), deliveryExecutor)
            .thenCompose(inboxes -> {
                List<CompletableFuture<DeliveryResult>> deliveries = inboxes.stream()
                    .map(inbox -> CompletableFuture.supplyAsync(
                        () -> deliverToInbox(activityId, body, inbox, sender.get()), deliveryExecutor))
                    .toList();
                return CompletableFuture.allOf(deliveries.toArray(new CompletableFuture[0]))
                    .thenApply(done -> new DeliveryReport(activityId,
                        deliveries.stream().map(CompletableFuture::join).toList()));
            })
            .whenComplete((report, error) -> {
                if (report != null) {
                    log.info("Delivered {} to {} inboxes ({} failed)", activityId, report.results().size(),
                        report.failureCount());
                }
            })
            .exceptionally(error -> {
                log.error("Delivery of {} aborted", activityId, error);
                return DeliveryReport.empty(activityId);
            });
    }

    /**
     * Delivers to a single inbox, bypassing audience resolution. Used for replies such as Accept.
     */
    public CompletableFuture<DeliveryResult> deliverToInbox(Map<String, Object> activity, String inbox,
                                                            FederatedActor sender) {
        String activityId = String.valueOf(activity.get("id"));
        try {
            String body = serializeForDelivery(activity);
            return CompletableFuture.supplyAsync(() -> deliverToInbox(activityId, body, inbox, sender), deliveryExecutor);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize activity {}", activityId, e);
            return CompletableFuture.completedFuture(DeliveryResult.failure(inbox, e.getMessage()));
        }
    }

    /**
     * Signs and posts one serialized activity. Never throws; failures are recorded for retry.
     */
    public DeliveryResult deliverToInbox(String activityId, String body, String inbox, FederatedActor sender) {
        try {
            DeliveryResult result = post(body, inbox, sender);
            log.debug("Sent {} to {} - Status: {}", activityId, inbox, result.statusCode());
            return result;
        } catch (RuntimeException e) {
            log.warn("Failed to deliver {} to {}: {}", activityId, inbox, e.getMessage());
            failedDeliveryService.recordFailure(activityId, body, inbox, sender.getActorUrl(), e.getMessage());
            return DeliveryResult.failure(inbox, e.getMessage());
        }
    }

    /**
     * Retries a recorded failure. The caller updates the record.
     */
    public DeliveryResult redeliver(FailedDelivery record) {
        Optional<FederatedActor> sender = directory.findActor(record.getSenderActorUri())
            .filter(actor -> !actor.isRemote());
        if (sender.isEmpty()) {
            return DeliveryResult.failure(record.getTargetInbox(), "Sender no longer exists: " + record.getSenderActorUri());
        }
        try {
            return post(record.getActivityJson(), record.getTargetInbox(), sender.get());
        } catch (RuntimeException e) {
            return DeliveryResult.failure(record.getTargetInbox(), e.getMessage());
        }
    }

    private DeliveryResult post(String body, String inbox, FederatedActor sender) {
        HttpSignatureService.SignatureHeaders signatureHeaders = signatureService.signRequest(
            HttpMethod.POST.name(), inbox, body, sender.getPrivateKeyPem(), sender.getKeyId());

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.CONTENT_TYPE, ActivityStreams.ACTIVITY_JSON);
        headers.set(HttpHeaders.ACCEPT, ActivityStreams.ACTIVITY_JSON);
        // must match the signed host exactly
        headers.set(HttpHeaders.HOST, signatureHeaders.host());
        headers.set(HttpHeaders.DATE, signatureHeaders.date());
        headers.set("Digest", signatureHeaders.digest());
        headers.set("Signature", signatureHeaders.signature());

        ResponseEntity<String> response = safeHttpClient.exchange(inbox, HttpMethod.POST, headers, body);
        return DeliveryResult.success(inbox, response.getStatusCode().value());
    }

    /**
     * Serializes a copy without bcc and bto.
     */
    String serializeForDelivery(Map<String, Object> activity) throws JsonProcessingException {
        Map<String, Object> visible = new LinkedHashMap<>(activity);
        HIDDEN_FIELDS.forEach(visible::remove);
        return objectMapper.writeValueAsString(visible);
    }
}
