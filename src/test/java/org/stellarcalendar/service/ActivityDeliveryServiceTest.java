package org.stellarcalendar.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.stellarcalendar.exception.RemoteFetchException;
import org.stellarcalendar.federation.Directory;
import org.stellarcalendar.federation.FederatedActor;
import org.stellarcalendar.model.activitypub.Addressing;
import org.stellarcalendar.model.entity.FailedDelivery;
import org.stellarcalendar.security.HttpSignatureService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ActivityDeliveryServiceTest {

    private static final String SENDER = "https://stellar.test/users/alice";
    private static final String ACTIVITY_ID = "https://stellar.test/activities/1";

    @Mock
    private AudienceResolver audienceResolver;

    @Mock
    private Directory directory;

    @Mock
    private HttpSignatureService signatureService;

    @Mock
    private SafeHttpClient safeHttpClient;

    @Mock
    private FailedDeliveryService failedDeliveryService;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private ActivityDeliveryService deliveryService;

    private final FederatedActor alice = FederatedActor.builder()
        .actorUrl(SENDER)
        .handle("alice")
        .inboxUrl(SENDER + "/inbox")
        .privateKeyPem("private-pem")
        .remote(false)
        .build();

    @BeforeEach
    void setUp() {
        deliveryService = new ActivityDeliveryService(audienceResolver, directory, signatureService, safeHttpClient,
            failedDeliveryService, objectMapper, Runnable::run);
    }

    @Test
    void deliver_sendsSignedRequestToEveryInbox() {
        Addressing addressing = Addressing.publicAddressing(SENDER);
        when(directory.findActor(SENDER)).thenReturn(Optional.of(alice));
        when(audienceResolver.resolveInboxes(addressing, SENDER))
            .thenReturn(orderedSet("https://a.example/inbox", "https://b.example/inbox"));
        stubSigning();
        when(safeHttpClient.exchange(anyString(), eq(HttpMethod.POST), any(HttpHeaders.class), anyString()))
            .thenReturn(ResponseEntity.status(HttpStatus.ACCEPTED).body(""));

        DeliveryReport report = deliveryService.deliver(activity(), addressing, SENDER).join();

        assertThat(report.successCount()).isEqualTo(2);
        assertThat(report.results()).extracting(DeliveryResult::statusCode).containsOnly(202);

        ArgumentCaptor<HttpHeaders> headers = ArgumentCaptor.forClass(HttpHeaders.class);
        verify(safeHttpClient).exchange(eq("https://a.example/inbox"), eq(HttpMethod.POST), headers.capture(), anyString());
        assertThat(headers.getValue().getFirst("Signature")).isEqualTo("sig");
        assertThat(headers.getValue().getFirst("Digest")).isEqualTo("SHA-256=abc");
        assertThat(headers.getValue().getFirst(HttpHeaders.CONTENT_TYPE)).isEqualTo("application/activity+json");
    }

    @Test
    void deliver_failingInboxDoesNotAffectOthers() {
        Addressing addressing = Addressing.publicAddressing(SENDER);
        when(directory.findActor(SENDER)).thenReturn(Optional.of(alice));
        when(audienceResolver.resolveInboxes(addressing, SENDER))
            .thenReturn(orderedSet("https://down.example/inbox", "https://b.example/inbox"));
        stubSigning();
        when(safeHttpClient.exchange(eq("https://down.example/inbox"), eq(HttpMethod.POST), any(HttpHeaders.class), anyString()))
            .thenThrow(new RemoteFetchException("POST https://down.example/inbox failed: 503"));
        when(safeHttpClient.exchange(eq("https://b.example/inbox"), eq(HttpMethod.POST), any(HttpHeaders.class), anyString()))
            .thenReturn(ResponseEntity.ok(""));

        DeliveryReport report = deliveryService.deliver(activity(), addressing, SENDER).join();

        assertThat(report.successCount()).isEqualTo(1);
        assertThat(report.failureCount()).isEqualTo(1);
        verify(failedDeliveryService).recordFailure(eq(ACTIVITY_ID), anyString(), eq("https://down.example/inbox"),
            eq(SENDER), anyString());
    }

    @Test
    void deliver_neverDisclosesBlindRecipients() throws Exception {
        Map<String, Object> activity = activity();
        activity.put("bcc", List.of("https://remote.example/users/hidden"));
        activity.put("bto", List.of("https://remote.example/users/secret"));
        Addressing addressing = new Addressing(Set.of(), Set.of(), Set.of("https://remote.example/users/hidden"));
        when(directory.findActor(SENDER)).thenReturn(Optional.of(alice));
        when(audienceResolver.resolveInboxes(addressing, SENDER)).thenReturn(orderedSet("https://remote.example/inbox"));
        stubSigning();
        when(safeHttpClient.exchange(anyString(), eq(HttpMethod.POST), any(HttpHeaders.class), anyString()))
            .thenReturn(ResponseEntity.ok(""));

        deliveryService.deliver(activity, addressing, SENDER).join();

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(safeHttpClient).exchange(anyString(), eq(HttpMethod.POST), any(HttpHeaders.class), body.capture());
        JsonNode sent = objectMapper.readTree(body.getValue());
        assertThat(sent.has("bcc")).isFalse();
        assertThat(sent.has("bto")).isFalse();
        assertThat(sent.path("id").asText()).isEqualTo(ACTIVITY_ID);
        assertThat(activity).containsKey("bcc");
    }

    @Test
    void deliver_refusesRemoteSender() {
        FederatedActor remote = FederatedActor.builder().actorUrl(SENDER).remote(true).build();
        when(directory.findActor(SENDER)).thenReturn(Optional.of(remote));

        DeliveryReport report = deliveryService.deliver(activity(), Addressing.publicAddressing(SENDER), SENDER).join();

        assertThat(report.results()).isEmpty();
        verify(audienceResolver, never()).resolveInboxes(any(), anyString());
    }

    @Test
    void redeliver_resendsStoredBody() {
        FailedDelivery record = FailedDelivery.builder()
            .activityId(ACTIVITY_ID)
            .activityJson("{\"id\":\"" + ACTIVITY_ID + "\"}")
            .targetInbox("https://b.example/inbox")
            .senderActorUri(SENDER)
            .attempts(2)
            .build();
        when(directory.findActor(SENDER)).thenReturn(Optional.of(alice));
        stubSigning();
        when(safeHttpClient.exchange(eq("https://b.example/inbox"), eq(HttpMethod.POST), any(HttpHeaders.class),
            eq(record.getActivityJson()))).thenReturn(ResponseEntity.ok(""));

        DeliveryResult result = deliveryService.redeliver(record);

        assertThat(result.success()).isTrue();
        verify(failedDeliveryService, never()).recordFailure(anyString(), anyString(), anyString(), anyString(), anyString());
    }

    @Test
    void redeliver_failsWhenSenderIsGone() {
        FailedDelivery record = FailedDelivery.builder()
            .activityId(ACTIVITY_ID)
            .activityJson("{}")
            .targetInbox("https://b.example/inbox")
            .senderActorUri(SENDER)
            .build();
        when(directory.findActor(SENDER)).thenReturn(Optional.empty());

        DeliveryResult result = deliveryService.redeliver(record);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("no longer exists");
    }

    private void stubSigning() {
        when(signatureService.signRequest(eq("POST"), anyString(), anyString(), eq("private-pem"), eq(SENDER + "#main-key")))
            .thenReturn(new HttpSignatureService.SignatureHeaders("remote.example", "Sun, 18 Oct 2026 10:00:00 GMT",
                "SHA-256=abc", "sig"));
    }

    private static Map<String, Object> activity() {
        Map<String, Object> activity = new LinkedHashMap<>();
        activity.put("@context", "https://www.w3.org/ns/activitystreams");
        activity.put("id", ACTIVITY_ID);
        activity.put("type", "Create");
        activity.put("actor", SENDER);
        return activity;
    }

    private static Set<String> orderedSet(String... values) {
        return new LinkedHashSet<>(List.of(values));
    }
}
