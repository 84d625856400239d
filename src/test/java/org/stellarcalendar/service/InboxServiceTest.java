package org.stellarcalendar.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.stellarcalendar.federation.DeduplicationStore;
import org.stellarcalendar.federation.Directory;
import org.stellarcalendar.federation.FederatedActor;
import org.stellarcalendar.model.activitypub.ActivityParser;
import org.stellarcalendar.model.activitypub.ActivityType;
import org.stellarcalendar.model.activitypub.InboundActivity;
import org.stellarcalendar.security.HttpSignatureService;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InboxServiceTest {

    private static final String ALICE = "https://stellar.test/users/alice";
    private static final String BOB = "https://remote.example/users/bob";
    private static final String SIGNATURE =
        "keyId=\"" + BOB + "#main-key\",algorithm=\"rsa-sha256\",headers=\"(request-target) host date\",signature=\"c2ln\"";

    @Mock
    private Directory directory;

    @Mock
    private HttpSignatureService signatureService;

    @Mock
    private InboxDispatcher inboxDispatcher;

    private final InMemoryDeduplicationStore deduplicationStore = new InMemoryDeduplicationStore();

    private InboxService inboxService;

    @BeforeEach
    void setUp() {
        inboxService = new InboxService(directory, deduplicationStore, signatureService, new ActivityParser(),
            inboxDispatcher, new ObjectMapper());
        ReflectionTestUtils.setField(inboxService, "baseUrl", "https://stellar.test");
    }

    @Test
    void receive_unknownUserIsNotFound() {
        when(directory.findLocalActor("nobody")).thenReturn(Optional.empty());

        InboxOutcome outcome = inboxService.receive(request("nobody", followBody("https://remote.example/a/1"), SIGNATURE));

        assertThat(outcome).isEqualTo(InboxOutcome.NOT_FOUND);
    }

    @Test
    void receive_unsignedRequestIsRejected() {
        when(directory.findLocalActor("alice")).thenReturn(Optional.of(alice()));

        InboxOutcome outcome = inboxService.receive(request("alice", followBody("https://remote.example/a/1"), null));

        assertThat(outcome).isEqualTo(InboxOutcome.REJECTED_UNAUTHENTICATED);
        assertThat(deduplicationStore.ids).isEmpty();
    }

    @Test
    void receive_digestMismatchIsRejectedBeforeVerification() {
        when(directory.findLocalActor("alice")).thenReturn(Optional.of(alice()));
        when(signatureService.digestMatches(eq("SHA-256=wrong"), any(byte[].class))).thenReturn(false);
        InboxRequest request = request("alice", followBody("https://remote.example/a/1"), SIGNATURE);
        request.headers().put("digest", "SHA-256=wrong");

        InboxOutcome outcome = inboxService.receive(request);

        assertThat(outcome).isEqualTo(InboxOutcome.REJECTED_UNAUTHENTICATED);
        verify(signatureService, never()).verify(anyString(), anyString(), anyString(), anyMap());
    }

    @Test
    void receive_digestHeaderOutsideSignatureIsRejected() {
        when(directory.findLocalActor("alice")).thenReturn(Optional.of(alice()));
        when(signatureService.digestMatches(eq("SHA-256=abc"), any(byte[].class))).thenReturn(true);
        stubValidSignature();
        InboxRequest request = request("alice", followBody("https://remote.example/a/1"), SIGNATURE);
        request.headers().put("digest", "SHA-256=abc");

        InboxOutcome outcome = inboxService.receive(request);

        assertThat(outcome).isEqualTo(InboxOutcome.REJECTED_UNAUTHENTICATED);
        assertThat(deduplicationStore.ids).isEmpty();
        verify(inboxDispatcher, never()).dispatch(any(), any());
    }

    @Test
    void receive_signedDigestBindsBody() {
        String signature = "keyId=\"" + BOB + "#main-key\",algorithm=\"rsa-sha256\","
            + "headers=\"(request-target) host date digest\",signature=\"c2ln\"";
        when(directory.findLocalActor("alice")).thenReturn(Optional.of(alice()));
        when(signatureService.digestMatches(eq("SHA-256=abc"), any(byte[].class))).thenReturn(true);
        when(signatureService.verify(eq(signature), eq("POST"), anyString(), anyMap())).thenReturn(true);
        when(signatureService.parseSignatureHeader(signature)).thenReturn(Optional.of(
            new HttpSignatureService.SignatureParameters(BOB + "#main-key", "rsa-sha256",
                List.of("(request-target)", "host", "date", "digest"), "c2ln")));
        InboxRequest request = request("alice", followBody("https://remote.example/a/1"), signature);
        request.headers().put("digest", "SHA-256=abc");

        InboxOutcome outcome = inboxService.receive(request);

        assertThat(outcome).isEqualTo(InboxOutcome.ACCEPTED_PROCESSED);
        verify(inboxDispatcher).dispatch(any(InboundActivity.class), eq(ALICE));
    }

    @Test
    void receive_unverifiableSignatureLeavesNoTrace() {
        when(directory.findLocalActor("alice")).thenReturn(Optional.of(alice()));
        when(signatureService.verify(eq(SIGNATURE), eq("POST"), eq("/users/alice/inbox"), anyMap())).thenReturn(false);

        InboxOutcome outcome = inboxService.receive(request("alice", followBody("https://remote.example/a/1"), SIGNATURE));

        assertThat(outcome).isEqualTo(InboxOutcome.REJECTED_UNAUTHENTICATED);
        assertThat(deduplicationStore.ids).isEmpty();
        verify(inboxDispatcher, never()).dispatch(any(), any());
    }

    @Test
    void receive_verifiesAgainstConfiguredHost() {
        when(directory.findLocalActor("alice")).thenReturn(Optional.of(alice()));
        when(signatureService.verify(eq(SIGNATURE), eq("POST"), eq("/users/alice/inbox"), anyMap())).thenReturn(false);
        InboxRequest request = request("alice", followBody("https://remote.example/a/1"), SIGNATURE);
        request.headers().put("host", "internal-proxy:8080");

        inboxService.receive(request);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> headers = ArgumentCaptor.forClass(Map.class);
        verify(signatureService).verify(eq(SIGNATURE), eq("POST"), eq("/users/alice/inbox"), headers.capture());
        assertThat(headers.getValue()).containsEntry("host", "stellar.test");
    }

    @Test
    void receive_sameActivityTwiceIsProcessedOnce() {
        when(directory.findLocalActor("alice")).thenReturn(Optional.of(alice()));
        stubValidSignature();
        byte[] body = followBody("https://remote.example/a/1");

        InboxOutcome first = inboxService.receive(request("alice", body, SIGNATURE));
        InboxOutcome second = inboxService.receive(request("alice", body, SIGNATURE));

        assertThat(first).isEqualTo(InboxOutcome.ACCEPTED_PROCESSED);
        assertThat(second).isEqualTo(InboxOutcome.ACCEPTED_DEDUPLICATED);
        assertThat(second.isAccepted()).isTrue();

        ArgumentCaptor<InboundActivity> dispatched = ArgumentCaptor.forClass(InboundActivity.class);
        verify(inboxDispatcher, times(1)).dispatch(dispatched.capture(), eq(ALICE));
        assertThat(dispatched.getValue().type()).isEqualTo(ActivityType.FOLLOW);
    }

    @Test
    void receive_sharedInboxDispatchesWithoutRecipient() {
        stubValidSignature();

        InboxOutcome outcome = inboxService.receive(request(null, followBody("https://remote.example/a/9"), SIGNATURE));

        assertThat(outcome).isEqualTo(InboxOutcome.ACCEPTED_PROCESSED);
        verify(directory, never()).findLocalActor(anyString());
        verify(inboxDispatcher).dispatch(any(InboundActivity.class), eq(null));
    }

    @Test
    void receive_actorMustMatchSigner() {
        when(directory.findLocalActor("alice")).thenReturn(Optional.of(alice()));
        stubValidSignature();
        byte[] body = ("{\"id\":\"https://evil.example/a/1\",\"type\":\"Follow\",\"actor\":\"https://evil.example/users/eve\","
            + "\"object\":\"" + ALICE + "\"}").getBytes(StandardCharsets.UTF_8);

        InboxOutcome outcome = inboxService.receive(request("alice", body, SIGNATURE));

        assertThat(outcome).isEqualTo(InboxOutcome.REJECTED_UNAUTHENTICATED);
        assertThat(deduplicationStore.ids).isEmpty();
    }

    @Test
    void receive_blockedUndoIsAcceptedButNotApplied() {
        when(directory.findLocalActor("alice")).thenReturn(Optional.of(alice()));
        stubValidSignature();
        when(directory.isBlocked(ALICE, BOB)).thenReturn(true);
        byte[] body = ("{\"id\":\"https://remote.example/a/2\",\"type\":\"Undo\",\"actor\":\"" + BOB + "\","
            + "\"object\":{\"id\":\"https://remote.example/a/1\",\"type\":\"Follow\",\"actor\":\"" + BOB + "\","
            + "\"object\":\"" + ALICE + "\"}}").getBytes(StandardCharsets.UTF_8);

        InboxOutcome outcome = inboxService.receive(request("alice", body, SIGNATURE));

        assertThat(outcome).isEqualTo(InboxOutcome.ACCEPTED_DROPPED_BLOCKED);
        assertThat(outcome.isAccepted()).isTrue();
        assertThat(deduplicationStore.ids).isEmpty();
        verify(inboxDispatcher, never()).dispatch(any(), any());
    }

    @Test
    void receive_malformedJsonIsInvalid() {
        when(directory.findLocalActor("alice")).thenReturn(Optional.of(alice()));
        when(signatureService.verify(eq(SIGNATURE), eq("POST"), eq("/users/alice/inbox"), anyMap())).thenReturn(true);

        InboxOutcome outcome = inboxService.receive(
            request("alice", "{not json".getBytes(StandardCharsets.UTF_8), SIGNATURE));

        assertThat(outcome).isEqualTo(InboxOutcome.REJECTED_INVALID);
    }

    @Test
    void receive_unsupportedTypeIsInvalid() {
        when(directory.findLocalActor("alice")).thenReturn(Optional.of(alice()));
        when(signatureService.verify(eq(SIGNATURE), eq("POST"), eq("/users/alice/inbox"), anyMap())).thenReturn(true);
        byte[] body = ("{\"id\":\"https://remote.example/a/3\",\"type\":\"Move\",\"actor\":\"" + BOB + "\","
            + "\"object\":\"" + BOB + "\"}").getBytes(StandardCharsets.UTF_8);

        InboxOutcome outcome = inboxService.receive(request("alice", body, SIGNATURE));

        assertThat(outcome).isEqualTo(InboxOutcome.REJECTED_INVALID);
        verify(inboxDispatcher, never()).dispatch(any(), any());
    }

    private void stubValidSignature() {
        when(signatureService.verify(eq(SIGNATURE), eq("POST"), anyString(), anyMap())).thenReturn(true);
        when(signatureService.parseSignatureHeader(SIGNATURE)).thenReturn(Optional.of(
            new HttpSignatureService.SignatureParameters(BOB + "#main-key", "rsa-sha256",
                List.of("(request-target)", "host", "date"), "c2ln")));
    }

    private static InboxRequest request(String username, byte[] body, String signature) {
        Map<String, String> headers = new HashMap<>();
        headers.put("host", "stellar.test");
        headers.put("date", "Sun, 18 Oct 2026 10:00:00 GMT");
        headers.put("content-type", "application/activity+json");
        if (signature != null) {
            headers.put("signature", signature);
        }
        String path = username == null ? "/inbox" : "/users/" + username + "/inbox";
        return new InboxRequest(username, "POST", path, headers, body);
    }

    private static byte[] followBody(String activityId) {
        return ("{\"@context\":\"https://www.w3.org/ns/activitystreams\",\"id\":\"" + activityId + "\","
            + "\"type\":\"Follow\",\"actor\":\"" + BOB + "\",\"object\":\"" + ALICE + "\"}")
            .getBytes(StandardCharsets.UTF_8);
    }

    private static FederatedActor alice() {
        return FederatedActor.builder().actorUrl(ALICE).handle("alice").remote(false).build();
    }

    private static class InMemoryDeduplicationStore implements DeduplicationStore {

        private final Set<String> ids = ConcurrentHashMap.newKeySet();

        @Override
        public boolean markProcessed(String activityId) {
            return ids.add(activityId);
        }

        @Override
        public boolean isProcessed(String activityId) {
            return ids.contains(activityId);
        }

        @Override
        public int purgeExpired(Instant now) {
            return 0;
        }
    }
}
