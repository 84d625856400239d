package org.stellarcalendar.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.stellarcalendar.model.entity.Event;
import org.stellarcalendar.model.entity.Follow;
import org.stellarcalendar.model.entity.User;
import org.stellarcalendar.repository.EventRepository;
import org.stellarcalendar.repository.FollowRepository;
import org.stellarcalendar.repository.UserRepository;
import org.stellarcalendar.service.InboxOutcome;
import org.stellarcalendar.service.InboxRequest;
import org.stellarcalendar.service.InboxService;
import org.stellarcalendar.service.LocalActorService;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ActivityPubControllerTest {

    private static final String BASE_URL = "https://stellar.test";
    private static final String ALICE = BASE_URL + "/users/alice";

    @Mock
    private UserRepository userRepository;

    @Mock
    private FollowRepository followRepository;

    @Mock
    private EventRepository eventRepository;

    @Mock
    private LocalActorService localActorService;

    @Mock
    private InboxService inboxService;

    private MockMvc mockMvc;

    private final User alice = User.builder()
        .id(UUID.randomUUID())
        .username("alice")
        .displayName("Alice")
        .publicKey("-----BEGIN PUBLIC KEY-----\nMIIB\n-----END PUBLIC KEY-----\n")
        .privateKey("00:11:22")
        .build();

    @BeforeEach
    void setUp() {
        ActivityPubController controller = new ActivityPubController(userRepository, followRepository, eventRepository,
            localActorService, inboxService);
        ReflectionTestUtils.setField(controller, "baseUrl", BASE_URL);
        ReflectionTestUtils.setField(controller, "pageSize", 2);
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    void getActor_returnsActivityJsonWithKeyAndEndpoints() throws Exception {
        when(userRepository.findByUsernameAndEnabledTrue("alice")).thenReturn(Optional.of(alice));
        when(localActorService.ensureKeys(alice)).thenReturn(alice);

        mockMvc.perform(get("/users/alice").accept("application/activity+json"))
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith("application/activity+json"))
            .andExpect(jsonPath("$.id").value(ALICE))
            .andExpect(jsonPath("$.type").value("Person"))
            .andExpect(jsonPath("$.inbox").value(ALICE + "/inbox"))
            .andExpect(jsonPath("$.endpoints.sharedInbox").value(BASE_URL + "/inbox"))
            .andExpect(jsonPath("$.publicKey.id").value(ALICE + "#main-key"))
            .andExpect(jsonPath("$.publicKey.publicKeyPem").exists())
            .andExpect(jsonPath("$.privateKey").doesNotExist());
    }

    @Test
    void getActor_unknownUserIsNotFound() throws Exception {
        when(userRepository.findByUsernameAndEnabledTrue("ghost")).thenReturn(Optional.empty());

        mockMvc.perform(get("/users/ghost")).andExpect(status().isNotFound());
    }

    @Test
    void inbox_passesRawRequestAndMapsOutcome() throws Exception {
        when(inboxService.receive(any(InboxRequest.class))).thenReturn(InboxOutcome.ACCEPTED_PROCESSED);
        byte[] body = "{\"type\":\"Follow\"}".getBytes();

        mockMvc.perform(post("/users/alice/inbox")
                .contentType("application/activity+json")
                .header("Signature", "keyId=\"x\"")
                .header("Date", "Sun, 18 Oct 2026 10:00:00 GMT")
                .content(body))
            .andExpect(status().isAccepted());

        ArgumentCaptor<InboxRequest> captured = ArgumentCaptor.forClass(InboxRequest.class);
        verify(inboxService).receive(captured.capture());
        InboxRequest request = captured.getValue();
        assertThat(request.username()).isEqualTo("alice");
        assertThat(request.method()).isEqualTo("POST");
        assertThat(request.path()).isEqualTo("/users/alice/inbox");
        assertThat(request.header("signature")).isEqualTo("keyId=\"x\"");
        assertThat(request.body()).isEqualTo(body);
    }

    @Test
    void inbox_emptyUnsignedPostReachesAuthentication() throws Exception {
        when(inboxService.receive(any(InboxRequest.class))).thenReturn(InboxOutcome.REJECTED_UNAUTHENTICATED);

        mockMvc.perform(post("/users/alice/inbox"))
            .andExpect(status().isUnauthorized());

        ArgumentCaptor<InboxRequest> captured = ArgumentCaptor.forClass(InboxRequest.class);
        verify(inboxService).receive(captured.capture());
        assertThat(captured.getValue().body()).isEmpty();
        assertThat(captured.getValue().header("signature")).isNull();
    }

    @Test
    void sharedInbox_rejectsUnauthenticated() throws Exception {
        when(inboxService.receive(any(InboxRequest.class))).thenReturn(InboxOutcome.REJECTED_UNAUTHENTICATED);

        mockMvc.perform(post("/inbox").contentType("application/activity+json").content("{}"))
            .andExpect(status().isUnauthorized());

        ArgumentCaptor<InboxRequest> captured = ArgumentCaptor.forClass(InboxRequest.class);
        verify(inboxService).receive(captured.capture());
        assertThat(captured.getValue().isSharedInbox()).isTrue();
    }

    @Test
    void toResponse_hidesWhyAnActivityWasAccepted() {
        assertThat(ActivityPubController.toResponse(InboxOutcome.ACCEPTED_PROCESSED).getStatusCode())
            .isEqualTo(HttpStatus.ACCEPTED);
        assertThat(ActivityPubController.toResponse(InboxOutcome.ACCEPTED_DEDUPLICATED).getStatusCode())
            .isEqualTo(HttpStatus.ACCEPTED);
        assertThat(ActivityPubController.toResponse(InboxOutcome.ACCEPTED_DROPPED_BLOCKED).getStatusCode())
            .isEqualTo(HttpStatus.ACCEPTED);
        assertThat(ActivityPubController.toResponse(InboxOutcome.REJECTED_INVALID).getStatusCode())
            .isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(ActivityPubController.toResponse(InboxOutcome.NOT_FOUND).getStatusCode())
            .isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void followers_withoutPageReturnsSummary() throws Exception {
        when(userRepository.findByUsernameAndEnabledTrue("alice")).thenReturn(Optional.of(alice));
        when(followRepository.countAcceptedFollowersByActorUri(ALICE)).thenReturn(3L);

        mockMvc.perform(get("/users/alice/followers"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.type").value("OrderedCollection"))
            .andExpect(jsonPath("$.totalItems").value(3))
            .andExpect(jsonPath("$.first").value(ALICE + "/followers?page=1"))
            .andExpect(jsonPath("$.orderedItems").doesNotExist());
    }

    @Test
    void followers_pageListsActorUrls() throws Exception {
        User bobLocal = User.builder().id(UUID.randomUUID()).username("bob").build();
        Follow remote = Follow.builder().remoteActorUri("https://remote.example/users/carol").followingActorUri(ALICE).build();
        Follow local = Follow.builder().followerId(bobLocal.getId()).followingActorUri(ALICE).build();
        when(userRepository.findByUsernameAndEnabledTrue("alice")).thenReturn(Optional.of(alice));
        when(followRepository.countAcceptedFollowersByActorUri(ALICE)).thenReturn(3L);
        when(followRepository.findAcceptedFollowersByActorUri(eq(ALICE), any(PageRequest.class)))
            .thenReturn(new PageImpl<>(List.of(remote, local), PageRequest.of(0, 2), 3));
        when(userRepository.findById(bobLocal.getId())).thenReturn(Optional.of(bobLocal));

        mockMvc.perform(get("/users/alice/followers").param("page", "1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.type").value("OrderedCollectionPage"))
            .andExpect(jsonPath("$.partOf").value(ALICE + "/followers"))
            .andExpect(jsonPath("$.orderedItems[0]").value("https://remote.example/users/carol"))
            .andExpect(jsonPath("$.orderedItems[1]").value(BASE_URL + "/users/bob"))
            .andExpect(jsonPath("$.next").value(ALICE + "/followers?page=2"))
            .andExpect(jsonPath("$.prev").doesNotExist());
    }

    @Test
    void followers_rejectsPageZero() throws Exception {
        when(userRepository.findByUsernameAndEnabledTrue("alice")).thenReturn(Optional.of(alice));
        when(followRepository.countAcceptedFollowersByActorUri(ALICE)).thenReturn(0L);

        mockMvc.perform(get("/users/alice/followers").param("page", "0")).andExpect(status().isBadRequest());
    }

    @Test
    void outbox_wrapsEventsInCreateActivities() throws Exception {
        Event event = Event.builder()
            .id(UUID.randomUUID())
            .userId(alice.getId())
            .title("Perseids watch")
            .startTime(Instant.parse("2026-08-12T22:00:00Z"))
            .createdAt(Instant.parse("2026-07-01T09:00:00Z"))
            .build();
        when(userRepository.findByUsernameAndEnabledTrue("alice")).thenReturn(Optional.of(alice));
        when(eventRepository.countByUserId(alice.getId())).thenReturn(1L);
        when(eventRepository.findByUserIdOrderByCreatedAtDesc(eq(alice.getId()), any(PageRequest.class)))
            .thenReturn(new PageImpl<>(List.of(event)));

        mockMvc.perform(get("/users/alice/outbox").param("page", "1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.orderedItems[0].type").value("Create"))
            .andExpect(jsonPath("$.orderedItems[0].actor").value(ALICE))
            .andExpect(jsonPath("$.orderedItems[0].object.type").value("Event"))
            .andExpect(jsonPath("$.orderedItems[0].object.name").value("Perseids watch"))
            .andExpect(jsonPath("$.orderedItems[0].object.id").value(BASE_URL + "/events/" + event.getId()));
    }

    @Test
    void event_servesLocalEventOnly() throws Exception {
        Event local = Event.builder().id(UUID.randomUUID()).userId(alice.getId()).title("Eclipse")
            .startTime(Instant.parse("2026-08-12T17:00:00Z")).build();
        Event cached = Event.builder().id(UUID.randomUUID()).externalId("https://remote.example/events/1").build();
        when(eventRepository.findById(local.getId())).thenReturn(Optional.of(local));
        when(eventRepository.findById(cached.getId())).thenReturn(Optional.of(cached));
        when(userRepository.findById(alice.getId())).thenReturn(Optional.of(alice));

        mockMvc.perform(get("/events/" + local.getId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.type").value("Event"))
            .andExpect(jsonPath("$.attributedTo").value(ALICE))
            .andExpect(jsonPath("$.startTime").value("2026-08-12T17:00:00Z"));

        mockMvc.perform(get("/events/" + cached.getId())).andExpect(status().isNotFound());
    }
}
