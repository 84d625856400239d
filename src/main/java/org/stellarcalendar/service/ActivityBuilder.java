package org.stellarcalendar.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.stellarcalendar.federation.FederatedActor;
import org.stellarcalendar.model.activitypub.ActivityStreams;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Builds the activities the engine emits on its own: the Accept reply to a Follow.
 */
@Component
@RequiredArgsConstructor
public class ActivityBuilder {

    private final ObjectMapper objectMapper;

    @Value("${stellar.base-url}")
    private String baseUrl;

    @SuppressWarnings("unchecked")
    public Map<String, Object> buildAccept(FederatedActor localActor, JsonNode followActivity, String followerActorUrl) {
        Map<String, Object> accept = new LinkedHashMap<>();
        accept.put("@context", ActivityStreams.CONTEXT);
        accept.put("id", baseUrl + "/activities/" + UUID.randomUUID());
        accept.put("type", "Accept");
        accept.put("actor", localActor.getActorUrl());
        accept.put("object", objectMapper.convertValue(followActivity, Map.class));
        accept.put("to", List.of(followerActorUrl));
        accept.put("published", Instant.now().toString());
        return accept;
    }
}
