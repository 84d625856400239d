package org.stellarcalendar.controller;

import lombok.RequiredArgsConstructor;
import org.stellarcalendar.repository.EventRepository;
import org.stellarcalendar.repository.UserRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * NodeInfo 2.0 discovery, used by other servers to identify this instance.
 */
@RestController
@RequiredArgsConstructor
public class NodeInfoController {

    private static final String SCHEMA_2_0 = "https://nodeinfo.diaspora.software/ns/schema/2.0";

    private final UserRepository userRepository;
    private final EventRepository eventRepository;

    @Value("${stellar.base-url}")
    private String baseUrl;

    @Value("${stellar.node.name:Stellar Calendar}")
    private String nodeName;

    @Value("${stellar.node.software-version:0.1.0}")
    private String softwareVersion;

    @Value("${stellar.node.open-registrations:false}")
    private boolean openRegistrations;

    @GetMapping("/.well-known/nodeinfo")
    public Map<String, Object> discovery() {
        return Map.of("links", List.of(Map.of("rel", SCHEMA_2_0, "href", baseUrl + "/nodeinfo/2.0")));
    }

    @GetMapping("/nodeinfo/2.0")
    public Map<String, Object> nodeInfo() {
        return Map.of(
            "version", "2.0",
            "software", Map.of("name", "stellar-calendar", "version", softwareVersion),
            "protocols", List.of("activitypub"),
            "services", Map.of("inbound", List.of(), "outbound", List.of()),
            "openRegistrations", openRegistrations,
            "usage", Map.of(
                "users", Map.of("total", userRepository.countByEnabledTrue()),
                "localPosts", eventRepository.countByUserIdIsNotNull()),
            "metadata", Map.of("nodeName", nodeName)
        );
    }
}
