package org.stellarcalendar.model.activitypub;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Optional;

/**
 * JSON Resource Descriptor (RFC 7033) served for local actors and read back from remote servers
 * when a handle is resolved to an actor URL.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class WebFingerResponse {

    public static final String REL_SELF = "self";
    public static final String REL_PROFILE_PAGE = "http://webfinger.net/rel/profile-page";

    private String subject;
    private List<String> aliases;
    private List<Link> links;

    /**
     * Descriptor for {@code acct:username@domain}. The actor URL doubles as the alias and the profile page.
     */
    public static WebFingerResponse forLocalActor(String username, String domain, String actorUrl) {
        return WebFingerResponse.builder()
            .subject("acct:" + username + "@" + domain)
            .aliases(List.of(actorUrl))
            .links(List.of(
                new Link(REL_SELF, ActivityStreams.ACTIVITY_JSON, actorUrl),
                new Link(REL_PROFILE_PAGE, "text/html", actorUrl)
            ))
            .build();
    }

    /**
     * The {@code self} link that points at an ActivityStreams document, if any.
     */
    public Optional<String> actorUrl() {
        if (links == null) {
            return Optional.empty();
        }
        return links.stream()
            .filter(Link::isActivityPubSelf)
            .map(Link::getHref)
            .filter(href -> href != null && !href.isBlank())
            .findFirst();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Link {
        private String rel;
        private String type;
        private String href;

        boolean isActivityPubSelf() {
            if (!REL_SELF.equals(rel) || type == null) {
                return false;
            }
            return type.equals(ActivityStreams.ACTIVITY_JSON) || type.startsWith("application/ld+json");
        }
    }
}
