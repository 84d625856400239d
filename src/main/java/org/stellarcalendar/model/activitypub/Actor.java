package org.stellarcalendar.model.activitypub;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.stellarcalendar.model.entity.User;

import java.util.List;

/**
 * ActivityPub Actor document for a local user.
 *
 * Spec: https://www.w3.org/TR/activitypub/#actors
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Actor {

    @JsonProperty("@context")
    private Object context;

    private String type;
    private String id;
    private String preferredUsername;
    private String name;
    private String summary;
    private String inbox;
    private String outbox;
    private String followers;
    private String following;
    private Boolean manuallyApprovesFollowers;
    private PublicKey publicKey;
    private Endpoints endpoints;
    private Image icon;
    private String url;

    /**
     * Builds the Person document for a user. The shared inbox lives at {@code {baseUrl}/inbox}.
     */
    public static Actor fromUser(User user, String baseUrl) {
        String actorUri = user.getActorUri(baseUrl);

        return Actor.builder()
            .context(List.of(ActivityStreams.CONTEXT, ActivityStreams.SECURITY_CONTEXT))
            .type("Person")
            .id(actorUri)
            .preferredUsername(user.getUsername())
            .name(user.getDisplayName() != null ? user.getDisplayName() : user.getUsername())
            .summary(user.getBio())
            .inbox(actorUri + "/inbox")
            .outbox(actorUri + "/outbox")
            .followers(actorUri + "/followers")
            .following(actorUri + "/following")
            .manuallyApprovesFollowers(!user.isAutoAcceptFollowers())
            .publicKey(PublicKey.builder()
                .id(actorUri + "#main-key")
                .owner(actorUri)
                .publicKeyPem(user.getPublicKey())
                .build())
            .endpoints(new Endpoints(baseUrl + "/inbox"))
            .icon(user.getAvatarUrl() != null ? Image.builder()
                .type("Image")
                .url(user.getAvatarUrl())
                .build() : null)
            .url(actorUri)
            .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class PublicKey {
        private String id;
        private String owner;
        private String publicKeyPem;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Endpoints {
        private String sharedInbox;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Image {
        private String type;
        private String mediaType;
        private String url;
    }
}
