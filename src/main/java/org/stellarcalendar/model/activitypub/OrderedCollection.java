package org.stellarcalendar.model.activitypub;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * OrderedCollection summary for followers, following and outbox.
 * Items are served by {@link OrderedCollectionPage}.
 *
 * Spec: https://www.w3.org/TR/activitystreams-core/#collections
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderedCollection {

    @JsonProperty("@context")
    private String context;

    private String type;
    private String id;
    private Long totalItems;
    private String first;

    public static OrderedCollection summary(String id, long totalItems) {
        return OrderedCollection.builder()
            .context(ActivityStreams.CONTEXT)
            .type("OrderedCollection")
            .id(id)
            .totalItems(totalItems)
            .first(totalItems > 0 ? id + "?page=1" : null)
            .build();
    }
}
