package org.stellarcalendar.model.activitypub;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of an OrderedCollection. Pages are 1-based.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderedCollectionPage {

    @JsonProperty("@context")
    private String context;

    private String type;
    private String id;
    private String partOf;
    private Long totalItems;
    private List<Object> orderedItems;
    private String next;
    private String prev;

    public static OrderedCollectionPage of(String collectionId, int page, int totalPages, long totalItems,
                                           List<Object> items) {
        return OrderedCollectionPage.builder()
            .context(ActivityStreams.CONTEXT)
            .type("OrderedCollectionPage")
            .id(collectionId + "?page=" + page)
            .partOf(collectionId)
            .totalItems(totalItems)
            .orderedItems(items)
            .next(page < totalPages ? collectionId + "?page=" + (page + 1) : null)
            .prev(page > 1 ? collectionId + "?page=" + (page - 1) : null)
            .build();
    }
}
