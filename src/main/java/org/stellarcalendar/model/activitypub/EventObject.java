package org.stellarcalendar.model.activitypub;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.stellarcalendar.model.entity.Event;

import java.util.List;

/**
 * ActivityStreams Event object, used both to publish local events and to read remote ones.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class EventObject {

    @JsonProperty("@context")
    private Object context;

    private String type;
    private String id;
    private String name;
    private String summary;
    private String content;
    private String startTime;
    private String endTime;
    private String duration;

    /**
     * Either a plain string or a Place object.
     */
    private JsonNode location;

    private String attributedTo;
    private String url;
    private String eventStatus;
    private String eventAttendanceMode;
    private Integer maximumAttendeeCapacity;
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<Actor.Image> attachment;
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> to;
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> cc;

    public static EventObject fromEvent(Event event, String eventUrl, String attributedTo) {
        return EventObject.builder()
            .context(ActivityStreams.CONTEXT)
            .type("Event")
            .id(eventUrl)
            .name(event.getTitle())
            .summary(event.getSummary())
            .startTime(event.getStartTime() != null ? event.getStartTime().toString() : null)
            .endTime(event.getEndTime() != null ? event.getEndTime().toString() : null)
            .duration(event.getDuration())
            .location(event.getLocation() != null
                ? TextNode.valueOf(event.getLocation()) : null)
            .attributedTo(attributedTo)
            .url(event.getUrl() != null ? event.getUrl() : eventUrl)
            .eventStatus(event.getEventStatus())
            .eventAttendanceMode(event.getEventAttendanceMode())
            .maximumAttendeeCapacity(event.getMaximumAttendeeCapacity())
            .attachment(event.getHeaderImage() != null
                ? List.of(Actor.Image.builder().type("Image").url(event.getHeaderImage()).build()) : null)
            .to(List.of(ActivityStreams.PUBLIC_COLLECTION))
            .cc(List.of(attributedTo + "/followers"))
            .build();
    }

    /**
     * Location as display text: the string itself, or the Place's name, falling back to its address.
     */
    public String locationText() {
        if (location == null || location.isNull()) {
            return null;
        }
        if (location.isTextual()) {
            return location.asText();
        }
        if (location.hasNonNull("name")) {
            return location.get("name").asText();
        }
        return location.hasNonNull("address") ? location.get("address").asText() : null;
    }

    public String headerImageUrl() {
        return attachment == null || attachment.isEmpty() ? null : attachment.get(0).getUrl();
    }
}
