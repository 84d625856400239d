package org.stellarcalendar.model.activitypub;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Parses raw inbound JSON into an {@link InboundActivity}.
 * Unknown types and malformed payloads become {@link ActivityParseResult.Rejected}, never exceptions.
 */
@Component
public class ActivityParser {

    public ActivityParseResult parse(JsonNode json) {
        if (json == null || !json.isObject()) {
            return ActivityParseResult.rejected("Activity must be a JSON object");
        }

        String typeName = textOrNull(json, "type");
        if (typeName == null) {
            return ActivityParseResult.rejected("Missing type");
        }
        Optional<ActivityType> type = ActivityType.fromName(typeName);
        if (type.isEmpty()) {
            return ActivityParseResult.rejected("Unsupported activity type: " + typeName);
        }

        String id = textOrNull(json, "id");
        if (!isHttpUrl(id)) {
            return ActivityParseResult.rejected("Activity id must be an http(s) URL");
        }
        String actor = readActor(json.get("actor"));
        if (!isHttpUrl(actor)) {
            return ActivityParseResult.rejected("Activity actor must be an http(s) URL");
        }

        Instant published = null;
        String publishedText = textOrNull(json, "published");
        if (publishedText != null) {
            try {
                published = Instant.parse(publishedText);
            } catch (DateTimeParseException e) {
                return ActivityParseResult.rejected("Invalid published timestamp");
            }
        }

        ActivityObject object = readObject(json.get("object"));
        if (object == null) {
            return ActivityParseResult.rejected("Missing or invalid object");
        }
        if (!type.get().getObjectShape().allows(object)) {
            return ActivityParseResult.rejected(typeName + " does not allow a "
                + (object.isEmbedded() ? "embedded" : "referenced") + " object");
        }

        return ActivityParseResult.parsed(new InboundActivity(
            type.get(), id, actor, published, Addressing.fromActivity(json), object, json));
    }

    private ActivityObject readObject(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return isHttpUrl(node.asText()) ? ActivityObject.reference(node.asText()) : null;
        }
        if (node.isObject()) {
            String objectId = textOrNull(node, "id");
            String objectType = textOrNull(node, "type");
            if (!isHttpUrl(objectId) || objectType == null) {
                return null;
            }
            return new ActivityObject(objectId, objectType, node);
        }
        return null;
    }

    /**
     * Some servers embed the actor object instead of referencing it.
     */
    private String readActor(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        return node.isObject() ? textOrNull(node, "id") : null;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    static boolean isHttpUrl(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        try {
            URI uri = new URI(value);
            return ("https".equalsIgnoreCase(uri.getScheme()) || "http".equalsIgnoreCase(uri.getScheme()))
                && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
