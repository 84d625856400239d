package org.stellarcalendar.model.activitypub;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The object of an activity: either a bare URI reference or an embedded object with its own id and type.
 *
 * @param id       object id, never null
 * @param type     object type, null for references
 * @param embedded the embedded JSON, null for references
 */
public record ActivityObject(String id, String type, JsonNode embedded) {

    public static ActivityObject reference(String id) {
        return new ActivityObject(id, null, null);
    }

    public boolean isEmbedded() {
        return embedded != null;
    }

    public boolean hasType(String candidate) {
        return candidate.equals(type);
    }

    /**
     * Text value of a field of the embedded object, or null.
     */
    public String text(String field) {
        if (embedded == null || !embedded.hasNonNull(field)) {
            return null;
        }
        JsonNode value = embedded.get(field);
        return value.isTextual() ? value.asText() : null;
    }
}
