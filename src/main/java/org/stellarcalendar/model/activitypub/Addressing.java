package org.stellarcalendar.model.activitypub;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Recipients of an activity. {@code bcc} recipients receive the activity but are never disclosed
 * in the delivered copy.
 */
@Value
public class Addressing {

    Set<String> to;
    Set<String> cc;
    Set<String> bcc;

    public Addressing(Collection<String> to, Collection<String> cc, Collection<String> bcc) {
        this.to = copy(to);
        this.cc = copy(cc);
        this.bcc = copy(bcc);
    }

    /**
     * Public post: to the public collection, cc the sender's followers.
     */
    public static Addressing publicAddressing(String senderActorUrl) {
        return new Addressing(Set.of(ActivityStreams.PUBLIC_COLLECTION), Set.of(senderActorUrl + "/followers"), Set.of());
    }

    public static Addressing followersOnly(String senderActorUrl) {
        return new Addressing(Set.of(senderActorUrl + "/followers"), Set.of(), Set.of());
    }

    public static Addressing direct(Collection<String> actorUrls) {
        return new Addressing(actorUrls, Set.of(), Set.of());
    }

    /**
     * Reads {@code to}, {@code cc}, {@code bcc} and {@code bto} from an activity. Each may be a string or an array.
     * {@code bto} is folded into {@code bcc}.
     */
    public static Addressing fromActivity(JsonNode activity) {
        Set<String> bcc = new LinkedHashSet<>(readRecipients(activity, "bcc"));
        bcc.addAll(readRecipients(activity, "bto"));
        return new Addressing(readRecipients(activity, "to"), readRecipients(activity, "cc"), bcc);
    }

    /**
     * Every recipient in to, cc and bcc.
     */
    public Set<String> allRecipients() {
        Set<String> all = new LinkedHashSet<>(to);
        all.addAll(cc);
        all.addAll(bcc);
        return all;
    }

    public boolean isPublic() {
        return allRecipients().stream().anyMatch(ActivityStreams::isPublic);
    }

    private static Set<String> readRecipients(JsonNode activity, String field) {
        Set<String> recipients = new LinkedHashSet<>();
        JsonNode node = activity == null ? null : activity.get(field);
        if (node == null || node.isNull()) {
            return recipients;
        }
        if (node.isTextual()) {
            recipients.add(node.asText());
        } else if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isTextual()) {
                    recipients.add(item.asText());
                } else if (item.hasNonNull("id")) {
                    recipients.add(item.get("id").asText());
                }
            }
        }
        return recipients;
    }

    private static Set<String> copy(Collection<String> values) {
        return values == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }
}
