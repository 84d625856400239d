package org.stellarcalendar.model.activitypub;

/**
 * ActivityStreams and ActivityPub constants.
 */
public final class ActivityStreams {

    public static final String CONTEXT = "https://www.w3.org/ns/activitystreams";
    public static final String SECURITY_CONTEXT = "https://w3id.org/security/v1";

    /**
     * Sentinel recipient meaning "public". Also accepted in the compact forms {@code as:Public} and {@code Public}.
     */
    public static final String PUBLIC_COLLECTION = "https://www.w3.org/ns/activitystreams#Public";

    public static final String ACTIVITY_JSON = "application/activity+json";
    public static final String LD_JSON = "application/ld+json; profile=\"https://www.w3.org/ns/activitystreams\"";

    private ActivityStreams() {
    }

    public static boolean isPublic(String recipient) {
        return PUBLIC_COLLECTION.equals(recipient) || "as:Public".equals(recipient) || "Public".equals(recipient);
    }
}
