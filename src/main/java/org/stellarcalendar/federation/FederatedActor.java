package org.stellarcalendar.federation;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.util.UUID;

/**
 * A federated identity as seen by the engine, either a local user or a cached remote actor.
 * Only local actors carry a private key.
 */
@Value
@Builder
public class FederatedActor {

    String actorUrl;

    /**
     * {@code username} for local actors, {@code username@domain} for remote ones.
     */
    String handle;

    String inboxUrl;

    String sharedInboxUrl;

    String publicKeyPem;

    /**
     * Decrypted PEM, present for local actors only.
     */
    @ToString.Exclude
    String privateKeyPem;

    boolean remote;

    /**
     * Local user id, null for remote actors.
     */
    UUID localUserId;

    boolean autoAcceptFollowers;

    public String getKeyId() {
        return actorUrl + "#main-key";
    }

    /**
     * Inbox to deliver to: shared inbox when advertised, personal inbox otherwise.
     */
    public String getDeliveryInbox() {
        return sharedInboxUrl != null && !sharedInboxUrl.isBlank() ? sharedInboxUrl : inboxUrl;
    }
}
