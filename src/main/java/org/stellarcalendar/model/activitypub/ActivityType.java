package org.stellarcalendar.model.activitypub;

import java.util.Arrays;
import java.util.Optional;

/**
 * Activity types the engine accepts, each with the object shapes it allows.
 */
public enum ActivityType {

    CREATE("Create", ObjectShape.EMBEDDED),
    UPDATE("Update", ObjectShape.EMBEDDED),
    DELETE("Delete", ObjectShape.EITHER),
    FOLLOW("Follow", ObjectShape.REFERENCE),
    ACCEPT("Accept", ObjectShape.EITHER),
    REJECT("Reject", ObjectShape.EITHER),
    TENTATIVE_ACCEPT("TentativeAccept", ObjectShape.REFERENCE),
    LIKE("Like", ObjectShape.REFERENCE),
    UNDO("Undo", ObjectShape.EITHER),
    ANNOUNCE("Announce", ObjectShape.EITHER);

    private final String name;
    private final ObjectShape objectShape;

    ActivityType(String name, ObjectShape objectShape) {
        this.name = name;
        this.objectShape = objectShape;
    }

    public String getName() {
        return name;
    }

    public ObjectShape getObjectShape() {
        return objectShape;
    }

    public static Optional<ActivityType> fromName(String name) {
        return Arrays.stream(values()).filter(type -> type.name.equals(name)).findFirst();
    }

    /**
     * Whether the activity's object is a URI reference, an embedded object, or may be either.
     */
    public enum ObjectShape {
        REFERENCE,
        EMBEDDED,
        EITHER;

        public boolean allows(ActivityObject object) {
            return switch (this) {
                case REFERENCE -> !object.isEmbedded();
                case EMBEDDED -> object.isEmbedded();
                case EITHER -> true;
            };
        }
    }
}
