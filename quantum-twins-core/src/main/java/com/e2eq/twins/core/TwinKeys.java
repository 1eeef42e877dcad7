package com.e2eq.twins.core;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reserved keys of the twin and relationship wire shapes.
 */
public final class TwinKeys {
    public static final String DT_ID = "$dtId";
    public static final String ETAG = "$etag";
    public static final String METADATA = "$metadata";
    public static final String MODEL = "$model";
    public static final String LAST_UPDATE_TIME = "$lastUpdateTime";
    public static final String PROPERTY_LAST_UPDATE_TIME = "lastUpdateTime";

    public static final String RELATIONSHIP_ID = "$relationshipId";
    public static final String SOURCE_ID = "$sourceId";
    public static final String TARGET_ID = "$targetId";
    public static final String RELATIONSHIP_NAME = "$relationshipName";

    /** Twin keys never validated against the model. */
    public static final Set<String> TWIN_RESERVED = Set.of(DT_ID, ETAG, METADATA);

    /** Twin keys a patch may not touch. */
    public static final Set<String> TWIN_IMMUTABLE = Set.of(DT_ID, ETAG);

    public static final Set<String> RELATIONSHIP_RESERVED = Set.of(RELATIONSHIP_ID, SOURCE_ID, TARGET_ID, RELATIONSHIP_NAME, ETAG);

    /** Relationship names become edge labels, so they are restricted to identifiers. */
    public static final Pattern RELATIONSHIP_NAME_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public static boolean isValidRelationshipName(String name) {
        return name != null && RELATIONSHIP_NAME_PATTERN.matcher(name).matches();
    }

    private TwinKeys() {
    }
}
