package com.e2eq.twins.core;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;

/**
 * Weak etags derived from the entity key and the write timestamp: the MD5 of
 * {@code "<key>-<timestamp>"} rendered as a UUID, e.g. {@code W/"1c8b...-..."}.
 */
public final class ETagGenerator {

    private ETagGenerator() {
    }

    public static String generate(String entityKey, Instant timestamp) {
        String seed = entityKey + "-" + timestamp;
        return "W/\"" + UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8)) + "\"";
    }
}
