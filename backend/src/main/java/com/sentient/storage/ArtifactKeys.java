package com.sentient.storage;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Object key layout: {@code artifacts/{userId}/{yyyy/MM/dd}/{recordId}.txt}, date in UTC.
 */
public final class ArtifactKeys {

    private static final DateTimeFormatter DATE_PATH =
            DateTimeFormatter.ofPattern("yyyy/MM/dd").withZone(ZoneOffset.UTC);

    private ArtifactKeys() {
    }

    public static String canvasKey(String userId, String recordId, Instant at) {
        return "artifacts/" + userId + "/" + DATE_PATH.format(at) + "/" + recordId + ".txt";
    }
}
