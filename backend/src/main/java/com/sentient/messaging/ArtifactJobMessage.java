package com.sentient.messaging;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Canvas job published after a plan record is stored.
 *
 * <pre>
 * {"record_id": "...", "user_id": "...", "emotion": "anxious", "timestamp": "2025-01-15T10:31:00.123456Z"}
 * </pre>
 *
 * @param recordId correlation token of the stored record
 * @param userId owning user
 * @param emotion emotion label used to pick the canvas
 * @param timestamp ISO-8601 creation instant of the record
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ArtifactJobMessage(
        @JsonProperty("record_id") String recordId,
        @JsonProperty("user_id") String userId,
        @JsonProperty("emotion") String emotion,
        @JsonProperty("timestamp") String timestamp
) {
}
