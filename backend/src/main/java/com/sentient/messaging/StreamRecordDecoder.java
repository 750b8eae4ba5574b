package com.sentient.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentient.exception.InvalidStreamRecordException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Decodes a transport-encoded stream record.
 *
 * Wire format: base64 of UTF-8 JSON {@code {"text": "...", "userId": "..."}}.
 * A missing or blank {@code userId} becomes {@link ReflectionInput#ANONYMOUS_USER};
 * a missing {@code text} decodes to an empty string and is left for the
 * caller to skip.
 */
@Component
@RequiredArgsConstructor
public class StreamRecordDecoder {

    private final ObjectMapper objectMapper;

    /**
     * @param body raw record body
     * @return decoded reflection
     * @throws InvalidStreamRecordException if the body is not base64 or not a JSON object
     */
    public ReflectionInput decode(byte[] body) {
        if (body == null || body.length == 0) {
            throw new InvalidStreamRecordException("Stream record is empty");
        }

        byte[] json;
        try {
            String encoded = new String(body, StandardCharsets.US_ASCII).strip();
            json = Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new InvalidStreamRecordException("Stream record is not valid base64", e);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(new String(json, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new InvalidStreamRecordException("Stream record is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidStreamRecordException("Stream record must be a JSON object");
        }

        String text = root.path("text").isTextual() ? root.get("text").asText() : "";
        String userId = root.path("userId").isTextual() ? root.get("userId").asText().strip() : "";
        if (userId.isEmpty()) {
            userId = ReflectionInput.ANONYMOUS_USER;
        }

        return new ReflectionInput(text, userId);
    }
}
