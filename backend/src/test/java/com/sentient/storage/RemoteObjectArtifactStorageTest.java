package com.sentient.storage;

import com.sentient.exception.ProcessingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("RemoteObjectArtifactStorage Unit Tests")
class RemoteObjectArtifactStorageTest {

    private static final String KEY = "artifacts/user-1/2025/03/14/rec-1.txt";

    private MockRestServiceServer server;
    private RemoteObjectArtifactStorage storage;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        storage = new RemoteObjectArtifactStorage(builder, "https://storage.test/", "service-key", "sentient-artifacts");
    }

    @Test
    @DisplayName("store should upsert the object and return its public URL")
    void testStore() {
        // Arrange
        server.expect(requestTo("https://storage.test/storage/v1/object/sentient-artifacts/" + KEY))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer service-key"))
                .andExpect(header("x-upsert", "true"))
                .andExpect(header("x-meta-record-id", "rec-1"))
                .andExpect(content().string("canvas"))
                .andRespond(withSuccess());

        // Act
        String url = storage.store(KEY, "canvas", Map.of("record_id", "rec-1"));

        // Assert
        assertEquals("https://storage.test/storage/v1/object/public/sentient-artifacts/" + KEY, url);
        server.verify();
    }

    @Test
    @DisplayName("store should keep reserved characters of the user id inside its path segment")
    void testStoreEncodesUserId() {
        // Arrange
        String key = ArtifactKeys.canvasKey("user{x}?#", "rec-1", Instant.parse("2025-03-14T10:00:00Z"));
        String encodedKey = "artifacts/user%7Bx%7D%3F%23/2025/03/14/rec-1.txt";
        server.expect(requestTo("https://storage.test/storage/v1/object/sentient-artifacts/" + encodedKey))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess());

        // Act
        String url = storage.store(key, "canvas", Map.of());

        // Assert
        assertEquals("https://storage.test/storage/v1/object/public/sentient-artifacts/" + encodedKey, url);
        server.verify();
    }

    @Test
    @DisplayName("store should raise an upload failure on an error response")
    void testStoreFailure() {
        // Arrange
        server.expect(requestTo("https://storage.test/storage/v1/object/sentient-artifacts/" + KEY))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        // Act
        ProcessingException ex = assertThrows(ProcessingException.class,
                () -> storage.store(KEY, "canvas", Map.of()));

        // Assert
        assertEquals("UPLOAD_FAILED", ex.getErrorCode());
    }
}
