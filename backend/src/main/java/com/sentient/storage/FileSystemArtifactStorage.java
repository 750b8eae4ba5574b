package com.sentient.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentient.exception.ProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;

/**
 * Local storage mode: writes canvases under {@code {root}/{bucket}/{key}}.
 *
 * Metadata is written next to the object as {@code {key}.metadata.json}.
 * Returned URLs have the form {@code {publicBaseUrl}/{bucket}/{key}}, matching
 * whatever static file server or emulator fronts the root directory.
 */
@Component
@ConditionalOnProperty(name = "app.storage.mode", havingValue = "local", matchIfMissing = true)
@Slf4j
public class FileSystemArtifactStorage implements ArtifactStorage {

    private final Path bucketRoot;
    private final String publicBaseUrl;
    private final String bucket;
    private final ObjectMapper objectMapper;

    public FileSystemArtifactStorage(
            @Value("${app.storage.local.root:./data/storage}") String root,
            @Value("${app.storage.public-base-url:http://localhost:4566}") String publicBaseUrl,
            @Value("${app.storage.bucket:sentient-artifacts}") String bucket,
            ObjectMapper objectMapper
    ) {
        this.bucketRoot = Path.of(root).toAbsolutePath().normalize().resolve(bucket);
        this.publicBaseUrl = publicBaseUrl.endsWith("/")
                ? publicBaseUrl.substring(0, publicBaseUrl.length() - 1)
                : publicBaseUrl;
        this.bucket = bucket;
        this.objectMapper = objectMapper;
        log.info("Local artifact storage configured: root={}, publicBaseUrl={}", bucketRoot, this.publicBaseUrl);
    }

    @Override
    public String store(String key, String content, Map<String, String> metadata) {
        Path target = bucketRoot.resolve(key).normalize();
        if (!target.startsWith(bucketRoot)) {
            throw ProcessingException.uploadFailed(key, new IllegalArgumentException("Key escapes storage root"));
        }

        try {
            Files.createDirectories(target.getParent());
            writeAtomically(target, content.getBytes(StandardCharsets.UTF_8));
            writeAtomically(target.resolveSibling(target.getFileName() + ".metadata.json"),
                    objectMapper.writeValueAsBytes(metadata));
        } catch (IOException e) {
            log.error("Failed to write artifact: key={}, error={}", key, e.getMessage());
            throw ProcessingException.uploadFailed(key, e);
        }

        String url = publicBaseUrl + "/" + bucket + "/" + key;
        log.info("Artifact stored: {}", url);
        return url;
    }

    private void writeAtomically(Path target, byte[] bytes) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.write(tmp, bytes);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
