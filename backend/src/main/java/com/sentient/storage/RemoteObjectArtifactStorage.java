package com.sentient.storage;

import com.sentient.exception.ProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Remote storage mode: uploads canvases through an object storage REST API.
 *
 * Upload: {@code POST {url}/storage/v1/object/{bucket}/{key}} with the service
 * key as bearer token and {@code x-upsert: true} so retries overwrite.
 * Metadata travels as {@code x-meta-*} headers.
 * Public URL: {@code {url}/storage/v1/object/public/{bucket}/{key}}.
 */
@Component
@ConditionalOnProperty(name = "app.storage.mode", havingValue = "remote")
@Slf4j
public class RemoteObjectArtifactStorage implements ArtifactStorage {

    private final RestClient restClient;
    private final String storageUrl;
    private final String bucket;

    public RemoteObjectArtifactStorage(
            RestClient.Builder restClientBuilder,
            @Value("${app.storage.remote.url}") String storageUrl,
            @Value("${app.storage.remote.service-key}") String serviceKey,
            @Value("${app.storage.bucket:sentient-artifacts}") String bucket
    ) {
        this.storageUrl = storageUrl.endsWith("/") ? storageUrl.substring(0, storageUrl.length() - 1) : storageUrl;
        this.bucket = bucket;
        this.restClient = restClientBuilder
                .baseUrl(this.storageUrl)
                .defaultHeader("Authorization", "Bearer " + serviceKey)
                .build();
        log.info("Remote artifact storage configured: url={}, bucket={}", this.storageUrl, bucket);
    }

    @Override
    public String store(String key, String content, Map<String, String> metadata) {
        URI uploadUri = objectUri(key, "storage", "v1", "object", bucket);
        try {
            restClient.post()
                    .uri(uploadUri)
                    .contentType(MediaType.parseMediaType(CONTENT_TYPE))
                    .header("x-upsert", "true")
                    .headers(headers -> metadata.forEach((name, value) ->
                            headers.add("x-meta-" + name.replace('_', '-'), value)))
                    .body(content.getBytes(StandardCharsets.UTF_8))
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientException e) {
            log.error("Failed to upload artifact: key={}, error={}", key, e.getMessage());
            throw ProcessingException.uploadFailed(key, e);
        }

        String url = objectUri(key, "storage", "v1", "object", "public", bucket).toString();
        log.info("Artifact uploaded: {}", url);
        return url;
    }

    /**
     * Key segments are encoded one by one, so user ids with reserved characters
     * stay inside their own path segment.
     */
    private URI objectUri(String key, String... prefix) {
        return UriComponentsBuilder.fromUriString(storageUrl)
                .pathSegment(prefix)
                .pathSegment(key.split("/"))
                .build()
                .encode()
                .toUri();
    }
}
