package com.sentient.secrets;

import com.sentient.exception.SecretResolutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the secret document from a mounted file, {@code {directory}/{name}}.
 * Suits container orchestrators that project secrets as files.
 */
@Component
@ConditionalOnProperty(name = "app.secrets.source", havingValue = "file")
@Slf4j
public class FileSecretsSource implements SecretsSource {

    private final Path directory;

    public FileSecretsSource(@Value("${app.secrets.directory:/run/secrets}") String directory) {
        this.directory = Path.of(directory);
    }

    @Override
    public String fetch(String secretName) {
        Path file = directory.resolve(secretName);
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            log.debug("Resolved secret document from file: path={}", file);
            return content;
        } catch (IOException e) {
            throw new SecretResolutionException("Cannot read secret file: " + file, e);
        }
    }
}
