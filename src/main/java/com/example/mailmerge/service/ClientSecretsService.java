package com.example.mailmerge.service;

import com.example.mailmerge.dto.GoogleClientSecrets;
import com.example.mailmerge.exception.ConfigException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Lazily loads the OAuth client identity. Dry runs never touch it.
 */
@Service
@Slf4j
public class ClientSecretsService {

    private final ObjectMapper objectMapper;
    private final Path clientSecretsPath;
    private GoogleClientSecrets.Details details;

    public ClientSecretsService(ObjectMapper objectMapper,
                                @Value("${google.client-secrets:credentials.json}") Path clientSecretsPath) {
        this.objectMapper = objectMapper;
        this.clientSecretsPath = clientSecretsPath;
    }

    public synchronized GoogleClientSecrets.Details getDetails() {
        if (details == null) {
            details = load();
        }
        return details;
    }

    private GoogleClientSecrets.Details load() {
        if (!Files.isReadable(clientSecretsPath)) {
            throw new ConfigException("OAuth client secrets not found at " + clientSecretsPath
                    + ". Download the desktop client JSON from the Google Cloud console.");
        }
        GoogleClientSecrets secrets;
        try {
            secrets = objectMapper.readValue(clientSecretsPath.toFile(), GoogleClientSecrets.class);
        } catch (IOException e) {
            throw new ConfigException("Malformed OAuth client secrets " + clientSecretsPath, e);
        }
        GoogleClientSecrets.Details loaded = secrets.getDetails();
        if (loaded == null || isBlank(loaded.getClientId()) || isBlank(loaded.getClientSecret())) {
            throw new ConfigException("OAuth client secrets " + clientSecretsPath
                    + " must contain an 'installed' or 'web' client with client_id and client_secret");
        }
        log.info("Loaded OAuth client {} from {}", loaded.getClientId(), clientSecretsPath);
        return loaded;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
