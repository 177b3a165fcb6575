package com.example.mailmerge.repository;

import com.example.mailmerge.exception.ConfigException;
import com.example.mailmerge.model.Credential;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;

/**
 * Token store as a JSON file. A save writes and fsyncs a sibling temp file, then renames it over
 * the target, so a crash mid-write leaves the previous file untouched.
 */
@Repository
@Slf4j
public class FileCredentialRepository implements CredentialRepository {

    private final ObjectMapper objectMapper;
    private final Path tokenPath;

    public FileCredentialRepository(ObjectMapper objectMapper,
                                    @Value("${google.token-store:token.json}") Path tokenPath) {
        this.objectMapper = objectMapper.copy()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.tokenPath = tokenPath.toAbsolutePath();
    }

    @Override
    public Optional<Credential> load() {
        if (!Files.exists(tokenPath)) {
            log.info("No stored credential at {}", tokenPath);
            return Optional.empty();
        }
        try {
            Credential credential = objectMapper.readValue(tokenPath.toFile(), Credential.class);
            log.info("Loaded stored credential from {}", tokenPath);
            return Optional.of(credential);
        } catch (IOException e) {
            throw new ConfigException("Token store " + tokenPath + " is unreadable or corrupt; delete it to re-authorize", e);
        }
    }

    @Override
    public void save(Credential credential) {
        Path directory = tokenPath.getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, tokenPath.getFileName() + ".", ".tmp");
            restrictToOwner(temp);
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(objectMapper.writeValueAsBytes(credential));
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(temp, tokenPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic rename not supported in {}, falling back to plain replace", directory);
                Files.move(temp, tokenPath, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("Saved credential to {}", tokenPath);
        } catch (IOException e) {
            throw new ConfigException("Failed to persist credential to " + tokenPath, e);
        } finally {
            deleteQuietly(temp);
        }
    }

    private static void restrictToOwner(Path file) throws IOException {
        try {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException e) {
            log.debug("POSIX permissions not supported for {}", file);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to delete temporary token file {}", temp, e);
        }
    }
}
