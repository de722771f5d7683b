package com.landrecords.ec.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.landrecords.ec.config.EcSearchProperties;
import com.landrecords.ec.model.SessionArtifact;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Keeps the last externally obtained session on disk as JSON so a restart does not
 * force a new login while the artifact is still inside its TTL.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SessionFileStore implements SessionAcquirer {

    private final ObjectMapper objectMapper;
    private final EcSearchProperties properties;

    public boolean exists() {
        return Files.isRegularFile(path());
    }

    public void save(SessionArtifact artifact) {
        Path file = path();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), artifact);
            log.info("Session saved to {}", file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot save session to " + file, e);
        }
    }

    /** Reads the saved artifact. */
    @Override
    public SessionArtifact acquireSession() {
        Path file = path();
        try {
            return objectMapper.readValue(file.toFile(), SessionArtifact.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read saved session " + file, e);
        }
    }

    public void delete() {
        try {
            Files.deleteIfExists(path());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot delete saved session " + path(), e);
        }
    }

    private Path path() {
        return Paths.get(properties.getSession().getFile());
    }
}
