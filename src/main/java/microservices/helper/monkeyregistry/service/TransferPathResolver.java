package microservices.helper.monkeyregistry.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

import lombok.extern.slf4j.Slf4j;
import microservices.helper.monkeyregistry.exception.StorageException;
import microservices.helper.monkeyregistry.exception.ValidationException;

/**
 * Confines import and export files named in HTTP requests to one transfer directory.
 * <p>
 * Requested paths are resolved against the directory and normalized; anything that
 * lands outside it, through {@code ..}, an absolute path or a symbolic link, is rejected.
 */
@Slf4j
public class TransferPathResolver {

    private static final String FIELD = "file";

    private final Path baseDirectory;

    public TransferPathResolver(Path baseDirectory) {
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.baseDirectory);
        } catch (IOException e) {
            throw new StorageException("Failed to create transfer directory " + this.baseDirectory, e);
        }
        log.info("Import and export files are resolved against {}", this.baseDirectory);
    }

    public Path resolve(String requested) {
        if (requested == null || requested.isBlank()) {
            throw new ValidationException(FIELD, "file is required");
        }
        Path candidate;
        try {
            candidate = baseDirectory.resolve(requested.trim()).normalize();
        } catch (InvalidPathException e) {
            throw new ValidationException(FIELD, "file is not a valid path", e);
        }
        if (!candidate.startsWith(baseDirectory) || candidate.equals(baseDirectory) || !staysInsideWhenLinked(candidate)) {
            log.warn("Rejected transfer path {} outside {}", requested, baseDirectory);
            throw new ValidationException(FIELD, "file must be inside the transfer directory");
        }
        return candidate;
    }

    private boolean staysInsideWhenLinked(Path candidate) {
        Path existing = candidate;
        while (existing != null && Files.notExists(existing)) {
            existing = existing.getParent();
        }
        if (existing == null) {
            return false;
        }
        try {
            return existing.toRealPath().startsWith(baseDirectory.toRealPath());
        } catch (IOException e) {
            throw new StorageException("Failed to resolve transfer path " + candidate, e);
        }
    }
}
