package com.example.vehicleplatereader.service.intake;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Temporary files created while serving one request. Each tracked file is deleted
 * exactly once, either explicitly through {@link #delete(Path)} or when the scope
 * is released. Not thread-safe; a scope belongs to a single request thread.
 */
public class RequestArtifacts implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RequestArtifacts.class);

    private final Path directory;
    private final Set<Path> tracked = new LinkedHashSet<>();

    RequestArtifacts(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    /**
     * Writes the submission to a uniquely named file in the upload directory.
     */
    public Path store(ImageSubmission submission) {
        Path target = allocate("upload-", "-" + submission.sanitizedFilename());
        try {
            Files.write(target, submission.content());
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to store upload " + submission.sanitizedFilename(), ex);
        }
        return target;
    }

    /**
     * Creates an empty tracked file. The suffix must already be sanitized.
     */
    public Path allocate(String prefix, String suffix) {
        try {
            Path file = Files.createTempFile(directory, prefix, suffix);
            tracked.add(file);
            return file;
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to allocate temporary file in " + directory, ex);
        }
    }

    /**
     * Deletes a tracked file now. Calling it again, or for an untracked path, does nothing.
     *
     * @return {@code true} when a file was removed
     */
    public boolean delete(Path file) {
        if (!tracked.remove(file)) {
            return false;
        }
        try {
            return Files.deleteIfExists(file);
        } catch (IOException ex) {
            log.warn("Failed to delete temporary file {}", file, ex);
            return false;
        }
    }

    /**
     * Deletes every file still tracked.
     *
     * @return number of files removed
     */
    public int release() {
        int removed = 0;
        for (Path file : List.copyOf(tracked)) {
            if (delete(file)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Released {} temporary file(s)", removed);
        }
        return removed;
    }

    public List<Path> files() {
        return new ArrayList<>(tracked);
    }

    @Override
    public void close() {
        release();
    }
}
