package com.example.vehicleplatereader.service.intake;

import com.example.vehicleplatereader.config.PlateReaderProperties;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Owns the upload directory. Every request gets its own {@link RequestArtifacts}
 * scope, so files never outlive the request that created them.
 */
@Component
public class UploadStorage {

    private static final Logger log = LoggerFactory.getLogger(UploadStorage.class);

    private final Path directory;

    public UploadStorage(PlateReaderProperties properties) {
        String configured = properties.upload().directory();
        this.directory = configured == null || configured.isBlank()
                ? Path.of(System.getProperty("java.io.tmpdir"), "vehicle-plate-reader", "uploads")
                : Path.of(configured);
    }

    @PostConstruct
    void createDirectory() {
        try {
            Files.createDirectories(directory);
            log.info("Storing request artifacts under {}", directory.toAbsolutePath());
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to create upload directory " + directory, ex);
        }
    }

    public Path directory() {
        return directory;
    }

    public RequestArtifacts openScope() {
        return new RequestArtifacts(directory);
    }
}
