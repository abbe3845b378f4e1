package com.example.vehicleplatereader.service.intake;

import java.util.Objects;

/**
 * A validated image upload. Lives for a single request.
 *
 * @param content           raw image bytes, never empty
 * @param originalFilename  name as sent by the client, may be {@code null} for raw bodies
 * @param sanitizedFilename single safe path segment derived from the original name
 * @param extension         lower-cased extension used for artifact names and MIME lookup
 * @param contentType       declared content type, may be {@code null}
 * @param origin            how the image reached the service
 */
public record ImageSubmission(
        byte[] content,
        String originalFilename,
        String sanitizedFilename,
        String extension,
        String contentType,
        Origin origin) {

    public enum Origin {
        MULTIPART,
        RAW_BODY
    }

    public ImageSubmission {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(sanitizedFilename, "sanitizedFilename");
        Objects.requireNonNull(extension, "extension");
        Objects.requireNonNull(origin, "origin");
    }

    public int size() {
        return content.length;
    }
}
