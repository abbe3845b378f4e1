package com.example.vehicleplatereader.service.intake;

import com.example.vehicleplatereader.config.PlateReaderProperties;
import com.example.vehicleplatereader.service.RecognitionError;
import com.example.vehicleplatereader.service.RecognitionException;
import com.example.vehicleplatereader.util.FileNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Checks presence, format and size of an inbound image before any expensive work
 * happens. Nothing is written to disk here.
 */
@Component
public class ImageIntakeValidator {

    private static final Logger log = LoggerFactory.getLogger(ImageIntakeValidator.class);

    public static final String NO_IMAGE_MESSAGE =
            "No image file provided. Send image as form-data with key \"image\" or \"file\", or as raw binary data.";
    static final String RAW_BODY_FILENAME = "upload.jpg";

    private final Set<String> allowedExtensions;
    private final long maxFileSizeBytes;

    public ImageIntakeValidator(PlateReaderProperties properties) {
        Set<String> extensions = new LinkedHashSet<>();
        for (String extension : properties.upload().allowedExtensions()) {
            String normalized = extension.trim().toLowerCase(Locale.ROOT);
            if (normalized.startsWith(".")) {
                normalized = normalized.substring(1);
            }
            if (!normalized.isEmpty()) {
                extensions.add(normalized);
            }
        }
        this.allowedExtensions = Collections.unmodifiableSet(extensions);
        this.maxFileSizeBytes = properties.upload().maxFileSize().toBytes();
    }

    /**
     * Validates a multipart submission. The {@code image} part wins when both
     * accepted field names are present.
     */
    public ImageSubmission validateMultipart(MultipartFile image, MultipartFile file) {
        MultipartFile part = image != null ? image : file;
        if (part == null) {
            throw new RecognitionException(RecognitionError.MISSING_INPUT, NO_IMAGE_MESSAGE);
        }

        String filename = part.getOriginalFilename();
        if (filename == null || filename.isBlank()) {
            throw new RecognitionException(RecognitionError.MISSING_INPUT, "No file selected");
        }

        Optional<String> extension = FileNames.extension(filename).filter(allowedExtensions::contains);
        if (extension.isEmpty()) {
            log.debug("Rejected upload {} with unsupported extension", FileNames.sanitize(filename));
            throw new RecognitionException(RecognitionError.UNSUPPORTED_FORMAT,
                    "Invalid file type. Allowed types: " + String.join(", ", allowedExtensions));
        }

        if (part.isEmpty()) {
            throw new RecognitionException(RecognitionError.MISSING_INPUT, "Uploaded file " + FileNames.sanitize(filename) + " is empty");
        }
        checkSize(part.getSize());

        byte[] content;
        try {
            content = part.getBytes();
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read uploaded image " + FileNames.sanitize(filename), ex);
        }
        return new ImageSubmission(content, filename, FileNames.sanitize(filename), extension.get(),
                part.getContentType(), ImageSubmission.Origin.MULTIPART);
    }

    /**
     * Validates a raw binary body. Any {@code image/*} payload is accepted; the
     * detector decides later whether it can be decoded.
     */
    public ImageSubmission validateRawBody(byte[] body, String contentType) {
        if (contentType == null || !contentType.toLowerCase(Locale.ROOT).contains("image")) {
            throw new RecognitionException(RecognitionError.MISSING_INPUT, NO_IMAGE_MESSAGE);
        }
        if (body == null || body.length == 0) {
            throw new RecognitionException(RecognitionError.MISSING_INPUT, NO_IMAGE_MESSAGE);
        }
        checkSize(body.length);
        return new ImageSubmission(body, null, RAW_BODY_FILENAME, "jpg", contentType, ImageSubmission.Origin.RAW_BODY);
    }

    public Set<String> allowedExtensions() {
        return allowedExtensions;
    }

    private void checkSize(long size) {
        if (size > maxFileSizeBytes) {
            throw new RecognitionException(RecognitionError.PAYLOAD_TOO_LARGE,
                    "Image exceeds the maximum size of " + maxFileSizeBytes + " bytes");
        }
    }
}
