package com.example.vehicleplatereader.service.extraction;

import com.example.vehicleplatereader.config.PlateReaderProperties;
import com.example.vehicleplatereader.model.PlateRecord;
import com.example.vehicleplatereader.util.FileNames;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a cropped plate into an {@link ExtractionRequest}: the crop is written to
 * a request artifact, base64 encoded and paired with the fixed instruction.
 */
@Component
public class ExtractionRequestBuilder {

    static final String DEFAULT_MIME_TYPE = "image/jpeg";

    private static final Map<String, String> MIME_TYPES = Map.of(
            "jpg", "image/jpeg",
            "jpeg", "image/jpeg",
            "png", "image/png",
            "gif", "image/gif",
            "bmp", "image/bmp");

    static final String INSTRUCTION =
            "You are reading a vehicle licence plate. The plate has exactly three parts:\n"
            + "- \"" + PlateRecord.LEFT_NUMBER + "\": the numeric segment on the left\n"
            + "- \"" + PlateRecord.MIDDLE_TEXT + "\": the letter segment in the middle\n"
            + "- \"" + PlateRecord.RIGHT_NUMBER + "\": the numeric segment on the right\n"
            + "Return the middle segment in its original script exactly as printed. Do not transliterate or translate it.\n"
            + "If any part cannot be read with confidence, set its value to \"" + PlateRecord.UNREADABLE + "\".\n"
            + "Reply with a single JSON object containing exactly the keys \"" + PlateRecord.LEFT_NUMBER + "\", \""
            + PlateRecord.MIDDLE_TEXT + "\" and \"" + PlateRecord.RIGHT_NUMBER + "\" with string values. "
            + "Do not add any explanation, markdown or other text.";

    private final PlateReaderProperties.OpenAi settings;

    public ExtractionRequestBuilder(PlateReaderProperties properties) {
        this.settings = properties.openai();
    }

    /**
     * Writes the plate to {@code artifact} in the format implied by its extension
     * and builds the request from the written bytes.
     */
    public ExtractionRequest build(BufferedImage plate, Path artifact) {
        Objects.requireNonNull(plate, "plate");
        String extension = FileNames.extension(artifact.getFileName().toString()).orElse("jpg");
        String format = MIME_TYPES.containsKey(extension) ? extension : "jpg";
        try {
            if (!ImageIO.write(prepareForFormat(plate, format), format, artifact.toFile())) {
                throw new IllegalStateException("No image writer available for format " + format);
            }
            return build(Files.readAllBytes(artifact), artifact.getFileName().toString());
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to encode plate image " + artifact.getFileName(), ex);
        }
    }

    public ExtractionRequest build(byte[] imageBytes, String fileName) {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new IllegalArgumentException("Plate image must not be empty");
        }
        return new ExtractionRequest(
                settings.model(),
                mimeTypeFor(fileName),
                Base64.getEncoder().encodeToString(imageBytes),
                INSTRUCTION,
                settings.maxTokens(),
                settings.jsonResponseMode());
    }

    public static String mimeTypeFor(String fileName) {
        return FileNames.extension(fileName)
                .map(MIME_TYPES::get)
                .orElse(DEFAULT_MIME_TYPE);
    }

    // jpeg and bmp writers reject images with an alpha channel
    private static BufferedImage prepareForFormat(BufferedImage image, String format) {
        boolean opaqueFormat = "jpg".equals(format) || "jpeg".equals(format) || "bmp".equals(format);
        if (!opaqueFormat || !image.getColorModel().hasAlpha()) {
            return image;
        }
        BufferedImage converted = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D graphics = converted.createGraphics();
        try {
            graphics.drawImage(image, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return converted;
    }
}
