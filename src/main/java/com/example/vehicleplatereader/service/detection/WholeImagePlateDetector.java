package com.example.vehicleplatereader.service.detection;

import com.example.vehicleplatereader.model.BoundingBox;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Fallback detector that returns the whole decodable image as the plate region.
 * Used when no YOLO model is configured; an image that cannot be decoded yields
 * no plate.
 */
public class WholeImagePlateDetector implements PlateDetector {

    @Override
    public PlateDetection detect(Path imagePath) {
        BufferedImage image;
        try {
            image = ImageIO.read(imagePath.toFile());
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read image " + imagePath.getFileName(), ex);
        }
        if (image == null) {
            return PlateDetection.nothing(null);
        }
        return new PlateDetection(image, image, 0, new BoundingBox(0, 0, image.getWidth(), image.getHeight()));
    }
}
