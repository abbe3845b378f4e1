package com.example.vehicleplatereader.service.detection;

import com.example.vehicleplatereader.model.BoundingBox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * Calls the configured {@link PlateDetector} and reduces its output to found or
 * not found. A missing crop and an empty crop are treated the same way.
 */
@Component
public class PlateDetectionInvoker {

    private static final Logger log = LoggerFactory.getLogger(PlateDetectionInvoker.class);

    private final PlateDetector detector;

    public PlateDetectionInvoker(PlateDetector detector) {
        this.detector = detector;
    }

    public DetectionOutcome invoke(Path imagePath) {
        PlateDetection detection = detector.detect(imagePath);
        if (detection == null) {
            log.debug("Detector returned no result for {}", imagePath.getFileName());
            return DetectionOutcome.notFound();
        }
        BufferedImage plate = detection.plate();
        if (plate == null || plate.getWidth() == 0 || plate.getHeight() == 0) {
            log.debug("No plate found in {}", imagePath.getFileName());
            return DetectionOutcome.notFound();
        }
        BoundingBox region = detection.region() != null
                ? detection.region()
                : new BoundingBox(0, detection.topOffset(), plate.getWidth(), plate.getHeight());
        if (region.isEmpty()) {
            log.debug("Detector reported an empty plate region for {}", imagePath.getFileName());
            return DetectionOutcome.notFound();
        }
        log.debug("Plate found in {} at {}", imagePath.getFileName(), region);
        return DetectionOutcome.found(plate, region);
    }
}
