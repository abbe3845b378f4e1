package com.example.vehicleplatereader.service.detection;

import java.nio.file.Path;

/**
 * Locates and crops a licence plate inside a stored image. Implementations can
 * rely on a deep learning model (e.g. YOLO) or treat the whole image as the plate;
 * they are wired in through {@code DetectorConfiguration}.
 */
public interface PlateDetector {

    /**
     * @param imagePath image stored for the current request
     * @return detection result; the crop is {@code null} when no plate was found
     */
    PlateDetection detect(Path imagePath);
}
