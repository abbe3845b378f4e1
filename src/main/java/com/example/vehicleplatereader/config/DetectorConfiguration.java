package com.example.vehicleplatereader.config;

import com.example.vehicleplatereader.service.detection.OpenCvYoloDetector;
import com.example.vehicleplatereader.service.detection.PlateDetector;
import com.example.vehicleplatereader.service.detection.WholeImagePlateDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Chooses the {@link PlateDetector}. The YOLO detector is used when a model file
 * is configured and present; otherwise the whole image is sent for extraction.
 */
@Configuration
public class DetectorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DetectorConfiguration.class);

    @Bean
    public PlateDetector plateDetector(PlateReaderProperties properties) {
        PlateReaderProperties.Detector detector = properties.detector();
        String modelPath = detector.modelPath();
        if (modelPath != null && !modelPath.isBlank()) {
            if (Files.isRegularFile(Path.of(modelPath))) {
                log.info("Using YOLO plate detector with model {}", modelPath);
                return new OpenCvYoloDetector(detector);
            }
            log.warn("YOLO model file {} not found. Falling back to whole image detection.", modelPath);
        } else {
            log.info("Using fallback plate detector. Configure plate-reader.detector.model-path for YOLO based detection.");
        }
        return new WholeImagePlateDetector();
    }
}
