package com.example.vehicleplatereader.service.detection;

import com.example.vehicleplatereader.TestFixtures;
import com.example.vehicleplatereader.model.BoundingBox;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class WholeImagePlateDetectorTest {

    @TempDir
    Path directory;

    private final WholeImagePlateDetector detector = new WholeImagePlateDetector();

    @Test
    void wholeImageIsReturnedAsPlate() throws IOException {
        Path image = Files.write(directory.resolve("car.png"), TestFixtures.pngBytes());

        PlateDetection detection = detector.detect(image);

        assertThat(detection.plate()).isNotNull();
        assertThat(detection.region()).isEqualTo(new BoundingBox(0, 0, 200, 100));
        assertThat(detection.topOffset()).isZero();
    }

    @Test
    void undecodableImageYieldsNoPlate() throws IOException {
        Path image = Files.write(directory.resolve("broken.jpg"), new byte[] {0, 1, 2, 3});

        PlateDetection detection = detector.detect(image);

        assertThat(detection.plate()).isNull();
        assertThat(detection.context()).isNull();
    }
}
