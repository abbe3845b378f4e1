package com.example.vehicleplatereader.service.detection;

import com.example.vehicleplatereader.TestFixtures;
import com.example.vehicleplatereader.config.PlateReaderProperties;
import com.example.vehicleplatereader.model.BoundingBox;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Needs a YOLO ONNX model, pointed to by {@code PLATE_DETECTOR_MODEL}.
 */
@EnabledIfEnvironmentVariable(named = "PLATE_DETECTOR_MODEL", matches = ".+\\.onnx")
class OpenCvYoloDetectorConcurrencyTest {

    @TempDir
    Path images;

    @Test
    void concurrentDetectionsMatchSequentialOnes() throws Exception {
        OpenCvYoloDetector detector = new OpenCvYoloDetector(
                new PlateReaderProperties.Detector(System.getenv("PLATE_DETECTOR_MODEL"), 640, 0.25, 0.45));
        Path small = write("small.png", TestFixtures.plateImage());
        Path wide = write("wide.png", widePlate());
        BoundingBox expectedSmall = detector.detect(small).region();
        BoundingBox expectedWide = detector.detect(wide).region();

        int tasks = 16;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<BoundingBox>> futures = new ArrayList<>();
            for (int i = 0; i < tasks; i++) {
                Path image = i % 2 == 0 ? small : wide;
                Callable<BoundingBox> task = () -> {
                    start.await();
                    return detector.detect(image).region();
                };
                futures.add(executor.submit(task));
            }
            start.countDown();
            for (int i = 0; i < tasks; i++) {
                assertThat(futures.get(i).get(60, TimeUnit.SECONDS)).isEqualTo(i % 2 == 0 ? expectedSmall : expectedWide);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private Path write(String name, BufferedImage image) throws Exception {
        return Files.write(images.resolve(name), TestFixtures.encode(image, "png"));
    }

    private static BufferedImage widePlate() {
        BufferedImage plate = TestFixtures.plateImage();
        BufferedImage canvas = new BufferedImage(800, 600, BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D graphics = canvas.createGraphics();
        try {
            graphics.drawImage(plate, 500, 400, null);
        } finally {
            graphics.dispose();
        }
        return canvas;
    }
}
