package com.example.vehicleplatereader.service.detection;

import com.example.vehicleplatereader.model.BoundingBox;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlateDetectionInvokerTest {

    private static final Path IMAGE = Path.of("upload-1-car.jpg");

    @Mock
    private PlateDetector detector;

    private PlateDetectionInvoker invoker;

    @BeforeEach
    void setUp() {
        invoker = new PlateDetectionInvoker(detector);
    }

    @Test
    void cropWithRegionIsFound() {
        BufferedImage crop = new BufferedImage(120, 40, BufferedImage.TYPE_3BYTE_BGR);
        BoundingBox region = new BoundingBox(10, 200, 120, 40);
        when(detector.detect(IMAGE)).thenReturn(new PlateDetection(crop, null, 200, region));

        DetectionOutcome outcome = invoker.invoke(IMAGE);

        assertThat(outcome.isFound()).isTrue();
        assertThat(outcome.plate()).isSameAs(crop);
        assertThat(outcome.region()).isEqualTo(region);
    }

    @Test
    void missingRegionIsDerivedFromCropAndTopOffset() {
        BufferedImage crop = new BufferedImage(80, 30, BufferedImage.TYPE_3BYTE_BGR);
        when(detector.detect(IMAGE)).thenReturn(new PlateDetection(crop, null, 55, null));

        DetectionOutcome outcome = invoker.invoke(IMAGE);

        assertThat(outcome.region()).isEqualTo(new BoundingBox(0, 55, 80, 30));
    }

    @Test
    void nullCropIsNotFound() {
        when(detector.detect(IMAGE)).thenReturn(PlateDetection.nothing(null));

        assertThat(invoker.invoke(IMAGE).status()).isEqualTo(DetectionOutcome.Status.NOT_FOUND);
    }

    @Test
    void nullDetectionIsNotFound() {
        when(detector.detect(IMAGE)).thenReturn(null);

        assertThat(invoker.invoke(IMAGE).isFound()).isFalse();
    }

    @Test
    void zeroAreaRegionIsNotFound() {
        BufferedImage crop = new BufferedImage(80, 30, BufferedImage.TYPE_3BYTE_BGR);
        when(detector.detect(IMAGE)).thenReturn(new PlateDetection(crop, null, 0, new BoundingBox(5, 5, 0, 30)));

        DetectionOutcome outcome = invoker.invoke(IMAGE);

        assertThat(outcome.isFound()).isFalse();
        assertThat(outcome.plate()).isNull();
        assertThat(outcome.region()).isNull();
    }
}
