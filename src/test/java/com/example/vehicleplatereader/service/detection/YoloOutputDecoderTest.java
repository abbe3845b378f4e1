package com.example.vehicleplatereader.service.detection;

import com.example.vehicleplatereader.config.PlateReaderProperties;
import com.example.vehicleplatereader.model.BoundingBox;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class YoloOutputDecoderTest {

    private static final PlateReaderProperties.Detector SETTINGS = new PlateReaderProperties.Detector(null, 640, 0.25, 0.45);

    @Test
    void rowsAreScaledToImageCoordinatesAndOrderedByConfidence() {
        float[] data = {
                320, 320, 100, 40, 0.9f, 1.0f,
                320, 320, 100, 40, 0.9f, 0.1f,
                10, 10, 100, 100, 1.0f, 1.0f
        };

        List<PlateCandidate> candidates = YoloOutputDecoder.decode(data, 3, 6, 1280, 640, SETTINGS);

        assertThat(candidates).extracting(PlateCandidate::boundingBox)
                .containsExactly(new BoundingBox(0, 0, 200, 100), new BoundingBox(540, 300, 200, 40));
    }

    @Test
    void objectnessAloneIsUsedWithoutClassScores() {
        float[] data = {320, 320, 64, 32, 0.3f};

        List<PlateCandidate> candidates = YoloOutputDecoder.decode(data, 1, 5, 640, 640, SETTINGS);

        assertThat(candidates).singleElement()
                .satisfies(candidate -> assertThat(candidate.boundingBox()).isEqualTo(new BoundingBox(288, 304, 64, 32)));
    }

    @Test
    void nothingAboveThresholdYieldsNoCandidates() {
        float[] data = {320, 320, 64, 32, 0.1f, 0.9f};

        assertThat(YoloOutputDecoder.decode(data, 1, 6, 640, 640, SETTINGS)).isEmpty();
    }
}
