package com.example.vehicleplatereader.service.detection;

import com.example.vehicleplatereader.config.PlateReaderProperties;
import com.example.vehicleplatereader.model.BoundingBox;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts raw YOLO output rows ({@code cx, cy, w, h, objectness, class scores...}),
 * expressed in model input coordinates, into image-space plate candidates.
 */
final class YoloOutputDecoder {

    private YoloOutputDecoder() {
    }

    /**
     * @return candidates above the confidence threshold after non-maximum suppression, best first
     */
    static List<PlateCandidate> decode(float[] data, int rowCount, int channels, int imageWidth, int imageHeight,
                                       PlateReaderProperties.Detector settings) {
        int inputSize = settings.inputSize();
        float xFactor = imageWidth / (float) inputSize;
        float yFactor = imageHeight / (float) inputSize;
        int classCount = channels - 5;

        List<PlateCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < rowCount; i++) {
            int offset = i * channels;
            float confidence = data[offset + 4];
            if (classCount > 0) {
                float maxClassScore = 0f;
                for (int c = 0; c < classCount; c++) {
                    maxClassScore = Math.max(maxClassScore, data[offset + 5 + c]);
                }
                confidence *= maxClassScore;
            }
            if (confidence < settings.confThreshold()) {
                continue;
            }

            float cx = data[offset];
            float cy = data[offset + 1];
            float w = data[offset + 2];
            float h = data[offset + 3];
            int left = clamp(Math.round((cx - w / 2f) * xFactor), 0, imageWidth - 1);
            int top = clamp(Math.round((cy - h / 2f) * yFactor), 0, imageHeight - 1);
            int width = clamp(Math.round(w * xFactor), 1, imageWidth - left);
            int height = clamp(Math.round(h * yFactor), 1, imageHeight - top);
            candidates.add(new PlateCandidate(new BoundingBox(left, top, width, height), confidence));
        }
        return PlateCandidate.suppressOverlaps(candidates, settings.nmsThreshold());
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
