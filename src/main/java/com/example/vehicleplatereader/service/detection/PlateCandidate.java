package com.example.vehicleplatereader.service.detection;

import com.example.vehicleplatereader.model.BoundingBox;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scored plate box produced by a model before suppression.
 */
public record PlateCandidate(BoundingBox boundingBox, double confidence) {

    /**
     * Greedy non-maximum suppression. The result is ordered by descending confidence.
     */
    public static List<PlateCandidate> suppressOverlaps(List<PlateCandidate> candidates, double threshold) {
        List<PlateCandidate> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.comparingDouble(PlateCandidate::confidence).reversed());
        List<PlateCandidate> kept = new ArrayList<>();
        for (PlateCandidate candidate : ordered) {
            boolean overlaps = false;
            for (PlateCandidate accepted : kept) {
                if (intersectionOverUnion(accepted.boundingBox(), candidate.boundingBox()) > threshold) {
                    overlaps = true;
                    break;
                }
            }
            if (!overlaps) {
                kept.add(candidate);
            }
        }
        return kept;
    }

    static double intersectionOverUnion(BoundingBox a, BoundingBox b) {
        int x1 = Math.max(a.x(), b.x());
        int y1 = Math.max(a.y(), b.y());
        int x2 = Math.min(a.x() + a.width(), b.x() + b.width());
        int y2 = Math.min(a.y() + a.height(), b.y() + b.height());
        long intersection = (long) Math.max(0, x2 - x1) * Math.max(0, y2 - y1);
        long union = a.area() + b.area() - intersection;
        if (union <= 0) {
            return 0d;
        }
        return intersection / (double) union;
    }
}
