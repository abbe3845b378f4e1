package com.example.vehicleplatereader.service.detection;

import com.example.vehicleplatereader.model.BoundingBox;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Detection stage result. {@code plate} and {@code region} are set only when the
 * status is {@link Status#FOUND}.
 */
public record DetectionOutcome(Status status, BufferedImage plate, BoundingBox region) {

    public enum Status {
        FOUND,
        NOT_FOUND
    }

    private static final DetectionOutcome NOT_FOUND = new DetectionOutcome(Status.NOT_FOUND, null, null);

    public DetectionOutcome {
        Objects.requireNonNull(status, "status");
        if (status == Status.FOUND) {
            Objects.requireNonNull(plate, "plate");
            Objects.requireNonNull(region, "region");
        }
    }

    public static DetectionOutcome found(BufferedImage plate, BoundingBox region) {
        return new DetectionOutcome(Status.FOUND, plate, region);
    }

    public static DetectionOutcome notFound() {
        return NOT_FOUND;
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }
}
