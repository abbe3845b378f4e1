package com.example.vehicleplatereader.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Plate region inside the source image, in pixels with the origin in the
 * top-left corner. A zero-sized box is allowed and means nothing usable was found.
 */
@Schema(description = "Axis-aligned rectangle describing a detected plate region")
public record BoundingBox(
        @Schema(description = "X coordinate of the top-left corner", example = "42") int x,
        @Schema(description = "Y coordinate of the top-left corner", example = "128") int y,
        @Schema(description = "Bounding box width in pixels", example = "180") int width,
        @Schema(description = "Bounding box height in pixels", example = "60") int height) {

    public BoundingBox {
        if (width < 0) {
            throw new IllegalArgumentException("Bounding box width must not be negative");
        }
        if (height < 0) {
            throw new IllegalArgumentException("Bounding box height must not be negative");
        }
    }

    public long area() {
        return (long) width * height;
    }

    public boolean isEmpty() {
        return area() == 0;
    }
}
