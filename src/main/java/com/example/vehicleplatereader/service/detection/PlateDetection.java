package com.example.vehicleplatereader.service.detection;

import com.example.vehicleplatereader.model.BoundingBox;

import java.awt.image.BufferedImage;

/**
 * Raw detector output.
 *
 * @param plate     cropped plate, {@code null} when nothing was found
 * @param context   decoded source image, {@code null} when it could not be decoded
 * @param topOffset y coordinate of the crop inside the source image
 * @param region    crop rectangle, may be {@code null} when the detector does not report one
 */
public record PlateDetection(BufferedImage plate, BufferedImage context, int topOffset, BoundingBox region) {

    public static PlateDetection nothing(BufferedImage context) {
        return new PlateDetection(null, context, 0, null);
    }
}
