package com.example.vehicleplatereader.service.detection;

import com.example.vehicleplatereader.config.PlateReaderProperties;
import com.example.vehicleplatereader.model.BoundingBox;
import nu.pattern.OpenCV;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.dnn.Dnn;
import org.opencv.dnn.Net;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Plate detector backed by a YOLO model exported to ONNX and executed with the
 * OpenCV DNN module. The highest scoring box left after non-maximum suppression
 * is cropped out of the source image.
 */
public class OpenCvYoloDetector implements PlateDetector {

    private static final Logger log = LoggerFactory.getLogger(OpenCvYoloDetector.class);

    static {
        OpenCV.loadLocally();
        log.info("Loaded OpenCV native libraries");
    }

    private final PlateReaderProperties.Detector settings;
    private final Object networkLock = new Object();
    private final Object inferenceLock = new Object();
    private volatile Net network;

    public OpenCvYoloDetector(PlateReaderProperties.Detector settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public PlateDetection detect(Path imagePath) {
        BufferedImage image;
        try {
            image = ImageIO.read(imagePath.toFile());
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read image " + imagePath.getFileName(), ex);
        }
        if (image == null) {
            log.debug("Image {} could not be decoded", imagePath.getFileName());
            return PlateDetection.nothing(null);
        }

        List<PlateCandidate> candidates = locate(image);
        if (candidates.isEmpty()) {
            return PlateDetection.nothing(image);
        }
        PlateCandidate best = candidates.get(0);
        BoundingBox box = best.boundingBox();
        log.debug("Best plate candidate {} with confidence {}", box, best.confidence());
        BufferedImage crop = image.getSubimage(box.x(), box.y(), box.width(), box.height());
        return new PlateDetection(crop, image, box.y(), box);
    }

    private List<PlateCandidate> locate(BufferedImage image) {
        Net net = ensureNetwork();
        int inputSize = settings.inputSize();
        Mat source = bufferedImageToMat(image);
        Mat blob = Dnn.blobFromImage(source, 1.0 / 255.0, new Size(inputSize, inputSize), new Scalar(0, 0, 0), true, false);
        Mat rawResult = null;
        Mat rows = null;
        try {
            float[] data;
            // Net keeps its input and output buffers internally
            synchronized (inferenceLock) {
                net.setInput(blob);
                rawResult = net.forward();
                rows = rawResult.reshape(1, (int) rawResult.size(1));
                data = new float[(int) (rows.total() * rows.channels())];
                rows.get(0, 0, data);
            }
            return YoloOutputDecoder.decode(data, rows.rows(), rows.cols(), image.getWidth(), image.getHeight(), settings);
        } finally {
            blob.release();
            source.release();
            if (rows != null) {
                rows.release();
            }
            if (rawResult != null) {
                rawResult.release();
            }
        }
    }

    private Net ensureNetwork() {
        Net current = network;
        if (current != null) {
            return current;
        }
        synchronized (networkLock) {
            if (network == null) {
                String modelPath = settings.modelPath();
                if (modelPath == null || modelPath.isBlank()) {
                    throw new IllegalStateException("Detector model path must be configured");
                }
                log.info("Loading YOLO model from {}", Path.of(modelPath).toAbsolutePath());
                network = Dnn.readNetFromONNX(modelPath);
            }
            return network;
        }
    }

    private Mat bufferedImageToMat(BufferedImage image) {
        BufferedImage converted = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D graphics = converted.createGraphics();
        try {
            graphics.drawImage(image, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        byte[] data = ((DataBufferByte) converted.getRaster().getDataBuffer()).getData();
        Mat mat = new Mat(image.getHeight(), image.getWidth(), CvType.CV_8UC3);
        mat.put(0, 0, data);
        return mat;
    }
}
