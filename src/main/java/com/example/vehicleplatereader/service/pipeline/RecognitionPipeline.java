package com.example.vehicleplatereader.service.pipeline;

import com.example.vehicleplatereader.service.RecognitionError;
import com.example.vehicleplatereader.service.detection.DetectionOutcome;
import com.example.vehicleplatereader.service.detection.PlateDetectionInvoker;
import com.example.vehicleplatereader.service.extraction.ExtractionClient;
import com.example.vehicleplatereader.service.extraction.ExtractionException;
import com.example.vehicleplatereader.service.extraction.ExtractionRequest;
import com.example.vehicleplatereader.service.extraction.ExtractionRequestBuilder;
import com.example.vehicleplatereader.service.extraction.RawExtractionReply;
import com.example.vehicleplatereader.service.intake.ImageSubmission;
import com.example.vehicleplatereader.service.intake.RequestArtifacts;
import com.example.vehicleplatereader.service.intake.UploadStorage;
import com.example.vehicleplatereader.service.parser.ExtractionReplyParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Runs detect, extract and parse for one validated submission. Every stage ends
 * in a {@link RecognitionOutcome}; temporary files are released on all paths.
 */
@Service
public class RecognitionPipeline {

    private static final Logger log = LoggerFactory.getLogger(RecognitionPipeline.class);

    static final String NO_PLATE_MESSAGE =
            "The image may not contain a visible license plate. Try a different image with a clearer license plate.";

    private final UploadStorage storage;
    private final PlateDetectionInvoker detectionInvoker;
    private final ExtractionRequestBuilder requestBuilder;
    private final ExtractionClient extractionClient;
    private final ExtractionReplyParser parser;
    private final ResultAssembler assembler;

    public RecognitionPipeline(UploadStorage storage,
                               PlateDetectionInvoker detectionInvoker,
                               ExtractionRequestBuilder requestBuilder,
                               ExtractionClient extractionClient,
                               ExtractionReplyParser parser,
                               ResultAssembler assembler) {
        this.storage = storage;
        this.detectionInvoker = detectionInvoker;
        this.requestBuilder = requestBuilder;
        this.extractionClient = extractionClient;
        this.parser = parser;
        this.assembler = assembler;
    }

    public ApiResult recognize(ImageSubmission submission) {
        try (RequestArtifacts artifacts = storage.openScope()) {
            RecognitionOutcome outcome;
            try {
                outcome = run(submission, artifacts);
            } catch (ExtractionException ex) {
                outcome = RecognitionOutcome.failure(ex.error(), ex.getMessage());
            } catch (RuntimeException ex) {
                log.error("Recognition of {} failed unexpectedly", submission.sanitizedFilename(), ex);
                outcome = RecognitionOutcome.failure(RecognitionError.INTERNAL_ERROR,
                        "Error during license plate recognition: " + ex.getMessage());
            }
            return assembler.assemble(outcome, artifacts);
        }
    }

    private RecognitionOutcome run(ImageSubmission submission, RequestArtifacts artifacts) {
        Path upload = artifacts.store(submission);
        log.debug("Processing image {} ({} bytes)", submission.sanitizedFilename(), submission.size());

        DetectionOutcome detection = detectionInvoker.invoke(upload);
        if (!detection.isFound()) {
            artifacts.delete(upload);
            log.info("No licence plate detected in {}", submission.sanitizedFilename());
            return RecognitionOutcome.failure(RecognitionError.NO_PLATE_DETECTED, NO_PLATE_MESSAGE);
        }

        Path plateArtifact = artifacts.allocate("plate-", "." + submission.extension());
        ExtractionRequest request = requestBuilder.build(detection.plate(), plateArtifact);
        RawExtractionReply reply = extractionClient.extract(request);

        return parser.parse(reply.content())
                .map(plate -> RecognitionOutcome.success(plate, request.model(), reply.usage()))
                .orElseGet(() -> {
                    log.warn("Could not recover a JSON object from the extraction reply for {}",
                            submission.sanitizedFilename());
                    return RecognitionOutcome.parseFailure(reply.content(), request.model(), reply.usage());
                });
    }
}
