package com.example.vehicleplatereader.service.extraction;

/**
 * Sends an {@link ExtractionRequest} to the external text extraction service.
 * Implementations return the reply uninterpreted and signal transport problems
 * with {@link ExtractionException}.
 */
public interface ExtractionClient {

    RawExtractionReply extract(ExtractionRequest request);
}
