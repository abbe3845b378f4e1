package com.example.vehicleplatereader.service.pipeline;

import com.example.vehicleplatereader.model.RecognitionResponse;
import com.example.vehicleplatereader.model.TokenUsage;
import com.example.vehicleplatereader.service.RecognitionError;
import com.example.vehicleplatereader.service.intake.RequestArtifacts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Builds the final {@link ApiResult} and releases the request's temporary files.
 */
@Component
public class ResultAssembler {

    private static final Logger log = LoggerFactory.getLogger(ResultAssembler.class);

    public ApiResult assemble(RecognitionOutcome outcome, RequestArtifacts artifacts) {
        int released = artifacts.release();
        log.debug("Released {} artifact(s) before responding", released);

        if (outcome.isSuccess()) {
            TokenUsage usage = outcome.usage() != null ? outcome.usage() : TokenUsage.empty();
            return new ApiResult(HttpStatus.OK, RecognitionResponse.success(outcome.plate(), outcome.model(), usage));
        }
        RecognitionError error = outcome.error();
        return new ApiResult(error.status(), RecognitionResponse.failure(error, outcome.message(), outcome.rawContent()));
    }
}
