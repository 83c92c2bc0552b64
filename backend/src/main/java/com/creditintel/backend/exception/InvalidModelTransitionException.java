package com.creditintel.backend.exception;

import com.creditintel.backend.pipeline.ModelStatus;

import java.util.List;

public class InvalidModelTransitionException extends CreditIntelligenceException {

    public InvalidModelTransitionException(long versionId, ModelStatus from, ModelStatus to) {
        super(ErrorKind.INVALID_TRANSITION, null,
                "Model " + versionId + " cannot move from " + from + " to " + to, List.of(from + "->" + to));
    }
}
