package com.creditintel.backend.exception;

import java.util.List;

public class ModelNotFoundException extends CreditIntelligenceException {

    public ModelNotFoundException(long versionId) {
        super(ErrorKind.MODEL_NOT_FOUND, null, "Model version " + versionId + " not found", List.of());
    }
}
