package com.creditintel.backend.exception;

import java.util.List;

public class TrainingException extends CreditIntelligenceException {

    public TrainingException(String message) {
        super(ErrorKind.TRAINING, null, message, List.of());
    }

    public TrainingException(String message, Throwable cause) {
        super(ErrorKind.TRAINING, null, message, cause);
    }
}
